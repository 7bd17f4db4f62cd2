package com.nosota.welfare.api.model;

/**
 * Kind of a single-shot payment record.
 */
public enum PaymentType {
    /**
     * Whole approved amount paid at once.
     */
    FULL_AMOUNT,

    /**
     * One phase of an application's distribution timeline.
     */
    INSTALLMENT,

    /**
     * Settlement of one recurring installment.
     */
    RECURRING
}
