package com.nosota.welfare.api.model;

/**
 * Cadence of a recurring payment schedule, expressed in calendar months.
 */
public enum PaymentPeriod {
    MONTHLY(1),
    QUARTERLY(3),
    SEMI_ANNUALLY(6),
    ANNUALLY(12);

    private final int months;

    PaymentPeriod(int months) {
        this.months = months;
    }

    public int getMonths() {
        return months;
    }
}
