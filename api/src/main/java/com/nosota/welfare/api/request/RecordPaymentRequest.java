package com.nosota.welfare.api.request;

import com.nosota.welfare.api.model.PaymentMethod;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request to record an installment as paid.
 *
 * @param amount               Paid amount; defaults to the installment amount when omitted
 * @param method               Payment method
 * @param transactionReference Bank/UPI reference of the transfer
 * @param paymentDate          Actual payment date; defaults to today when omitted
 * @param notes                Free-form notes
 */
public record RecordPaymentRequest(
        @Positive(message = "Amount must be positive")
        BigDecimal amount,

        @NotNull(message = "Payment method is required")
        PaymentMethod method,

        @Size(max = 100)
        String transactionReference,

        LocalDate paymentDate,

        @Size(max = 1000)
        String notes
) {
}
