package com.nosota.welfare.api.request;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial update of a pending installment. {@code null} fields are left unchanged.
 */
public record RecurringPaymentUpdateRequest(
        LocalDate scheduledDate,

        LocalDate dueDate,

        @Positive(message = "Amount must be positive")
        BigDecimal amount,

        @Size(max = 500)
        String description,

        @Size(max = 1000)
        String notes
) {
}
