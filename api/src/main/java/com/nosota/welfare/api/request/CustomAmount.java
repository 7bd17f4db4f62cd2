package com.nosota.welfare.api.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * Override of a single installment within a simple recurring schedule.
 *
 * @param paymentNumber 1-based position of the installment
 * @param amount        Amount replacing {@code amountPerPayment}
 * @param description   Optional description replacing the generated one
 */
public record CustomAmount(
        @NotNull @Min(1)
        Integer paymentNumber,

        @NotNull @Positive
        BigDecimal amount,

        String description
) {
}
