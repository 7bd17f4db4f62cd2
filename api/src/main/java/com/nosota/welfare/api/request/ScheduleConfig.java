package com.nosota.welfare.api.request;

import com.nosota.welfare.api.model.PaymentPeriod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.util.List;

/**
 * Configuration of a recurring payment schedule.
 *
 * @param period           Cadence between cycles
 * @param numberOfPayments Number of cycles (1..60)
 * @param amountPerPayment Amount of each installment. May be omitted when the application
 *                         carries a distribution timeline, whose phase amounts are used instead
 * @param startDate        Date of the first installment, ISO format {@code yyyy-MM-dd}
 * @param customAmounts    Optional per-installment overrides of amount and description
 */
public record ScheduleConfig(
        @NotNull(message = "Period is required")
        PaymentPeriod period,

        @NotNull(message = "Number of payments is required")
        @Min(value = 1, message = "Number of payments must be at least 1")
        @Max(value = 60, message = "Number of payments must not exceed 60")
        Integer numberOfPayments,

        @Positive(message = "Amount per payment must be positive")
        BigDecimal amountPerPayment,

        @NotBlank(message = "Start date is required")
        String startDate,

        @Valid
        List<CustomAmount> customAmounts
) {
    public ScheduleConfig(PaymentPeriod period, Integer numberOfPayments,
                          BigDecimal amountPerPayment, String startDate) {
        this(period, numberOfPayments, amountPerPayment, startDate, List.of());
    }
}
