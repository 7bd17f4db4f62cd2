package com.nosota.welfare.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One phase of a distribution timeline decided at approval time.
 */
public record DistributionPhaseRequest(
        @NotBlank
        String description,

        @NotNull @Positive
        BigDecimal amount,

        @NotNull
        LocalDate expectedDate
) {
}
