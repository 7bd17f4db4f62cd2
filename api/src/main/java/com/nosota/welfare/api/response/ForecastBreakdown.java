package com.nosota.welfare.api.response;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Forecast total for one scheme or project. {@code id} is {@code null} for
 * installments without a project.
 */
public record ForecastBreakdown(
        UUID id,
        BigDecimal totalAmount,
        int count
) {
}
