package com.nosota.welfare.api.response;

import java.math.BigDecimal;

public record ForecastSummary(
        BigDecimal totalAmount,
        int totalPayments,
        BigDecimal overdueAmount,
        int overduePayments,
        BigDecimal averagePayment
) {
}
