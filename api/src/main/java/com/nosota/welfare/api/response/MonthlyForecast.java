package com.nosota.welfare.api.response;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Pending disbursements scheduled within one calendar month. The first month of a
 * forecast also carries pending installments scheduled before it.
 *
 * @param month          Calendar month
 * @param totalAmount    Sum of pending installment amounts
 * @param paymentCount   Number of pending installments
 * @param overdueCount   Installments already overdue
 * @param scheduledCount Installments not yet overdue
 */
public record MonthlyForecast(
        YearMonth month,
        BigDecimal totalAmount,
        int paymentCount,
        int overdueCount,
        int scheduledCount
) {
}
