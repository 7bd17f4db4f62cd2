package com.nosota.welfare.api.response;

import java.math.BigDecimal;
import java.util.List;

/**
 * Aggregated view of recurring payments for the admin dashboard.
 */
public record DashboardStatsResponse(
        long totalPayments,
        long scheduled,
        long due,
        long overdue,
        long completed,
        long cancelled,
        int upcomingNext7Days,
        int upcomingNext30Days,
        BigDecimal totalAmount,
        BigDecimal completedAmount,
        BigDecimal pendingAmount,
        List<RecurringPaymentResponse> overdueList
) {
}
