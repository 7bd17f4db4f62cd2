package com.nosota.welfare.service;

import com.nosota.welfare.api.model.RecurringPaymentStatus;
import com.nosota.welfare.api.request.ForecastFilter;
import com.nosota.welfare.api.response.BudgetForecastResponse;
import com.nosota.welfare.api.response.DashboardStatsResponse;
import com.nosota.welfare.api.response.ForecastBreakdown;
import com.nosota.welfare.api.response.ForecastSummary;
import com.nosota.welfare.api.response.MonthlyForecast;
import com.nosota.welfare.api.response.RecurringPaymentResponse;
import com.nosota.welfare.error.ValidationException;
import com.nosota.welfare.mapper.RecurringPaymentMapper;
import com.nosota.welfare.model.RecurringPayment;
import com.nosota.welfare.repository.RecurringPaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.*;
import java.util.function.Function;

import static com.nosota.welfare.repository.RecurringPaymentSpecifications.*;

/**
 * Read-side aggregations over recurring payments: budget forecast, upcoming and
 * overdue lists, dashboard statistics. Nothing here changes state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecurringPaymentForecastService {

    /**
     * Installments that still represent money to be disbursed.
     */
    static final Set<RecurringPaymentStatus> FORECAST_STATUSES = EnumSet.of(
            RecurringPaymentStatus.SCHEDULED,
            RecurringPaymentStatus.DUE,
            RecurringPaymentStatus.OVERDUE,
            RecurringPaymentStatus.PROCESSING
    );

    private static final Set<RecurringPaymentStatus> UPCOMING_STATUSES = EnumSet.of(
            RecurringPaymentStatus.SCHEDULED,
            RecurringPaymentStatus.DUE
    );

    private static final Set<RecurringPaymentStatus> UNPAID_STATUSES = EnumSet.of(
            RecurringPaymentStatus.SCHEDULED,
            RecurringPaymentStatus.DUE,
            RecurringPaymentStatus.OVERDUE
    );

    private static final int DASHBOARD_OVERDUE_LIMIT = 10;
    private static final int DEFAULT_MAX_FORECAST_MONTHS = 120;

    private final RecurringPaymentRepository recurringPaymentRepository;
    private final Clock clock;

    @Value("${recurring-payment.max-forecast-months:120}")
    private int maxForecastMonths = DEFAULT_MAX_FORECAST_MONTHS;

    /**
     * Forecasts pending disbursements over {@code months} calendar months, starting with
     * the current one.
     *
     * <p>Every month of the window appears in the result, with zeros when nothing is
     * scheduled. Completed, failed, skipped and cancelled installments are excluded.
     * Pending installments scheduled before the current month are still owed; they are
     * counted in the first month.
     *
     * @param months Number of months, between 1 and {@code recurring-payment.max-forecast-months}
     * @param filter Optional scheme/project/region restriction
     * @return Monthly totals, window summary and per-scheme/per-project breakdowns
     * @throws ValidationException if {@code months} is out of range
     */
    public BudgetForecastResponse getBudgetForecast(int months, ForecastFilter filter) {
        if (months < 1 || months > maxForecastMonths) {
            throw new ValidationException("months", "must be between 1 and " + maxForecastMonths);
        }

        YearMonth firstMonth = YearMonth.now(clock);
        YearMonth lastMonth = firstMonth.plusMonths(months - 1L);

        List<RecurringPayment> payments = recurringPaymentRepository.findAll(
                Specification.where(statusIn(FORECAST_STATUSES))
                        .and(scheduledOnOrBefore(lastMonth.atEndOfMonth()))
                        .and(matching(filter)));

        Map<YearMonth, Tally> byMonth = new LinkedHashMap<>();
        for (YearMonth month = firstMonth; !month.isAfter(lastMonth); month = month.plusMonths(1)) {
            byMonth.put(month, new Tally());
        }

        BigDecimal total = BigDecimal.ZERO;
        BigDecimal overdueTotal = BigDecimal.ZERO;
        int overdueCount = 0;

        for (RecurringPayment payment : payments) {
            YearMonth scheduled = YearMonth.from(payment.getScheduledDate());
            Tally month = byMonth.get(scheduled.isBefore(firstMonth) ? firstMonth : scheduled);
            if (month == null) {
                continue;
            }
            boolean overdue = payment.getStatus() == RecurringPaymentStatus.OVERDUE;
            month.add(payment.getAmount(), overdue);

            total = total.add(payment.getAmount());
            if (overdue) {
                overdueTotal = overdueTotal.add(payment.getAmount());
                overdueCount++;
            }
        }

        List<MonthlyForecast> monthly = new ArrayList<>(byMonth.size());
        byMonth.forEach((month, acc) -> monthly.add(
                new MonthlyForecast(month, acc.total, acc.count, acc.overdue, acc.count - acc.overdue)));

        ForecastSummary summary = new ForecastSummary(total, payments.size(), overdueTotal, overdueCount,
                average(total, payments.size()));

        log.debug("Budget forecast: months={}, installments={}, total={}", months, payments.size(), total);

        return new BudgetForecastResponse(summary, monthly,
                breakdown(payments, RecurringPayment::getSchemeId),
                breakdown(payments, RecurringPayment::getProjectId));
    }

    /**
     * SCHEDULED and DUE installments scheduled within the next {@code days} days, soonest first.
     */
    public List<RecurringPaymentResponse> getUpcomingPayments(int days, ForecastFilter filter) {
        if (days < 1) {
            throw new ValidationException("days", "must be at least 1");
        }

        LocalDate today = LocalDate.now(clock);
        List<RecurringPayment> payments = recurringPaymentRepository.findAll(
                Specification.where(statusIn(UPCOMING_STATUSES))
                        .and(scheduledBetween(today, today.plusDays(days)))
                        .and(matching(filter)),
                Sort.by("scheduledDate", "paymentNumber"));

        return RecurringPaymentMapper.INSTANCE.toResponseList(payments);
    }

    /**
     * Unpaid installments whose due date has passed, oldest first.
     *
     * <p>Includes installments the sweep has not promoted yet; their stored status is
     * left as it is.
     */
    public List<RecurringPaymentResponse> getOverduePayments(ForecastFilter filter) {
        LocalDate today = LocalDate.now(clock);
        List<RecurringPayment> payments = recurringPaymentRepository.findAll(
                Specification.where(statusIn(UNPAID_STATUSES))
                        .and(dueBefore(today))
                        .and(matching(filter)),
                Sort.by("dueDate", "paymentNumber"));

        return RecurringPaymentMapper.INSTANCE.toResponseList(payments);
    }

    public DashboardStatsResponse getDashboardStats(ForecastFilter filter) {
        LocalDate today = LocalDate.now(clock);
        LocalDate in7Days = today.plusDays(7);
        LocalDate in30Days = today.plusDays(30);

        List<RecurringPayment> payments = recurringPaymentRepository.findAll(
                Specification.where(matching(filter)));

        Map<RecurringPaymentStatus, Long> byStatus = new EnumMap<>(RecurringPaymentStatus.class);
        BigDecimal totalAmount = BigDecimal.ZERO;
        BigDecimal completedAmount = BigDecimal.ZERO;
        BigDecimal pendingAmount = BigDecimal.ZERO;
        int upcoming7 = 0;
        int upcoming30 = 0;
        List<RecurringPayment> overdue = new ArrayList<>();

        for (RecurringPayment payment : payments) {
            RecurringPaymentStatus status = payment.getStatus();
            byStatus.merge(status, 1L, Long::sum);

            if (status != RecurringPaymentStatus.CANCELLED) {
                totalAmount = totalAmount.add(payment.getAmount());
            }
            if (status == RecurringPaymentStatus.COMPLETED) {
                completedAmount = completedAmount.add(
                        payment.getPaidAmount() != null ? payment.getPaidAmount() : payment.getAmount());
            }
            if (FORECAST_STATUSES.contains(status)) {
                pendingAmount = pendingAmount.add(payment.getAmount());
            }
            if (status == RecurringPaymentStatus.OVERDUE) {
                overdue.add(payment);
            }

            if (UPCOMING_STATUSES.contains(status) && !payment.getScheduledDate().isBefore(today)) {
                if (!payment.getScheduledDate().isAfter(in7Days)) {
                    upcoming7++;
                }
                if (!payment.getScheduledDate().isAfter(in30Days)) {
                    upcoming30++;
                }
            }
        }

        overdue.sort(Comparator.comparing(RecurringPayment::getDueDate));
        List<RecurringPayment> topOverdue = overdue.subList(0, Math.min(DASHBOARD_OVERDUE_LIMIT, overdue.size()));

        return new DashboardStatsResponse(
                payments.size(),
                byStatus.getOrDefault(RecurringPaymentStatus.SCHEDULED, 0L),
                byStatus.getOrDefault(RecurringPaymentStatus.DUE, 0L),
                byStatus.getOrDefault(RecurringPaymentStatus.OVERDUE, 0L),
                byStatus.getOrDefault(RecurringPaymentStatus.COMPLETED, 0L),
                byStatus.getOrDefault(RecurringPaymentStatus.CANCELLED, 0L),
                upcoming7,
                upcoming30,
                totalAmount,
                completedAmount,
                pendingAmount,
                RecurringPaymentMapper.INSTANCE.toResponseList(topOverdue));
    }

    private static List<ForecastBreakdown> breakdown(List<RecurringPayment> payments,
                                                     Function<RecurringPayment, UUID> key) {
        Map<UUID, Tally> groups = new LinkedHashMap<>();
        for (RecurringPayment payment : payments) {
            groups.computeIfAbsent(key.apply(payment), k -> new Tally())
                    .add(payment.getAmount(), false);
        }

        List<ForecastBreakdown> result = new ArrayList<>(groups.size());
        groups.forEach((id, acc) -> result.add(new ForecastBreakdown(id, acc.total, acc.count)));
        result.sort(Comparator.comparing(ForecastBreakdown::totalAmount).reversed());
        return result;
    }

    private static BigDecimal average(BigDecimal total, int count) {
        return count == 0
                ? BigDecimal.ZERO
                : total.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
    }

    private static final class Tally {
        private BigDecimal total = BigDecimal.ZERO;
        private int count;
        private int overdue;

        void add(BigDecimal amount, boolean isOverdue) {
            total = total.add(amount);
            count++;
            if (isOverdue) {
                overdue++;
            }
        }
    }
}
