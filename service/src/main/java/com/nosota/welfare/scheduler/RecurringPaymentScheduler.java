package com.nosota.welfare.scheduler;

import com.nosota.welfare.api.response.OverdueSweepResult;
import com.nosota.welfare.service.RecurringPaymentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled overdue sweep of recurring payment installments.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   recurring-payment:
 *     enabled: true                 # enable/disable scheduler
 *     sweep-cron: "0 0 1 * * *"     # daily at 01:00
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.recurring-payment.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class RecurringPaymentScheduler {

    private final RecurringPaymentService recurringPaymentService;

    /**
     * Promotes pending installments to DUE or OVERDUE by due date.
     *
     * <p>The sweep is idempotent, so a run repeated by another instance changes nothing.
     */
    @Scheduled(cron = "${scheduler.recurring-payment.sweep-cron:0 0 1 * * *}")
    public void sweepOverduePayments() {
        log.info("Starting scheduled job: recurring payment overdue sweep");

        try {
            OverdueSweepResult result = recurringPaymentService.computeOverdueStatuses();

            if (result.updatedCount() > 0) {
                log.info("Overdue sweep finished: {} overdue, {} due", result.overdueCount(), result.dueCount());
            } else {
                log.debug("Overdue sweep finished: no installments changed");
            }

        } catch (Exception e) {
            log.error("Failed to run recurring payment overdue sweep: {}", e.getMessage(), e);
        }
    }
}
