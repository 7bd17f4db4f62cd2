package com.nosota.welfare.event;

import com.nosota.welfare.model.Application;
import com.nosota.welfare.repository.ApplicationRepository;
import com.nosota.welfare.service.PaymentService;
import com.nosota.welfare.service.RecurringPaymentService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;

/**
 * Materializes the payment plan of an approved application.
 *
 * <p>Runs after the approval has committed, in its own transaction: a recurring
 * configuration becomes a generated schedule, anything else becomes PENDING payments
 * (one per timeline phase, or one for the full amount). Applications that already
 * have payments or an active schedule are skipped, so replaying an event is harmless.
 *
 * <p>Failures are logged and not rethrown. The approval stays committed.
 */
@Component
@Slf4j
public class PaymentPlanListener {

    private final ApplicationRepository applicationRepository;
    private final RecurringPaymentService recurringPaymentService;
    private final PaymentService paymentService;
    private final TransactionTemplate transactionTemplate;

    public PaymentPlanListener(ApplicationRepository applicationRepository,
                               RecurringPaymentService recurringPaymentService,
                               PaymentService paymentService,
                               PlatformTransactionManager transactionManager) {
        this.applicationRepository = applicationRepository;
        this.recurringPaymentService = recurringPaymentService;
        this.paymentService = paymentService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onApplicationApproved(ApplicationApprovedEvent event) {
        try {
            transactionTemplate.executeWithoutResult(status -> createPaymentPlan(event));
        } catch (RuntimeException e) {
            log.error("Failed to create payment plan for application {}: {}",
                    event.applicationId(), e.getMessage(), e);
        }
    }

    private void createPaymentPlan(ApplicationApprovedEvent event) {
        UUID applicationId = event.applicationId();

        if (paymentService.hasPayments(applicationId) || recurringPaymentService.hasActiveSchedule(applicationId)) {
            log.info("Payment plan of application {} already exists, skipping", applicationId);
            return;
        }

        if (event.recurring() != null) {
            int installments = recurringPaymentService.generateSchedule(applicationId, event.recurring()).size();
            log.info("Recurring schedule created on approval: application={}, installments={}",
                    applicationId, installments);
            return;
        }

        Application application = applicationRepository.findById(applicationId).orElse(null);
        if (application == null) {
            log.warn("Approved application {} not found, no payment plan created", applicationId);
            return;
        }

        int payments = paymentService.createPlannedPayments(application).size();
        log.info("Payment plan created on approval: application={}, payments={}", applicationId, payments);
    }
}
