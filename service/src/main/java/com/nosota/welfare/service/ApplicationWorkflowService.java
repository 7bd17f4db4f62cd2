package com.nosota.welfare.service;

import com.nosota.welfare.api.model.ApplicationStatus;
import com.nosota.welfare.api.model.ApprovalSource;
import com.nosota.welfare.api.request.ApprovalDecision;
import com.nosota.welfare.api.request.DistributionPhaseRequest;
import com.nosota.welfare.api.request.ScheduleConfig;
import com.nosota.welfare.error.InvalidStateException;
import com.nosota.welfare.error.RecordNotFoundException;
import com.nosota.welfare.error.ValidationException;
import com.nosota.welfare.event.ApplicationApprovedEvent;
import com.nosota.welfare.model.Application;
import com.nosota.welfare.model.DistributionPhase;
import com.nosota.welfare.model.RecurringConfig;
import com.nosota.welfare.repository.ApplicationRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Application status workflow up to approval, rejection and completion.
 *
 * <p>Approval stores the decided amount, distribution timeline and recurring settings,
 * then publishes {@link ApplicationApprovedEvent}; the payment plan is created from it
 * after the approval commits.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class ApplicationWorkflowService {

    /**
     * Targets reachable through {@link #advanceStatus}. Decisions have dedicated operations.
     */
    private static final Set<ApplicationStatus> PROCEDURAL_TARGETS = EnumSet.of(
            ApplicationStatus.UNDER_REVIEW,
            ApplicationStatus.INTERVIEW_SCHEDULED,
            ApplicationStatus.PENDING_COMMITTEE_APPROVAL,
            ApplicationStatus.CANCELLED
    );

    private final ApplicationRepository applicationRepository;
    private final ApplicationStatusStateMachine stateMachine;
    private final ScheduleCalculator scheduleCalculator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Moves an application through a procedural step: review, interview scheduling,
     * referral to the committee, or cancellation.
     */
    @Transactional
    public Application advanceStatus(@NotNull UUID applicationId, @NotNull ApplicationStatus target) {
        if (!PROCEDURAL_TARGETS.contains(target)) {
            throw new ValidationException("status", "use the dedicated operation for " + target);
        }

        Application application = getForUpdate(applicationId);
        ApplicationStatus previous = application.getStatus();
        stateMachine.validateTransition(previous, target);

        application.setStatus(target);
        application.setUpdatedAt(LocalDateTime.now(clock));
        application = applicationRepository.save(application);

        log.info("Application status changed: id={}, {} → {}", applicationId, previous, target);
        return application;
    }

    /**
     * Approves an application after a passed interview or a committee decision.
     *
     * @param applicationId Application to approve
     * @param decision      Amount, timeline, optional recurring schedule and source
     * @param approverId    Approving admin
     * @return The approved application
     * @throws ValidationException   if the decision is malformed or the timeline does not add up
     * @throws InvalidStateException if the application is not awaiting the given kind of decision
     */
    @Transactional
    public Application approveApplication(@NotNull UUID applicationId, ApprovalDecision decision,
                                          @NotNull UUID approverId) {
        validateDecision(decision);

        Application application = getForUpdate(applicationId);

        ApplicationStatus expected = decision.source() == ApprovalSource.INTERVIEW
                ? ApplicationStatus.INTERVIEW_SCHEDULED
                : ApplicationStatus.PENDING_COMMITTEE_APPROVAL;
        if (application.getStatus() != expected) {
            throw new InvalidStateException(
                    "Application in status " + application.getStatus() + " cannot be approved by " + decision.source());
        }
        stateMachine.validateTransition(application.getStatus(), ApplicationStatus.APPROVED);

        LocalDateTime now = LocalDateTime.now(clock);

        List<DistributionPhase> timeline = new ArrayList<>();
        if (decision.distributionTimeline() != null) {
            for (DistributionPhaseRequest phase : decision.distributionTimeline()) {
                timeline.add(new DistributionPhase(phase.description().trim(), phase.amount(), phase.expectedDate()));
            }
        }
        if (application.getDistributionTimeline() == null) {
            application.setDistributionTimeline(new ArrayList<>());
        }
        application.getDistributionTimeline().clear();
        application.getDistributionTimeline().addAll(timeline);

        ScheduleConfig recurring = decision.recurring();
        if (recurring != null) {
            RecurringConfig recurringConfig = new RecurringConfig();
            recurringConfig.setRecurring(true);
            recurringConfig.setPeriod(recurring.period());
            recurringConfig.setNumberOfPayments(recurring.numberOfPayments());
            recurringConfig.setAmountPerPayment(recurring.amountPerPayment());
            recurringConfig.setStartDate(LocalDate.parse(recurring.startDate().trim()));
            recurringConfig.setCompletedPayments(0);
            application.setRecurringConfig(recurringConfig);
        }

        application.setStatus(ApplicationStatus.APPROVED);
        application.setApprovedAmount(decision.approvedAmount());
        application.setApprovalSource(decision.source());
        application.setApprovedBy(approverId);
        application.setApprovedAt(now);
        application.setDecisionRemarks(decision.remarks());
        application.setUpdatedAt(now);

        application = applicationRepository.save(application);

        eventPublisher.publishEvent(new ApplicationApprovedEvent(applicationId, decision.source(), recurring));

        log.info("Application approved: id={}, source={}, amount={}, phases={}, recurring={}, by={}",
                applicationId, decision.source(), decision.approvedAmount(), timeline.size(),
                recurring != null, approverId);

        return application;
    }

    @Transactional
    public Application rejectApplication(@NotNull UUID applicationId, String reason, @NotNull UUID actorId) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "is required");
        }

        Application application = getForUpdate(applicationId);
        stateMachine.validateTransition(application.getStatus(), ApplicationStatus.REJECTED);

        application.setStatus(ApplicationStatus.REJECTED);
        application.setDecisionRemarks(reason.trim());
        application.setUpdatedAt(LocalDateTime.now(clock));
        application = applicationRepository.save(application);

        log.info("Application rejected: id={}, by={}", applicationId, actorId);
        return application;
    }

    @Transactional
    public Application completeApplication(@NotNull UUID applicationId) {
        Application application = getForUpdate(applicationId);
        stateMachine.validateTransition(application.getStatus(), ApplicationStatus.COMPLETED);

        application.setStatus(ApplicationStatus.COMPLETED);
        application.setUpdatedAt(LocalDateTime.now(clock));
        application = applicationRepository.save(application);

        log.info("Application completed: id={}", applicationId);
        return application;
    }

    private void validateDecision(ApprovalDecision decision) {
        if (decision == null) {
            throw new ValidationException("decision", "is required");
        }

        Map<String, String> errors = new LinkedHashMap<>();
        if (decision.source() == null) {
            errors.put("source", "is required");
        }
        if (decision.approvedAmount() == null || decision.approvedAmount().signum() <= 0) {
            errors.put("approvedAmount", "must be positive");
        }

        List<DistributionPhaseRequest> timeline = decision.distributionTimeline();
        boolean hasTimeline = timeline != null && !timeline.isEmpty();
        if (hasTimeline) {
            BigDecimal sum = BigDecimal.ZERO;
            for (int i = 0; i < timeline.size(); i++) {
                DistributionPhaseRequest phase = timeline.get(i);
                String prefix = "distributionTimeline[" + i + "].";
                if (phase == null) {
                    errors.put("distributionTimeline[" + i + "]", "is required");
                    continue;
                }
                if (phase.description() == null || phase.description().isBlank()) {
                    errors.put(prefix + "description", "is required");
                }
                if (phase.expectedDate() == null) {
                    errors.put(prefix + "expectedDate", "is required");
                }
                if (phase.amount() == null || phase.amount().signum() <= 0) {
                    errors.put(prefix + "amount", "must be positive");
                } else {
                    sum = sum.add(phase.amount());
                }
            }
            if (errors.isEmpty() && sum.compareTo(decision.approvedAmount()) != 0) {
                errors.put("distributionTimeline", "amounts must add up to approvedAmount");
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        if (decision.recurring() != null) {
            scheduleCalculator.validate(decision.recurring(), hasTimeline);
        }
    }

    private Application getForUpdate(UUID applicationId) {
        return applicationRepository.findByIdForUpdate(applicationId)
                .orElseThrow(() -> new RecordNotFoundException("Application"));
    }
}
