package com.nosota.welfare.service;

import com.nosota.welfare.api.model.ApplicationStatus;
import com.nosota.welfare.api.model.RecurringPaymentStatus;
import com.nosota.welfare.api.model.RecurringScheduleStatus;
import com.nosota.welfare.api.request.RecordPaymentRequest;
import com.nosota.welfare.api.request.RecurringPaymentUpdateRequest;
import com.nosota.welfare.api.request.ScheduleConfig;
import com.nosota.welfare.api.response.OverdueSweepResult;
import com.nosota.welfare.api.response.RecurringPaymentResponse;
import com.nosota.welfare.dto.ScheduledInstallment;
import com.nosota.welfare.error.InvalidStateException;
import com.nosota.welfare.error.RecordNotFoundException;
import com.nosota.welfare.error.StoreException;
import com.nosota.welfare.error.ValidationException;
import com.nosota.welfare.mapper.RecurringPaymentMapper;
import com.nosota.welfare.model.Application;
import com.nosota.welfare.model.Payment;
import com.nosota.welfare.model.RecurringConfig;
import com.nosota.welfare.model.RecurringPayment;
import com.nosota.welfare.repository.ApplicationRepository;
import com.nosota.welfare.repository.RecurringPaymentRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Recurring payment schedules of approved applications.
 *
 * <p>A schedule is generated as one batch of installments, atomically. Each installment
 * then moves through its own lifecycle (see {@link RecurringPaymentStatusStateMachine}):
 * the overdue sweep promotes pending installments to DUE/OVERDUE, and admins record,
 * fail, skip, reschedule or cancel them. A completed installment keeps its amount and
 * dates forever; only its notes and transaction reference can be corrected.
 *
 * <p>The owning application's {@link RecurringConfig} tracks progress (completed count,
 * next and last payment dates, schedule status) and is refreshed after every change.
 *
 * <p>Configuration:
 * <pre>
 * recurring-payment:
 *   due-window-days: 7   # SCHEDULED installments due within this window become DUE
 *   currency: INR        # currency stamped on generated installments
 * </pre>
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class RecurringPaymentService {

    /**
     * Installments still awaiting payment. An application with any of these has an active schedule.
     */
    static final Set<RecurringPaymentStatus> PENDING_STATUSES = EnumSet.of(
            RecurringPaymentStatus.SCHEDULED,
            RecurringPaymentStatus.DUE,
            RecurringPaymentStatus.OVERDUE,
            RecurringPaymentStatus.PROCESSING
    );

    private static final Set<RecurringPaymentStatus> EDITABLE_STATUSES = EnumSet.of(
            RecurringPaymentStatus.SCHEDULED,
            RecurringPaymentStatus.DUE,
            RecurringPaymentStatus.OVERDUE
    );

    private final RecurringPaymentRepository recurringPaymentRepository;
    private final ApplicationRepository applicationRepository;
    private final PaymentService paymentService;
    private final ScheduleCalculator scheduleCalculator;
    private final RecurringPaymentStatusStateMachine stateMachine;
    private final Clock clock;

    @Value("${recurring-payment.due-window-days:7}")
    private int dueWindowDays = 7;

    @Value("${recurring-payment.currency:INR}")
    private String currency = "INR";

    /**
     * Generates the recurring payment schedule of an approved application.
     *
     * <p>The application row is locked for the duration of the transaction, so
     * concurrent generations for one application are serialized and at most one
     * active schedule can exist.
     *
     * @param applicationId Application to schedule
     * @param config        Cadence, count, amount and start date
     * @return Created installments, ordered by payment number
     * @throws ValidationException     if the configuration is invalid
     * @throws RecordNotFoundException if the application does not exist
     * @throws InvalidStateException   if the application is not approved or already has an active schedule
     * @throws StoreException          if the batch cannot be stored
     */
    @Transactional
    public List<RecurringPayment> generateSchedule(@NotNull UUID applicationId, ScheduleConfig config) {
        // Shape checks first; whether the amount may be omitted depends on the timeline
        scheduleCalculator.validate(config, true);

        Application application = applicationRepository.findByIdForUpdate(applicationId)
                .orElseThrow(() -> new RecordNotFoundException("Application"));

        if (application.getStatus() != ApplicationStatus.APPROVED) {
            throw new InvalidStateException("Application must be approved to generate a payment schedule");
        }

        if (recurringPaymentRepository.existsByApplicationIdAndStatusIn(applicationId, PENDING_STATUSES)) {
            throw new InvalidStateException("Application already has an active payment schedule");
        }

        List<ScheduledInstallment> installments =
                scheduleCalculator.buildInstallments(config, application.getDistributionTimeline());

        UUID batchId = UUID.randomUUID();
        LocalDateTime now = LocalDateTime.now(clock);

        List<RecurringPayment> records = new ArrayList<>(installments.size());
        for (ScheduledInstallment installment : installments) {
            records.add(toRecord(application, batchId, installment, now));
        }

        List<RecurringPayment> saved;
        try {
            saved = recurringPaymentRepository.saveAllAndFlush(records);
        } catch (DataIntegrityViolationException e) {
            throw new InvalidStateException("Payment schedule conflicts with an existing schedule", e);
        } catch (DataAccessException e) {
            log.error("Failed to store payment schedule of application {}: {}", applicationId, e.getMessage(), e);
            throw new StoreException("Failed to store payment schedule", e);
        }

        RecurringConfig recurringConfig = application.getRecurringConfig() != null
                ? application.getRecurringConfig()
                : new RecurringConfig();
        recurringConfig.setRecurring(true);
        recurringConfig.setPeriod(config.period());
        recurringConfig.setNumberOfPayments(config.numberOfPayments());
        recurringConfig.setAmountPerPayment(config.amountPerPayment());
        recurringConfig.setStartDate(installments.get(0).scheduledDate());
        recurringConfig.setEndDate(installments.stream()
                .map(ScheduledInstallment::scheduledDate)
                .max(LocalDate::compareTo)
                .orElse(null));
        recurringConfig.setNextPaymentDate(installments.stream()
                .map(ScheduledInstallment::scheduledDate)
                .min(LocalDate::compareTo)
                .orElse(null));
        recurringConfig.setLastPaymentDate(null);
        recurringConfig.setCompletedPayments(0);
        recurringConfig.setStatus(RecurringScheduleStatus.ACTIVE);
        application.setRecurringConfig(recurringConfig);
        application.setUpdatedAt(now);
        applicationRepository.save(application);

        log.info("Payment schedule generated: application={}, batch={}, installments={}, period={}",
                applicationId, batchId, saved.size(), config.period());

        return saved;
    }

    /**
     * Records an installment as paid and creates the matching {@link Payment}.
     *
     * @param paymentId   Installment id
     * @param request     Method, optional amount override, reference, date and notes
     * @param processedBy Acting admin
     * @return The completed installment
     * @throws InvalidStateException if the installment is already completed or otherwise final
     */
    @Transactional
    public RecurringPayment recordPayment(@NotNull UUID paymentId, RecordPaymentRequest request,
                                          UUID processedBy) {
        if (request == null) {
            throw new ValidationException("request", "is required");
        }
        if (request.method() == null) {
            throw new ValidationException("method", "is required");
        }
        if (request.amount() != null && request.amount().signum() <= 0) {
            throw new ValidationException("amount", "must be positive");
        }

        RecurringPayment installment = getRecord(paymentId);

        if (installment.getStatus() == RecurringPaymentStatus.COMPLETED) {
            throw new InvalidStateException("Payment has already been recorded");
        }
        stateMachine.validateTransition(installment.getStatus(), RecurringPaymentStatus.COMPLETED);

        BigDecimal paidAmount = request.amount() != null ? request.amount() : installment.getAmount();
        LocalDate paymentDate = request.paymentDate() != null ? request.paymentDate() : LocalDate.now(clock);
        LocalDateTime now = LocalDateTime.now(clock);

        Payment payment = paymentService.createCompletedInstallment(installment, paidAmount, request.method(),
                request.transactionReference(), paymentDate, processedBy, request.notes());

        installment.setStatus(RecurringPaymentStatus.COMPLETED);
        installment.setAmount(paidAmount);
        installment.setPaidAmount(paidAmount);
        installment.setPaymentId(payment.getId());
        installment.setPaymentMethod(request.method());
        installment.setTransactionReference(request.transactionReference());
        installment.setActualPaymentDate(paymentDate);
        installment.setProcessedBy(processedBy);
        installment.setProcessedAt(now);
        if (request.notes() != null) {
            installment.setNotes(request.notes());
        }
        installment.setUpdatedAt(now);
        installment.setUpdatedBy(processedBy);

        installment = recurringPaymentRepository.save(installment);

        log.info("Installment paid: id={}, application={}, number={}/{}, amount={}, method={}",
                paymentId, installment.getApplicationId(), installment.getPaymentNumber(),
                installment.getTotalPayments(), paidAmount, request.method());

        refreshScheduleProgress(installment.getApplicationId(), paymentDate);
        return installment;
    }

    /**
     * Corrects the notes or transaction reference of a completed installment. Amount
     * and dates are never touched.
     *
     * @throws InvalidStateException if the installment is not completed
     */
    @Transactional
    public RecurringPayment correctPaymentDetails(@NotNull UUID paymentId, String notes,
                                                  String transactionReference, UUID updatedBy) {
        if (notes == null && transactionReference == null) {
            throw new ValidationException("notes", "nothing to correct");
        }

        RecurringPayment installment = getRecord(paymentId);
        if (installment.getStatus() != RecurringPaymentStatus.COMPLETED) {
            throw new InvalidStateException("Only completed payments can be corrected");
        }

        if (notes != null) {
            installment.setNotes(notes);
        }
        if (transactionReference != null) {
            installment.setTransactionReference(transactionReference);
        }
        installment.setUpdatedAt(LocalDateTime.now(clock));
        installment.setUpdatedBy(updatedBy);

        log.info("Completed installment details corrected: id={}, by={}", paymentId, updatedBy);
        return recurringPaymentRepository.save(installment);
    }

    @Transactional
    public RecurringPayment markProcessing(@NotNull UUID paymentId) {
        RecurringPayment installment = getRecord(paymentId);
        stateMachine.validateTransition(installment.getStatus(), RecurringPaymentStatus.PROCESSING);

        installment.setStatus(RecurringPaymentStatus.PROCESSING);
        installment.setUpdatedAt(LocalDateTime.now(clock));

        log.info("Installment processing: id={}", paymentId);
        return recurringPaymentRepository.save(installment);
    }

    @Transactional
    public RecurringPayment markFailed(@NotNull UUID paymentId, String reason) {
        return closeWithReason(paymentId, RecurringPaymentStatus.FAILED, reason);
    }

    @Transactional
    public RecurringPayment skipPayment(@NotNull UUID paymentId, String reason) {
        return closeWithReason(paymentId, RecurringPaymentStatus.SKIPPED, reason);
    }

    /**
     * Edits a pending installment in place.
     *
     * <p>Moving only the scheduled date shifts the due date by the same number of days.
     * When the due date moves, a DUE or OVERDUE installment is re-evaluated against the
     * due window and may return to an earlier status.
     *
     * @param paymentId Installment id
     * @param patch     Fields to change; {@code null} fields are left as they are
     * @param updatedBy Acting admin
     * @return The updated installment
     * @throws InvalidStateException if the installment is final or being processed
     * @throws ValidationException   if the amount is not positive or the due date precedes the scheduled date
     */
    @Transactional
    public RecurringPayment updateRecurringPayment(@NotNull UUID paymentId, RecurringPaymentUpdateRequest patch,
                                                   UUID updatedBy) {
        if (patch == null) {
            throw new ValidationException("patch", "is required");
        }
        if (patch.amount() != null && patch.amount().signum() <= 0) {
            throw new ValidationException("amount", "must be positive");
        }

        RecurringPayment installment = getRecord(paymentId);
        RecurringPaymentStatus status = installment.getStatus();
        if (!EDITABLE_STATUSES.contains(status)) {
            throw new InvalidStateException("Payment in status " + status + " cannot be modified");
        }

        LocalDate scheduledDate = installment.getScheduledDate();
        LocalDate dueDate = installment.getDueDate();

        LocalDate newScheduledDate = patch.scheduledDate() != null ? patch.scheduledDate() : scheduledDate;
        LocalDate newDueDate;
        if (patch.dueDate() != null) {
            newDueDate = patch.dueDate();
        } else if (patch.scheduledDate() != null) {
            newDueDate = dueDate.plusDays(ChronoUnit.DAYS.between(scheduledDate, newScheduledDate));
        } else {
            newDueDate = dueDate;
        }

        if (newDueDate.isBefore(newScheduledDate)) {
            throw new ValidationException("dueDate", "must not be before scheduledDate");
        }

        boolean datesChanged = !newScheduledDate.equals(scheduledDate) || !newDueDate.equals(dueDate);

        installment.setScheduledDate(newScheduledDate);
        installment.setDueDate(newDueDate);
        if (patch.amount() != null) {
            installment.setAmount(patch.amount());
        }
        if (patch.description() != null) {
            installment.setDescription(patch.description());
        }
        if (patch.notes() != null) {
            installment.setNotes(patch.notes());
        }

        if (datesChanged) {
            RecurringPaymentStatus target = statusForDueDate(newDueDate);
            if (target != status
                    && (stateMachine.allowsReschedule(status, target) || stateMachine.isTransitionAllowed(status, target))) {
                log.info("Installment {} rescheduled: {} → {}", paymentId, status, target);
                installment.setStatus(target);
            }
        }

        installment.setUpdatedAt(LocalDateTime.now(clock));
        installment.setUpdatedBy(updatedBy);
        installment = recurringPaymentRepository.save(installment);

        log.info("Installment updated: id={}, scheduledDate={}, dueDate={}, amount={}, by={}",
                paymentId, newScheduledDate, newDueDate, installment.getAmount(), updatedBy);

        if (datesChanged) {
            refreshScheduleProgress(installment.getApplicationId(), null);
        }
        return installment;
    }

    /**
     * Cancels one installment. The record is kept, with its amount and dates, for audit.
     *
     * @throws ValidationException   if {@code reason} is blank
     * @throws InvalidStateException if the installment is final or being processed
     */
    @Transactional
    public void cancelRecurringPayment(@NotNull UUID paymentId, String reason, UUID cancelledBy) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "is required");
        }

        RecurringPayment installment = getRecord(paymentId);
        if (stateMachine.isFinalState(installment.getStatus())) {
            throw new InvalidStateException("Payment in status " + installment.getStatus() + " cannot be cancelled");
        }
        stateMachine.validateTransition(installment.getStatus(), RecurringPaymentStatus.CANCELLED);

        cancel(installment, reason.trim(), cancelledBy, LocalDateTime.now(clock));
        recurringPaymentRepository.save(installment);

        log.info("Installment cancelled: id={}, application={}, by={}",
                paymentId, installment.getApplicationId(), cancelledBy);

        refreshScheduleProgress(installment.getApplicationId(), null);
    }

    /**
     * Cancels every pending installment of an application's schedule. Completed
     * installments are left untouched; installments being processed are left to finish.
     *
     * @return Number of cancelled installments
     */
    @Transactional
    public int cancelSchedule(@NotNull UUID applicationId, String reason, UUID cancelledBy) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "is required");
        }

        Application application = applicationRepository.findByIdForUpdate(applicationId)
                .orElseThrow(() -> new RecordNotFoundException("Application"));

        List<RecurringPayment> pending =
                recurringPaymentRepository.findByApplicationIdAndStatusIn(applicationId, EDITABLE_STATUSES);

        LocalDateTime now = LocalDateTime.now(clock);
        for (RecurringPayment installment : pending) {
            cancel(installment, reason.trim(), cancelledBy, now);
        }
        recurringPaymentRepository.saveAll(pending);

        RecurringConfig recurringConfig = application.getRecurringConfig();
        if (recurringConfig != null) {
            recurringConfig.setStatus(RecurringScheduleStatus.CANCELLED);
            recurringConfig.setNextPaymentDate(null);
            application.setUpdatedAt(now);
            applicationRepository.save(application);
        }

        log.info("Payment schedule cancelled: application={}, cancelled={}, by={}",
                applicationId, pending.size(), cancelledBy);

        return pending.size();
    }

    /**
     * Promotes pending installments by due date: SCHEDULED/DUE installments past their
     * due date become OVERDUE, SCHEDULED installments due within the due window become DUE.
     *
     * <p>Both steps are status-guarded bulk updates, so the sweep is idempotent and
     * never touches final states. Safe to run from several instances.
     *
     * @return Counts of promoted installments
     */
    @Transactional
    public OverdueSweepResult computeOverdueStatuses() {
        LocalDate today = LocalDate.now(clock);
        LocalDateTime now = LocalDateTime.now(clock);

        int overdue = recurringPaymentRepository.markOverdue(today, now);
        int due = recurringPaymentRepository.markDue(today, today.plusDays(dueWindowDays), now);

        if (overdue + due > 0) {
            log.info("Overdue sweep: {} installments overdue, {} due", overdue, due);
        } else {
            log.debug("Overdue sweep: nothing to promote");
        }

        return new OverdueSweepResult(overdue + due, overdue, due);
    }

    /**
     * Installments of an application ordered by payment number.
     */
    public List<RecurringPaymentResponse> getPaymentSchedule(@NotNull UUID applicationId) {
        if (!applicationRepository.existsById(applicationId)) {
            throw new RecordNotFoundException("Application");
        }
        return RecurringPaymentMapper.INSTANCE.toResponseList(
                recurringPaymentRepository.findByApplicationIdOrderByPaymentNumberAsc(applicationId));
    }

    public RecurringPaymentResponse getRecurringPayment(@NotNull UUID paymentId) {
        return RecurringPaymentMapper.INSTANCE.toResponse(getRecord(paymentId));
    }

    public boolean hasActiveSchedule(@NotNull UUID applicationId) {
        return recurringPaymentRepository.existsByApplicationIdAndStatusIn(applicationId, PENDING_STATUSES);
    }

    private RecurringPayment closeWithReason(UUID paymentId, RecurringPaymentStatus target, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "is required");
        }

        RecurringPayment installment = getRecord(paymentId);
        stateMachine.validateTransition(installment.getStatus(), target);

        installment.setStatus(target);
        installment.setNotes(reason.trim());
        installment.setUpdatedAt(LocalDateTime.now(clock));
        installment = recurringPaymentRepository.save(installment);

        log.info("Installment closed: id={}, status={}", paymentId, target);

        refreshScheduleProgress(installment.getApplicationId(), null);
        return installment;
    }

    private RecurringPaymentStatus statusForDueDate(LocalDate dueDate) {
        LocalDate today = LocalDate.now(clock);
        if (dueDate.isBefore(today)) {
            return RecurringPaymentStatus.OVERDUE;
        }
        if (!dueDate.isAfter(today.plusDays(dueWindowDays))) {
            return RecurringPaymentStatus.DUE;
        }
        return RecurringPaymentStatus.SCHEDULED;
    }

    /**
     * Recomputes the schedule progress stored on the application.
     *
     * @param lastPaymentDate Date of a payment just recorded, or null
     */
    private void refreshScheduleProgress(UUID applicationId, LocalDate lastPaymentDate) {
        Application application = applicationRepository.findById(applicationId).orElse(null);
        if (application == null || application.getRecurringConfig() == null) {
            log.warn("No recurring configuration to update for application {}", applicationId);
            return;
        }

        RecurringConfig recurringConfig = application.getRecurringConfig();
        long completed = recurringPaymentRepository.countByApplicationIdAndStatus(
                applicationId, RecurringPaymentStatus.COMPLETED);
        recurringConfig.setCompletedPayments((int) completed);
        if (lastPaymentDate != null) {
            recurringConfig.setLastPaymentDate(lastPaymentDate);
        }

        LocalDate next = recurringPaymentRepository
                .findFirstByApplicationIdAndStatusInOrderByScheduledDateAsc(applicationId, PENDING_STATUSES)
                .map(RecurringPayment::getScheduledDate)
                .orElse(null);
        recurringConfig.setNextPaymentDate(next);

        if (next == null && recurringConfig.getStatus() == RecurringScheduleStatus.ACTIVE) {
            recurringConfig.setStatus(completed > 0
                    ? RecurringScheduleStatus.COMPLETED
                    : RecurringScheduleStatus.CANCELLED);
            log.info("Payment schedule of application {} finished: {}", applicationId, recurringConfig.getStatus());
        }

        application.setUpdatedAt(LocalDateTime.now(clock));
        applicationRepository.save(application);
    }

    private RecurringPayment getRecord(UUID paymentId) {
        return recurringPaymentRepository.findById(paymentId)
                .orElseThrow(() -> new RecordNotFoundException("Recurring payment"));
    }

    private RecurringPayment toRecord(Application application, UUID batchId,
                                      ScheduledInstallment installment, LocalDateTime now) {
        RecurringPayment record = new RecurringPayment();
        record.setApplicationId(application.getId());
        record.setScheduleBatchId(batchId);
        record.setBeneficiaryId(application.getBeneficiaryId());
        record.setSchemeId(application.getSchemeId());
        record.setProjectId(application.getProjectId());
        record.setStateId(application.getStateId());
        record.setDistrictId(application.getDistrictId());
        record.setAreaId(application.getAreaId());
        record.setUnitId(application.getUnitId());
        record.setPaymentNumber(installment.paymentNumber());
        record.setTotalPayments(installment.totalPayments());
        record.setCycleNumber(installment.cycleNumber());
        record.setTotalCycles(installment.totalCycles());
        record.setPhaseNumber(installment.phaseNumber());
        record.setTotalPhases(installment.totalPhases());
        record.setScheduledDate(installment.scheduledDate());
        record.setDueDate(installment.scheduledDate());
        record.setAmount(installment.amount());
        record.setCurrency(currency);
        record.setDescription(installment.description());
        record.setStatus(RecurringPaymentStatus.SCHEDULED);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        return record;
    }

    private static void cancel(RecurringPayment installment, String reason, UUID cancelledBy, LocalDateTime now) {
        installment.setStatus(RecurringPaymentStatus.CANCELLED);
        installment.setCancellationReason(reason);
        installment.setCancelledBy(cancelledBy);
        installment.setCancelledAt(now);
        installment.setUpdatedAt(now);
        installment.setUpdatedBy(cancelledBy);
    }
}
