package com.nosota.welfare.model;

import com.nosota.welfare.api.model.PaymentMethod;
import com.nosota.welfare.api.model.RecurringPaymentStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One installment obligation of an application's recurring payment schedule.
 *
 * <p>Installments are created in batches by schedule generation; every record of a
 * batch shares {@link #scheduleBatchId}, and {@link #paymentNumber} is unique within
 * the batch.
 *
 * <p>Lifecycle:
 * <pre>
 * SCHEDULED → DUE → OVERDUE → COMPLETED
 *     (PROCESSING optional before COMPLETED/FAILED)
 * FAILED, SKIPPED, CANCELLED reachable from SCHEDULED/DUE/OVERDUE
 * </pre>
 *
 * <p>Once COMPLETED, amount and dates never change; only notes and the transaction
 * reference may be corrected.
 */
@Entity
@Table(name = "recurring_payment",
        uniqueConstraints = @UniqueConstraint(name = "uk_recurring_payment_batch_number",
                columnNames = {"schedule_batch_id", "payment_number"}),
        indexes = {
                @Index(name = "idx_recurring_payment_application", columnList = "application_id, payment_number"),
                @Index(name = "idx_recurring_payment_status_due", columnList = "status, due_date"),
                @Index(name = "idx_recurring_payment_status_scheduled", columnList = "status, scheduled_date")
        })
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class RecurringPayment implements ScopedRecord {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "application_id", nullable = false)
    private UUID applicationId;

    /**
     * Identifier shared by all installments created by one schedule generation.
     */
    @Column(name = "schedule_batch_id", nullable = false)
    private UUID scheduleBatchId;

    @Column(name = "beneficiary_id", nullable = false)
    private UUID beneficiaryId;

    @Column(name = "scheme_id", nullable = false)
    private UUID schemeId;

    @Column(name = "project_id")
    private UUID projectId;

    @Column(name = "state_id")
    private UUID stateId;

    @Column(name = "district_id")
    private UUID districtId;

    @Column(name = "area_id")
    private UUID areaId;

    @Column(name = "unit_id")
    private UUID unitId;

    /**
     * 1-based position within the schedule.
     */
    @Column(name = "payment_number", nullable = false)
    private Integer paymentNumber;

    @Column(name = "total_payments", nullable = false)
    private Integer totalPayments;

    @Column(name = "cycle_number")
    private Integer cycleNumber;

    @Column(name = "total_cycles")
    private Integer totalCycles;

    /**
     * Timeline phase; only set when the schedule was built from a distribution timeline.
     */
    @Column(name = "phase_number")
    private Integer phaseNumber;

    @Column(name = "total_phases")
    private Integer totalPhases;

    @Column(name = "scheduled_date", nullable = false)
    private LocalDate scheduledDate;

    /**
     * Initialized to {@link #scheduledDate}. Passing it without payment makes the
     * installment overdue.
     */
    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Column(name = "amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "description", length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RecurringPaymentStatus status;

    /**
     * Payment record created when this installment was paid.
     */
    @Column(name = "payment_id")
    private UUID paymentId;

    @Column(name = "paid_amount", precision = 15, scale = 2)
    private BigDecimal paidAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", length = 20)
    private PaymentMethod paymentMethod;

    @Column(name = "transaction_reference", length = 100)
    private String transactionReference;

    @Column(name = "actual_payment_date")
    private LocalDate actualPaymentDate;

    @Column(name = "processed_by")
    private UUID processedBy;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "cancelled_by")
    private UUID cancelledBy;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "updated_by")
    private UUID updatedBy;

    /**
     * Optimistic lock. Bulk status sweeps bump it explicitly.
     */
    @Version
    @Column(name = "version")
    private Long version;
}
