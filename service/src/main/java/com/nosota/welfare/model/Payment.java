package com.nosota.welfare.model;

import com.nosota.welfare.api.model.PaymentMethod;
import com.nosota.welfare.api.model.PaymentStatus;
import com.nosota.welfare.api.model.PaymentType;
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
 * Single-shot or manually tracked disbursement.
 *
 * <p>Created either from an approval (one per timeline phase, or one for the full
 * amount) or when a recurring installment is paid.
 */
@Entity
@Table(name = "payment",
        indexes = @Index(name = "idx_payment_application", columnList = "application_id"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Payment implements ScopedRecord {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "payment_number", nullable = false, unique = true, length = 50)
    private String paymentNumber;

    @Column(name = "application_id", nullable = false)
    private UUID applicationId;

    @Column(name = "recurring_payment_id")
    private UUID recurringPaymentId;

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

    @Column(name = "amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private PaymentType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "method", length = 20)
    private PaymentMethod method;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "installment_number")
    private Integer installmentNumber;

    @Column(name = "total_installments")
    private Integer totalInstallments;

    @Column(name = "installment_description", length = 500)
    private String installmentDescription;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Column(name = "completed_date")
    private LocalDate completedDate;

    @Column(name = "processed_by")
    private UUID processedBy;

    @Column(name = "transaction_reference", length = 100)
    private String transactionReference;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
