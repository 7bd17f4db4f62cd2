package com.nosota.welfare.model;

import com.nosota.welfare.api.model.ApplicationStatus;
import com.nosota.welfare.api.model.ApprovalSource;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A beneficiary's request against one scheme.
 *
 * <p>Region references are copied from the beneficiary's location at creation time
 * and never rewritten, so scope filtering does not depend on later changes to the
 * region tree.
 */
@Entity
@Table(name = "application",
        indexes = {
                @Index(name = "idx_application_status", columnList = "status"),
                @Index(name = "idx_application_district", columnList = "district_id"),
                @Index(name = "idx_application_unit", columnList = "unit_id")
        })
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Application implements ScopedRecord {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "application_number", nullable = false, unique = true, length = 50)
    private String applicationNumber;

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

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 40)
    private ApplicationStatus status;

    @Column(name = "requested_amount", precision = 15, scale = 2)
    private BigDecimal requestedAmount;

    @Column(name = "approved_amount", precision = 15, scale = 2)
    private BigDecimal approvedAmount;

    /**
     * Ordered disbursement phases decided at approval. Phase amounts add up to
     * {@link #approvedAmount}.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "application_distribution_phase", joinColumns = @JoinColumn(name = "application_id"))
    @OrderColumn(name = "phase_index")
    private List<DistributionPhase> distributionTimeline = new ArrayList<>();

    @Embedded
    private RecurringConfig recurringConfig;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_source", length = 20)
    private ApprovalSource approvalSource;

    @Column(name = "approved_by")
    private UUID approvedBy;

    @Column(name = "approved_at")
    private LocalDateTime approvedAt;

    @Column(name = "decision_remarks", length = 1000)
    private String decisionRemarks;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
