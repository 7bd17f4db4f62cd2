package com.nosota.welfare.api.request;

import com.nosota.welfare.api.model.ApprovalSource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of an interview or committee decision approving an application.
 *
 * @param source               Workflow step taking the decision
 * @param approvedAmount       Total approved amount
 * @param distributionTimeline Ordered phases; their amounts must add up to {@code approvedAmount}
 * @param recurring            Recurring schedule, or {@code null} for one-off disbursement
 * @param remarks              Decision remarks
 */
public record ApprovalDecision(
        @NotNull
        ApprovalSource source,

        @NotNull @Positive
        BigDecimal approvedAmount,

        @Valid
        List<DistributionPhaseRequest> distributionTimeline,

        @Valid
        ScheduleConfig recurring,

        String remarks
) {
}
