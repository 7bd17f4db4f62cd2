package com.nosota.welfare.event;

import com.nosota.welfare.api.model.ApprovalSource;
import com.nosota.welfare.api.request.ScheduleConfig;

import java.util.UUID;

/**
 * Published when an application is approved.
 *
 * @param applicationId Approved application
 * @param source        Workflow step that approved it
 * @param recurring     Recurring schedule to generate, or {@code null} for a one-off payment plan
 */
public record ApplicationApprovedEvent(
        UUID applicationId,
        ApprovalSource source,
        ScheduleConfig recurring
) {
}
