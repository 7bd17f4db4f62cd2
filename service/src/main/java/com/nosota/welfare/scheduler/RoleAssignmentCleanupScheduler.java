package com.nosota.welfare.scheduler;

import com.nosota.welfare.security.PermissionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deactivates role assignments whose validity has ended.
 *
 * <pre>
 * scheduler:
 *   role-assignment:
 *     enabled: true
 *     cleanup-cron: "0 30 1 * * *"   # daily at 01:30
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.role-assignment.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class RoleAssignmentCleanupScheduler {

    private final PermissionService permissionService;

    @Scheduled(cron = "${scheduler.role-assignment.cleanup-cron:0 30 1 * * *}")
    public void cleanupExpiredAssignments() {
        try {
            int count = permissionService.cleanupExpiredAssignments();
            if (count == 0) {
                log.debug("No expired role assignments found");
            }
        } catch (Exception e) {
            log.error("Failed to clean up expired role assignments: {}", e.getMessage(), e);
        }
    }
}
