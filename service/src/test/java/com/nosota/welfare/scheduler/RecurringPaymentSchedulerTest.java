package com.nosota.welfare.scheduler;

import com.nosota.welfare.api.response.OverdueSweepResult;
import com.nosota.welfare.error.StoreException;
import com.nosota.welfare.security.PermissionService;
import com.nosota.welfare.service.RecurringPaymentService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Scheduled jobs")
class RecurringPaymentSchedulerTest {

    @Mock
    private RecurringPaymentService recurringPaymentService;

    @Mock
    private PermissionService permissionService;

    @InjectMocks
    private RecurringPaymentScheduler recurringPaymentScheduler;

    @InjectMocks
    private RoleAssignmentCleanupScheduler roleAssignmentCleanupScheduler;

    @Test
    @DisplayName("Sweep job runs the overdue computation")
    void sweepRuns() {
        when(recurringPaymentService.computeOverdueStatuses()).thenReturn(new OverdueSweepResult(3, 1, 2));

        recurringPaymentScheduler.sweepOverduePayments();

        verify(recurringPaymentService, times(1)).computeOverdueStatuses();
    }

    @Test
    @DisplayName("Sweep failure is logged and does not escape the scheduler thread")
    void sweepFailure() {
        when(recurringPaymentService.computeOverdueStatuses())
                .thenThrow(new StoreException("Failed to update installments", new RuntimeException("timeout")));

        assertThatCode(() -> recurringPaymentScheduler.sweepOverduePayments()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Cleanup job deactivates expired role assignments")
    void cleanupRuns() {
        when(permissionService.cleanupExpiredAssignments()).thenReturn(0);

        roleAssignmentCleanupScheduler.cleanupExpiredAssignments();

        verify(permissionService).cleanupExpiredAssignments();
    }
}
