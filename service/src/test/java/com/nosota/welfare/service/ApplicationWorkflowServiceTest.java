package com.nosota.welfare.service;

import com.nosota.welfare.api.model.ApplicationStatus;
import com.nosota.welfare.api.model.ApprovalSource;
import com.nosota.welfare.api.model.PaymentPeriod;
import com.nosota.welfare.api.request.ApprovalDecision;
import com.nosota.welfare.api.request.DistributionPhaseRequest;
import com.nosota.welfare.api.request.ScheduleConfig;
import com.nosota.welfare.error.InvalidStateException;
import com.nosota.welfare.error.ValidationException;
import com.nosota.welfare.event.ApplicationApprovedEvent;
import com.nosota.welfare.model.Application;
import com.nosota.welfare.repository.ApplicationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Application workflow")
class ApplicationWorkflowServiceTest {

    @Mock
    private ApplicationRepository applicationRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private ApplicationWorkflowService workflowService;

    private Application application;
    private UUID approverId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);
        workflowService = new ApplicationWorkflowService(applicationRepository, new ApplicationStatusStateMachine(),
                new ScheduleCalculator(), eventPublisher, clock);

        application = new Application();
        application.setId(UUID.randomUUID());
        application.setApplicationNumber("APP-2024-0042");
        application.setStatus(ApplicationStatus.PENDING_COMMITTEE_APPROVAL);
        application.setRequestedAmount(new BigDecimal("10000"));
        approverId = UUID.randomUUID();
    }

    private void stubLock() {
        when(applicationRepository.findByIdForUpdate(application.getId())).thenReturn(Optional.of(application));
    }

    private void stubSave() {
        when(applicationRepository.save(any(Application.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("Committee approval stores the timeline and publishes the approval event")
    void committeeApproval() {
        stubLock();
        stubSave();

        ApprovalDecision decision = new ApprovalDecision(ApprovalSource.COMMITTEE, new BigDecimal("5000"),
                List.of(new DistributionPhaseRequest("Admission fee", new BigDecimal("3000"), LocalDate.of(2024, 6, 1)),
                        new DistributionPhaseRequest("Books", new BigDecimal("2000"), LocalDate.of(2024, 9, 1))),
                null, "Approved in March sitting");

        Application approved = workflowService.approveApplication(application.getId(), decision, approverId);

        assertThat(approved.getStatus()).isEqualTo(ApplicationStatus.APPROVED);
        assertThat(approved.getApprovedAmount()).isEqualByComparingTo("5000");
        assertThat(approved.getApprovedBy()).isEqualTo(approverId);
        assertThat(approved.getApprovalSource()).isEqualTo(ApprovalSource.COMMITTEE);
        assertThat(approved.getDistributionTimeline()).hasSize(2);
        assertThat(approved.getDistributionTimeline().get(1).getDescription()).isEqualTo("Books");
        assertThat(approved.getRecurringConfig()).isNull();

        ArgumentCaptor<ApplicationApprovedEvent> event = ArgumentCaptor.forClass(ApplicationApprovedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().applicationId()).isEqualTo(application.getId());
        assertThat(event.getValue().recurring()).isNull();
    }

    @Test
    @DisplayName("Interview approval with a recurring schedule records the recurring configuration")
    void interviewApprovalWithRecurring() {
        application.setStatus(ApplicationStatus.INTERVIEW_SCHEDULED);
        stubLock();
        stubSave();

        ScheduleConfig recurring = new ScheduleConfig(PaymentPeriod.MONTHLY, 12, new BigDecimal("1500"), "2024-04-01");
        Application approved = workflowService.approveApplication(application.getId(),
                new ApprovalDecision(ApprovalSource.INTERVIEW, new BigDecimal("18000"), null, recurring, null),
                approverId);

        assertThat(approved.getRecurringConfig().getRecurring()).isTrue();
        assertThat(approved.getRecurringConfig().getNumberOfPayments()).isEqualTo(12);
        assertThat(approved.getRecurringConfig().getStartDate()).isEqualTo(LocalDate.of(2024, 4, 1));
        verify(eventPublisher).publishEvent(new ApplicationApprovedEvent(application.getId(),
                ApprovalSource.INTERVIEW, recurring));
    }

    @Test
    @DisplayName("Timeline amounts must add up to the approved amount")
    void timelineMismatch() {
        ApprovalDecision decision = new ApprovalDecision(ApprovalSource.COMMITTEE, new BigDecimal("5000"),
                List.of(new DistributionPhaseRequest("Admission fee", new BigDecimal("3000"), LocalDate.of(2024, 6, 1))),
                null, null);

        assertThatThrownBy(() -> workflowService.approveApplication(application.getId(), decision, approverId))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("distributionTimeline");

        verifyNoInteractions(applicationRepository, eventPublisher);
    }

    @Test
    @DisplayName("Decision source must match the application's current step")
    void wrongSource() {
        stubLock();

        assertThatThrownBy(() -> workflowService.approveApplication(application.getId(),
                new ApprovalDecision(ApprovalSource.INTERVIEW, new BigDecimal("5000"), null, null, null), approverId))
                .isInstanceOf(InvalidStateException.class);

        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("Invalid recurring configuration blocks the approval")
    void invalidRecurring() {
        ScheduleConfig recurring = new ScheduleConfig(PaymentPeriod.MONTHLY, 61, new BigDecimal("100"), "2024-04-01");

        assertThatThrownBy(() -> workflowService.approveApplication(application.getId(),
                new ApprovalDecision(ApprovalSource.COMMITTEE, new BigDecimal("6100"), null, recurring, null),
                approverId))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("numberOfPayments");
    }

    @Test
    @DisplayName("Procedural steps follow the status graph; decisions need their own operation")
    void advanceStatus() {
        application.setStatus(ApplicationStatus.PENDING);
        stubLock();
        stubSave();

        assertThat(workflowService.advanceStatus(application.getId(), ApplicationStatus.UNDER_REVIEW).getStatus())
                .isEqualTo(ApplicationStatus.UNDER_REVIEW);

        assertThatThrownBy(() -> workflowService.advanceStatus(application.getId(), ApplicationStatus.APPROVED))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> workflowService.advanceStatus(application.getId(), ApplicationStatus.UNDER_REVIEW))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    @DisplayName("Rejection requires a reason and is final")
    void reject() {
        assertThatThrownBy(() -> workflowService.rejectApplication(application.getId(), " ", approverId))
                .isInstanceOf(ValidationException.class);

        stubLock();
        stubSave();

        Application rejected = workflowService.rejectApplication(application.getId(), "Income above limit", approverId);
        assertThat(rejected.getStatus()).isEqualTo(ApplicationStatus.REJECTED);
        assertThat(rejected.getDecisionRemarks()).isEqualTo("Income above limit");

        assertThatThrownBy(() -> workflowService.completeApplication(application.getId()))
                .isInstanceOf(InvalidStateException.class);
    }
}
