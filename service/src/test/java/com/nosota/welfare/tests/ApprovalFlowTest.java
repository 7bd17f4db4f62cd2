package com.nosota.welfare.tests;

import com.nosota.welfare.TestBase;
import com.nosota.welfare.api.model.ApplicationStatus;
import com.nosota.welfare.api.model.ApprovalSource;
import com.nosota.welfare.api.model.PaymentMethod;
import com.nosota.welfare.api.model.PaymentPeriod;
import com.nosota.welfare.api.model.PaymentType;
import com.nosota.welfare.api.model.RecurringPaymentStatus;
import com.nosota.welfare.api.model.RecurringScheduleStatus;
import com.nosota.welfare.api.request.ApprovalDecision;
import com.nosota.welfare.api.request.DistributionPhaseRequest;
import com.nosota.welfare.api.request.RecordPaymentRequest;
import com.nosota.welfare.api.request.ScheduleConfig;
import com.nosota.welfare.api.response.RecurringPaymentResponse;
import com.nosota.welfare.error.InvalidStateException;
import com.nosota.welfare.model.Application;
import com.nosota.welfare.model.Payment;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApprovalFlowTest extends TestBase {

    @Test
    void recurringApprovalGeneratesScheduleAfterCommit() {
        Application application = createApplication(ApplicationStatus.PENDING_COMMITTEE_APPROVAL);
        LocalDate start = today().plusMonths(1).withDayOfMonth(1);
        ScheduleConfig config = new ScheduleConfig(PaymentPeriod.MONTHLY, 3, new BigDecimal("1500"), start.toString());

        workflowService.approveApplication(application.getId(),
                new ApprovalDecision(ApprovalSource.COMMITTEE, new BigDecimal("4500"), null, config, "approved"),
                UUID.randomUUID());

        List<RecurringPaymentResponse> schedule = recurringPaymentService.getPaymentSchedule(application.getId());
        assertThat(schedule).hasSize(3);
        assertThat(schedule).extracting(RecurringPaymentResponse::scheduledDate)
                .containsExactly(start, start.plusMonths(1), start.plusMonths(2));
        assertThat(schedule).allSatisfy(r -> assertThat(r.status()).isEqualTo(RecurringPaymentStatus.SCHEDULED));

        Application stored = applicationRepository.findById(application.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(ApplicationStatus.APPROVED);
        assertThat(stored.getRecurringConfig().getStatus()).isEqualTo(RecurringScheduleStatus.ACTIVE);
        assertThat(stored.getRecurringConfig().getNextPaymentDate()).isEqualTo(start);

        assertThatThrownBy(() -> recurringPaymentService.generateSchedule(application.getId(), config))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void recordingPaymentUpdatesScheduleProgress() {
        Application application = createApplication(ApplicationStatus.PENDING_COMMITTEE_APPROVAL);
        LocalDate start = today().withDayOfMonth(1);
        ScheduleConfig config = new ScheduleConfig(PaymentPeriod.QUARTERLY, 2, new BigDecimal("1000"), start.toString());

        workflowService.approveApplication(application.getId(),
                new ApprovalDecision(ApprovalSource.COMMITTEE, new BigDecimal("2000"), null, config, null),
                UUID.randomUUID());

        RecurringPaymentResponse first = recurringPaymentService.getPaymentSchedule(application.getId()).get(0);
        recurringPaymentService.recordPayment(first.id(),
                new RecordPaymentRequest(null, PaymentMethod.BANK_TRANSFER, "NEFT-77", null, null), UUID.randomUUID());

        Application stored = applicationRepository.findById(application.getId()).orElseThrow();
        assertThat(stored.getRecurringConfig().getCompletedPayments()).isEqualTo(1);
        assertThat(stored.getRecurringConfig().getNextPaymentDate()).isEqualTo(start.plusMonths(3));

        List<Payment> payments = paymentRepository.findByApplicationIdOrderByCreatedAtAsc(application.getId());
        assertThat(payments).singleElement().satisfies(p -> {
            assertThat(p.getType()).isEqualTo(PaymentType.RECURRING);
            assertThat(p.getRecurringPaymentId()).isEqualTo(first.id());
        });
    }

    @Test
    void oneOffApprovalPlansPaymentsPerPhase() {
        Application application = createApplication(ApplicationStatus.INTERVIEW_SCHEDULED);
        LocalDate date = today().plusDays(20);

        workflowService.approveApplication(application.getId(),
                new ApprovalDecision(ApprovalSource.INTERVIEW, new BigDecimal("5000"),
                        List.of(new DistributionPhaseRequest("Admission fee", new BigDecimal("3000"), date),
                                new DistributionPhaseRequest("Books", new BigDecimal("2000"), date.plusMonths(2))),
                        null, null),
                UUID.randomUUID());

        List<Payment> payments = paymentRepository.findByApplicationIdOrderByCreatedAtAsc(application.getId());
        assertThat(payments).hasSize(2);
        assertThat(payments).allSatisfy(p -> assertThat(p.getType()).isEqualTo(PaymentType.INSTALLMENT));
        assertThat(payments).extracting(Payment::getAmount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactlyInAnyOrder(new BigDecimal("3000"), new BigDecimal("2000"));
        assertThat(recurringPaymentService.hasActiveSchedule(application.getId())).isFalse();
    }
}
