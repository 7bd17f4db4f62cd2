package com.nosota.welfare.service;

import com.nosota.welfare.api.model.PaymentMethod;
import com.nosota.welfare.api.model.PaymentStatus;
import com.nosota.welfare.api.model.PaymentType;
import com.nosota.welfare.model.Application;
import com.nosota.welfare.model.DistributionPhase;
import com.nosota.welfare.model.Payment;
import com.nosota.welfare.model.RecurringPayment;
import com.nosota.welfare.repository.PaymentRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Single-shot and manually tracked disbursements.
 *
 * <p>Payments are planned on approval (one per timeline phase, or one for the full
 * approved amount) and recorded when a recurring installment is paid.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private static final DateTimeFormatter NUMBER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final PaymentRepository paymentRepository;
    private final Clock clock;

    /**
     * Creates a PENDING payment for an application.
     */
    @Transactional
    public Payment createPayment(@NotNull Application application, @NotNull BigDecimal amount,
                                 @NotNull PaymentType type, Integer installmentNumber,
                                 Integer totalInstallments, String description, LocalDate dueDate) {
        Payment payment = newPayment(application, amount, type);
        payment.setStatus(PaymentStatus.PENDING);
        payment.setInstallmentNumber(installmentNumber);
        payment.setTotalInstallments(totalInstallments);
        payment.setInstallmentDescription(description);
        payment.setDueDate(dueDate);

        payment = paymentRepository.save(payment);

        log.info("Payment created: id={}, number={}, application={}, type={}, amount={}",
                payment.getId(), payment.getPaymentNumber(), application.getId(), type, amount);

        return payment;
    }

    /**
     * Plans the payments of a one-off (non-recurring) approval: one INSTALLMENT per
     * distribution phase, or a single FULL_AMOUNT payment without a timeline.
     */
    @Transactional
    public List<Payment> createPlannedPayments(@NotNull Application application) {
        List<DistributionPhase> timeline = application.getDistributionTimeline();
        List<Payment> payments = new ArrayList<>();

        if (timeline == null || timeline.isEmpty()) {
            payments.add(createPayment(application, application.getApprovedAmount(), PaymentType.FULL_AMOUNT,
                    null, null, null, null));
            return payments;
        }

        for (int i = 0; i < timeline.size(); i++) {
            DistributionPhase phase = timeline.get(i);
            payments.add(createPayment(application, phase.getAmount(), PaymentType.INSTALLMENT,
                    i + 1, timeline.size(), phase.getDescription(), phase.getExpectedDate()));
        }
        return payments;
    }

    /**
     * Records the completed payment of a recurring installment.
     */
    @Transactional
    public Payment createCompletedInstallment(@NotNull RecurringPayment installment, @NotNull BigDecimal amount,
                                              @NotNull PaymentMethod method, String transactionReference,
                                              @NotNull LocalDate paymentDate, UUID processedBy, String notes) {
        Payment payment = new Payment();
        payment.setPaymentNumber(nextPaymentNumber());
        payment.setApplicationId(installment.getApplicationId());
        payment.setRecurringPaymentId(installment.getId());
        payment.setBeneficiaryId(installment.getBeneficiaryId());
        payment.setSchemeId(installment.getSchemeId());
        payment.setProjectId(installment.getProjectId());
        payment.setStateId(installment.getStateId());
        payment.setDistrictId(installment.getDistrictId());
        payment.setAreaId(installment.getAreaId());
        payment.setUnitId(installment.getUnitId());
        payment.setAmount(amount);
        payment.setType(PaymentType.RECURRING);
        payment.setMethod(method);
        payment.setStatus(PaymentStatus.COMPLETED);
        payment.setInstallmentNumber(installment.getPaymentNumber());
        payment.setTotalInstallments(installment.getTotalPayments());
        payment.setInstallmentDescription(installment.getDescription());
        payment.setDueDate(installment.getDueDate());
        payment.setCompletedDate(paymentDate);
        payment.setProcessedBy(processedBy);
        payment.setTransactionReference(transactionReference);
        payment.setNotes(notes);
        LocalDateTime now = LocalDateTime.now(clock);
        payment.setCreatedAt(now);
        payment.setUpdatedAt(now);

        payment = paymentRepository.save(payment);

        log.info("Recurring installment payment recorded: payment={}, installment={}, amount={}",
                payment.getId(), installment.getId(), amount);

        return payment;
    }

    public List<Payment> getPaymentsForApplication(@NotNull UUID applicationId) {
        return paymentRepository.findByApplicationIdOrderByCreatedAtAsc(applicationId);
    }

    public boolean hasPayments(@NotNull UUID applicationId) {
        return paymentRepository.existsByApplicationId(applicationId);
    }

    private Payment newPayment(Application application, BigDecimal amount, PaymentType type) {
        LocalDateTime now = LocalDateTime.now(clock);

        Payment payment = new Payment();
        payment.setPaymentNumber(nextPaymentNumber());
        payment.setApplicationId(application.getId());
        payment.setBeneficiaryId(application.getBeneficiaryId());
        payment.setSchemeId(application.getSchemeId());
        payment.setProjectId(application.getProjectId());
        payment.setStateId(application.getStateId());
        payment.setDistrictId(application.getDistrictId());
        payment.setAreaId(application.getAreaId());
        payment.setUnitId(application.getUnitId());
        payment.setAmount(amount);
        payment.setType(type);
        payment.setCreatedAt(now);
        payment.setUpdatedAt(now);
        return payment;
    }

    private String nextPaymentNumber() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        return "PAY-" + LocalDate.now(clock).format(NUMBER_DATE) + "-" + suffix;
    }
}
