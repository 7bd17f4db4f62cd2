package com.nosota.welfare.service;

import com.nosota.welfare.api.model.PaymentPeriod;
import com.nosota.welfare.api.request.CustomAmount;
import com.nosota.welfare.api.request.ScheduleConfig;
import com.nosota.welfare.dto.ScheduledInstallment;
import com.nosota.welfare.error.ValidationException;
import com.nosota.welfare.model.DistributionPhase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Schedule calculator")
class ScheduleCalculatorTest {

    private final ScheduleCalculator calculator = new ScheduleCalculator();

    @Test
    @DisplayName("Monthly schedule starts on the start date and advances one calendar month per installment")
    void monthlySchedule() {
        List<ScheduledInstallment> installments = calculator.buildInstallments(
                new ScheduleConfig(PaymentPeriod.MONTHLY, 6, new BigDecimal("1000"), "2024-01-01"), List.of());

        assertThat(installments).extracting(ScheduledInstallment::scheduledDate).containsExactly(
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1), LocalDate.of(2024, 3, 1),
                LocalDate.of(2024, 4, 1), LocalDate.of(2024, 5, 1), LocalDate.of(2024, 6, 1));
        assertThat(installments).extracting(ScheduledInstallment::paymentNumber).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(installments).allSatisfy(i -> {
            assertThat(i.totalPayments()).isEqualTo(6);
            assertThat(i.amount()).isEqualByComparingTo("1000");
            assertThat(i.phaseNumber()).isNull();
        });
        assertThat(installments.get(2).description()).isEqualTo("Payment 3 of 6");
    }

    @Test
    @DisplayName("Quarterly, semi-annual and annual cadences use 3, 6 and 12 months")
    void periodMonths() {
        assertThat(calculator.buildInstallments(
                new ScheduleConfig(PaymentPeriod.QUARTERLY, 3, BigDecimal.TEN, "2024-01-15"), List.of()))
                .extracting(ScheduledInstallment::scheduledDate)
                .containsExactly(LocalDate.of(2024, 1, 15), LocalDate.of(2024, 4, 15), LocalDate.of(2024, 7, 15));

        assertThat(calculator.buildInstallments(
                new ScheduleConfig(PaymentPeriod.SEMI_ANNUALLY, 2, BigDecimal.TEN, "2024-01-15"), List.of()))
                .extracting(ScheduledInstallment::scheduledDate)
                .containsExactly(LocalDate.of(2024, 1, 15), LocalDate.of(2024, 7, 15));

        assertThat(calculator.buildInstallments(
                new ScheduleConfig(PaymentPeriod.ANNUALLY, 2, BigDecimal.TEN, "2024-01-15"), List.of()))
                .extracting(ScheduledInstallment::scheduledDate)
                .containsExactly(LocalDate.of(2024, 1, 15), LocalDate.of(2025, 1, 15));
    }

    @Test
    @DisplayName("Month-end start dates are clamped per month, not accumulated")
    void monthEndStart() {
        List<ScheduledInstallment> installments = calculator.buildInstallments(
                new ScheduleConfig(PaymentPeriod.MONTHLY, 3, BigDecimal.TEN, "2024-01-31"), List.of());

        assertThat(installments).extracting(ScheduledInstallment::scheduledDate).containsExactly(
                LocalDate.of(2024, 1, 31), LocalDate.of(2024, 2, 29), LocalDate.of(2024, 3, 31));
    }

    @Test
    @DisplayName("Number of payments is bounded to 1..60")
    void numberOfPaymentsBounds() {
        assertThatThrownBy(() -> calculator.validate(
                new ScheduleConfig(PaymentPeriod.MONTHLY, 61, BigDecimal.TEN, "2024-01-01"), false))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getFieldErrors()).containsKey("numberOfPayments"));

        assertThatThrownBy(() -> calculator.validate(
                new ScheduleConfig(PaymentPeriod.MONTHLY, 0, BigDecimal.TEN, "2024-01-01"), false))
                .isInstanceOf(ValidationException.class);

        assertThat(calculator.buildInstallments(
                new ScheduleConfig(PaymentPeriod.MONTHLY, 60, BigDecimal.TEN, "2024-01-01"), List.of()))
                .hasSize(60)
                .last()
                .satisfies(i -> assertThat(i.scheduledDate()).isEqualTo(LocalDate.of(2028, 12, 1)));
    }

    @Test
    @DisplayName("Non-positive amounts and unparseable start dates are rejected with field errors")
    void invalidAmountAndDate() {
        assertThatThrownBy(() -> calculator.validate(
                new ScheduleConfig(PaymentPeriod.MONTHLY, 3, BigDecimal.ZERO, "01/02/2024"), true))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getFieldErrors())
                        .containsOnlyKeys("amountPerPayment", "startDate"));

        assertThatThrownBy(() -> calculator.validate(
                new ScheduleConfig(PaymentPeriod.MONTHLY, 3, new BigDecimal("-5"), "2024-02-30"), true))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Amount per payment may only be omitted when a timeline supplies amounts")
    void amountRequiredWithoutTimeline() {
        ScheduleConfig config = new ScheduleConfig(PaymentPeriod.MONTHLY, 2, null, "2024-01-01");

        assertThatThrownBy(() -> calculator.buildInstallments(config, List.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("amountPerPayment");

        List<DistributionPhase> timeline = List.of(
                new DistributionPhase("Tuition", new BigDecimal("500"), LocalDate.of(2024, 1, 10)));
        assertThat(calculator.buildInstallments(config, timeline)).hasSize(2);
    }

    @Test
    @DisplayName("Custom amounts override single installments")
    void customAmounts() {
        ScheduleConfig config = new ScheduleConfig(PaymentPeriod.MONTHLY, 3, new BigDecimal("100"), "2024-01-01",
                List.of(new CustomAmount(2, new BigDecimal("250"), "Festival bonus")));

        List<ScheduledInstallment> installments = calculator.buildInstallments(config, List.of());

        assertThat(installments).extracting(ScheduledInstallment::amount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("100"), new BigDecimal("250"), new BigDecimal("100"));
        assertThat(installments.get(1).description()).isEqualTo("Festival bonus");
    }

    @Test
    @DisplayName("Custom amount outside the schedule is rejected")
    void customAmountOutOfRange() {
        ScheduleConfig config = new ScheduleConfig(PaymentPeriod.MONTHLY, 3, new BigDecimal("100"), "2024-01-01",
                List.of(new CustomAmount(4, new BigDecimal("250"), null)));

        assertThatThrownBy(() -> calculator.validate(config, false))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Single cycle with a timeline yields one installment per phase with the phase's amount and date")
    void timelineSingleCycle() {
        List<DistributionPhase> timeline = List.of(
                new DistributionPhase("Admission", new BigDecimal("3000"), LocalDate.of(2024, 6, 1)),
                new DistributionPhase("Books", new BigDecimal("2000"), LocalDate.of(2024, 9, 15)));

        List<ScheduledInstallment> installments = calculator.buildInstallments(
                new ScheduleConfig(PaymentPeriod.MONTHLY, 1, null, "2024-01-01"), timeline);

        assertThat(installments).hasSize(2);
        assertThat(installments.get(0).scheduledDate()).isEqualTo(LocalDate.of(2024, 6, 1));
        assertThat(installments.get(0).amount()).isEqualByComparingTo("3000");
        assertThat(installments.get(0).description()).isEqualTo("Admission");
        assertThat(installments.get(1).scheduledDate()).isEqualTo(LocalDate.of(2024, 9, 15));
        assertThat(installments.get(1).phaseNumber()).isEqualTo(2);
        assertThat(installments.get(1).totalPhases()).isEqualTo(2);
        assertThat(installments).allSatisfy(i -> {
            assertThat(i.cycleNumber()).isEqualTo(1);
            assertThat(i.totalPayments()).isEqualTo(2);
        });
    }

    @Test
    @DisplayName("Several cycles repeat every phase, shifted by the cycle's month offset")
    void timelineSeveralCycles() {
        List<DistributionPhase> timeline = List.of(
                new DistributionPhase("Ration", new BigDecimal("400"), LocalDate.of(2024, 1, 5)),
                new DistributionPhase("Medicine", new BigDecimal("600"), LocalDate.of(2024, 1, 20)));

        List<ScheduledInstallment> installments = calculator.buildInstallments(
                new ScheduleConfig(PaymentPeriod.QUARTERLY, 3, null, "2024-01-01"), timeline);

        assertThat(installments).hasSize(6);
        assertThat(installments).extracting(ScheduledInstallment::paymentNumber).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(installments).allSatisfy(i -> assertThat(i.totalPayments()).isEqualTo(6));

        ScheduledInstallment third = installments.get(2);
        assertThat(third.cycleNumber()).isEqualTo(2);
        assertThat(third.phaseNumber()).isEqualTo(1);
        assertThat(third.scheduledDate()).isEqualTo(LocalDate.of(2024, 4, 5));
        assertThat(third.description()).isEqualTo("Ration (Cycle 2 of 3)");

        ScheduledInstallment last = installments.get(5);
        assertThat(last.cycleNumber()).isEqualTo(3);
        assertThat(last.phaseNumber()).isEqualTo(2);
        assertThat(last.scheduledDate()).isEqualTo(LocalDate.of(2024, 7, 20));
        assertThat(last.amount()).isEqualByComparingTo("600");
    }
}
