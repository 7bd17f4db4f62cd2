package com.nosota.welfare.service;

import com.nosota.welfare.api.request.CustomAmount;
import com.nosota.welfare.api.request.ScheduleConfig;
import com.nosota.welfare.dto.ScheduledInstallment;
import com.nosota.welfare.error.ValidationException;
import com.nosota.welfare.model.DistributionPhase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Computes installment dates and amounts for a recurring schedule.
 *
 * <p>Installment {@code i} (0-based) of a simple schedule falls on
 * {@code startDate + i × period} calendar months, so the first one is on the start
 * date itself. With a distribution timeline the phases supply amounts and dates:
 * a single cycle yields one installment per phase, several cycles repeat every phase
 * once per cycle, shifted by the cycle's month offset.
 *
 * <p>Stateless apart from configuration.
 */
@Component
public class ScheduleCalculator {

    static final int DEFAULT_MAX_PAYMENTS = 60;

    @Value("${recurring-payment.max-payments:60}")
    private int maxPayments = DEFAULT_MAX_PAYMENTS;

    /**
     * Checks a schedule configuration and returns its parsed start date.
     *
     * @param config         The configuration
     * @param amountOptional Whether {@code amountPerPayment} may be omitted (a timeline
     *                       supplies amounts). A supplied non-positive amount is always rejected
     * @return Parsed start date
     * @throws ValidationException listing every violated field
     */
    public LocalDate validate(ScheduleConfig config, boolean amountOptional) {
        if (config == null) {
            throw new ValidationException("config", "is required");
        }

        Map<String, String> errors = new LinkedHashMap<>();

        if (config.period() == null) {
            errors.put("period", "is required");
        }

        Integer count = config.numberOfPayments();
        if (count == null) {
            errors.put("numberOfPayments", "is required");
        } else if (count < 1 || count > maxPayments) {
            errors.put("numberOfPayments", "must be between 1 and " + maxPayments);
        }

        BigDecimal amount = config.amountPerPayment();
        if (amount == null) {
            if (!amountOptional) {
                errors.put("amountPerPayment", "is required");
            }
        } else if (amount.signum() <= 0) {
            errors.put("amountPerPayment", "must be positive");
        }

        LocalDate startDate = null;
        if (config.startDate() == null || config.startDate().isBlank()) {
            errors.put("startDate", "is required");
        } else {
            try {
                startDate = LocalDate.parse(config.startDate().trim());
            } catch (DateTimeParseException e) {
                errors.put("startDate", "must be a date in yyyy-MM-dd format");
            }
        }

        if (config.customAmounts() != null) {
            for (CustomAmount custom : config.customAmounts()) {
                if (custom == null || custom.paymentNumber() == null
                        || custom.paymentNumber() < 1 || (count != null && custom.paymentNumber() > count)) {
                    errors.put("customAmounts.paymentNumber", "must reference an installment of the schedule");
                } else if (custom.amount() == null || custom.amount().signum() <= 0) {
                    errors.put("customAmounts.amount", "must be positive");
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return startDate;
    }

    /**
     * Builds the installments of a schedule.
     *
     * @param config   A configuration accepted by {@link #validate}
     * @param timeline Distribution phases of the application, may be empty
     * @return Installments ordered by payment number
     */
    public List<ScheduledInstallment> buildInstallments(ScheduleConfig config, List<DistributionPhase> timeline) {
        List<DistributionPhase> phases = timeline == null ? List.of() : timeline;
        LocalDate startDate = validate(config, !phases.isEmpty());

        return phases.isEmpty()
                ? buildSimple(config, startDate)
                : buildFromTimeline(config, phases);
    }

    private List<ScheduledInstallment> buildSimple(ScheduleConfig config, LocalDate startDate) {
        int count = config.numberOfPayments();
        long periodMonths = config.period().getMonths();

        Map<Integer, CustomAmount> overrides = new HashMap<>();
        if (config.customAmounts() != null) {
            for (CustomAmount custom : config.customAmounts()) {
                overrides.put(custom.paymentNumber(), custom);
            }
        }

        List<ScheduledInstallment> installments = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int number = i + 1;
            CustomAmount custom = overrides.get(number);

            String description = custom != null && custom.description() != null && !custom.description().isBlank()
                    ? custom.description()
                    : "Payment " + number + " of " + count;

            installments.add(ScheduledInstallment.builder()
                    .paymentNumber(number)
                    .totalPayments(count)
                    .cycleNumber(number)
                    .totalCycles(count)
                    .scheduledDate(startDate.plusMonths(i * periodMonths))
                    .amount(custom != null ? custom.amount() : config.amountPerPayment())
                    .description(description)
                    .build());
        }
        return installments;
    }

    private List<ScheduledInstallment> buildFromTimeline(ScheduleConfig config, List<DistributionPhase> phases) {
        int cycles = config.numberOfPayments();
        int phaseCount = phases.size();
        int total = cycles * phaseCount;
        long periodMonths = config.period().getMonths();

        List<ScheduledInstallment> installments = new ArrayList<>(total);
        for (int cycle = 0; cycle < cycles; cycle++) {
            for (int p = 0; p < phaseCount; p++) {
                DistributionPhase phase = phases.get(p);

                String description = cycles == 1
                        ? phase.getDescription()
                        : phase.getDescription() + " (Cycle " + (cycle + 1) + " of " + cycles + ")";

                installments.add(ScheduledInstallment.builder()
                        .paymentNumber(cycle * phaseCount + p + 1)
                        .totalPayments(total)
                        .cycleNumber(cycle + 1)
                        .totalCycles(cycles)
                        .phaseNumber(p + 1)
                        .totalPhases(phaseCount)
                        .scheduledDate(phase.getExpectedDate().plusMonths(cycle * periodMonths))
                        .amount(phase.getAmount())
                        .description(description)
                        .build());
            }
        }
        return installments;
    }
}
