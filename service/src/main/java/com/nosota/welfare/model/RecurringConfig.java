package com.nosota.welfare.model;

import com.nosota.welfare.api.model.PaymentPeriod;
import com.nosota.welfare.api.model.RecurringScheduleStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Recurring disbursement settings of an application and the progress of its schedule.
 *
 * <p>{@link #nextPaymentDate}, {@link #lastPaymentDate} and {@link #completedPayments}
 * are maintained by {@code RecurringPaymentService} as installments change.
 */
@Embeddable
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class RecurringConfig {

    @Column(name = "is_recurring")
    private Boolean recurring;

    @Enumerated(EnumType.STRING)
    @Column(name = "recurring_period", length = 20)
    private PaymentPeriod period;

    @Column(name = "recurring_number_of_payments")
    private Integer numberOfPayments;

    @Column(name = "recurring_amount_per_payment", precision = 15, scale = 2)
    private BigDecimal amountPerPayment;

    @Column(name = "recurring_start_date")
    private LocalDate startDate;

    @Column(name = "recurring_end_date")
    private LocalDate endDate;

    @Column(name = "recurring_next_payment_date")
    private LocalDate nextPaymentDate;

    @Column(name = "recurring_last_payment_date")
    private LocalDate lastPaymentDate;

    @Column(name = "recurring_completed_payments")
    private Integer completedPayments;

    @Enumerated(EnumType.STRING)
    @Column(name = "recurring_status", length = 20)
    private RecurringScheduleStatus status;
}
