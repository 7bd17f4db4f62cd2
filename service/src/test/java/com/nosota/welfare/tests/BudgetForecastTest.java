package com.nosota.welfare.tests;

import com.nosota.welfare.TestBase;
import com.nosota.welfare.api.model.ApplicationStatus;
import com.nosota.welfare.api.model.RecurringPaymentStatus;
import com.nosota.welfare.api.request.ForecastFilter;
import com.nosota.welfare.api.response.BudgetForecastResponse;
import com.nosota.welfare.api.response.MonthlyForecast;
import com.nosota.welfare.model.Application;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.YearMonth;

import static org.assertj.core.api.Assertions.assertThat;

class BudgetForecastTest extends TestBase {

    @Test
    void forecastSumsPendingInstallmentsPerMonthWithBacklogInFirstMonth() {
        Application application = createApplication(ApplicationStatus.APPROVED);
        Application other = createApplication(ApplicationStatus.APPROVED);
        YearMonth month = YearMonth.now(clock);

        createInstallment(application, 1, month.atDay(1), "100", RecurringPaymentStatus.OVERDUE);
        createInstallment(application, 2, month.plusMonths(1).atDay(1), "200", RecurringPaymentStatus.SCHEDULED);
        createInstallment(application, 3, month.plusMonths(2).atDay(1), "300", RecurringPaymentStatus.SCHEDULED);
        createInstallment(application, 4, month.plusMonths(1).atDay(15), "500", RecurringPaymentStatus.CANCELLED);
        createInstallment(application, 5, month.atDay(2), "700", RecurringPaymentStatus.COMPLETED);
        createInstallment(application, 6, month.minusMonths(1).atDay(5), "40", RecurringPaymentStatus.OVERDUE);
        createInstallment(other, 1, month.plusMonths(1).atDay(1), "900", RecurringPaymentStatus.SCHEDULED);

        BudgetForecastResponse forecast = forecastService.getBudgetForecast(3,
                new ForecastFilter(application.getSchemeId(), null, null, null));

        assertThat(forecast.summary().totalAmount()).isEqualByComparingTo("640");
        assertThat(forecast.summary().totalPayments()).isEqualTo(4);
        assertThat(forecast.summary().overdueAmount()).isEqualByComparingTo("140");
        assertThat(forecast.monthlyForecast()).extracting(MonthlyForecast::totalAmount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("140"), new BigDecimal("200"), new BigDecimal("300"));

        BudgetForecastResponse everything = forecastService.getBudgetForecast(3, ForecastFilter.none());

        assertThat(everything.summary().totalAmount()).isEqualByComparingTo("1540");
        assertThat(everything.schemeBreakdown()).hasSize(2);
        assertThat(everything.schemeBreakdown().get(0).id()).isEqualTo(other.getSchemeId());
    }
}
