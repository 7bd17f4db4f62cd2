package com.nosota.welfare.api.response;

import java.util.List;

/**
 * Budget forecast over the next N calendar months.
 *
 * @param summary           Totals over the whole window
 * @param monthlyForecast   One entry per month of the window, in chronological order
 * @param schemeBreakdown   Totals per scheme
 * @param projectBreakdown  Totals per project
 */
public record BudgetForecastResponse(
        ForecastSummary summary,
        List<MonthlyForecast> monthlyForecast,
        List<ForecastBreakdown> schemeBreakdown,
        List<ForecastBreakdown> projectBreakdown
) {
}
