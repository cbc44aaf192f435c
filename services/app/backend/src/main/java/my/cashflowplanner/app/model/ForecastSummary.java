package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Rollups over the first 30 and 90 simulated days. {@code withdrawableCash} is the current balance less a
 * three month burn buffer, never negative.
 */
public record ForecastSummary(
		BigDecimal avgDailyBalance30,
		BigDecimal totalIncome30,
		BigDecimal totalExpenses30,
		BigDecimal netCashflow30,
		BigDecimal avgDailyBalance90,
		BigDecimal totalIncome90,
		BigDecimal totalExpenses90,
		BigDecimal netCashflow90,
		BigDecimal monthlyBurnRate,
		BigDecimal threeMonthBurnRate,
		BigDecimal withdrawableCash,
		LocalDate withdrawableDate
) {
}
