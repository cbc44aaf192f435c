package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A perturbation of a forecast snapshot. Every field is optional; a null field leaves that part of the snapshot
 * untouched. {@code interestRateIncreaseBps} is in basis points, percentages are 0-100.
 * {@code incomeDropDurationMonths} is informational: the income drop covers the whole forecast horizon.
 */
public record StressParameters(
		BigDecimal incomeDropPercent,
		Integer incomeDropDurationMonths,
		BigDecimal expenseShockAmount,
		LocalDate expenseShockDate,
		BigDecimal expenseInflationPercent,
		Integer interestRateIncreaseBps
) {
	public boolean isEmpty() {
		return incomeDropPercent == null
				&& expenseShockAmount == null
				&& expenseInflationPercent == null
				&& interestRateIncreaseBps == null;
	}
}
