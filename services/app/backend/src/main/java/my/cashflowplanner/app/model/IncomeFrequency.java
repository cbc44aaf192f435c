package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;

public enum IncomeFrequency {
	WEEKLY(7, new BigDecimal("4.33")),
	FORTNIGHTLY(14, new BigDecimal("2.17")),
	MONTHLY(30, BigDecimal.ONE),
	ANNUAL(365, null);

	private final int intervalDays;
	private final BigDecimal monthlyFactor;

	IncomeFrequency(int intervalDays, BigDecimal monthlyFactor) {
		this.intervalDays = intervalDays;
		this.monthlyFactor = monthlyFactor;
	}

	public int intervalDays() {
		return intervalDays;
	}

	public BigDecimal monthlyFactor() {
		return monthlyFactor;
	}

	/**
	 * Monthly equivalent of one period's amount: times the monthly factor, or divided by 12 for ANNUAL.
	 */
	public BigDecimal toMonthly(BigDecimal periodAmount) {
		return monthlyFactor == null
				? periodAmount.divide(BigDecimal.valueOf(12), MathContext.DECIMAL64)
				: periodAmount.multiply(monthlyFactor);
	}

	public LocalDate advance(LocalDate anchor, long steps) {
		return switch (this) {
			case WEEKLY -> anchor.plusWeeks(steps);
			case FORTNIGHTLY -> anchor.plusWeeks(2 * steps);
			case MONTHLY -> anchor.plusMonths(steps);
			case ANNUAL -> anchor.plusYears(steps);
		};
	}
}
