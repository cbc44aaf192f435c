package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * An expected income source. {@code volatility} is a 0-1 coefficient of how variable the amount is.
 * {@code monthlyAmount} is quoted in the stream's own frequency: a weekly figure for WEEKLY, a yearly one for ANNUAL.
 * {@code accountId} names the account the income is paid into; it is optional.
 */
public record IncomeStream(
		String id,
		String name,
		IncomeType type,
		BigDecimal monthlyAmount,
		IncomeFrequency frequency,
		LocalDate nextExpected,
		double volatility,
		String accountId
) {
	public IncomeStream withMonthlyAmount(BigDecimal amount) {
		return new IncomeStream(id, name, type, amount, frequency, nextExpected, volatility, accountId);
	}
}
