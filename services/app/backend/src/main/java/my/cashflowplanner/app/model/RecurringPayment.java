package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Recurring outflow detected by the categorisation pipeline. {@code lastPriceChange} is the signed change of the
 * expected amount at the most recent price change, when one was observed.
 */
public record RecurringPayment(
		String id,
		String merchant,
		String accountId,
		RecurrencePattern pattern,
		BigDecimal expectedAmount,
		LocalDate nextExpected,
		LocalDate lastOccurrence,
		boolean active,
		Boolean priceIncreaseAlert,
		BigDecimal lastPriceChange,
		LocalDate lastPriceChangeDate
) {
	public RecurringPayment withExpectedAmount(BigDecimal amount) {
		return new RecurringPayment(id, merchant, accountId, pattern, amount, nextExpected, lastOccurrence, active,
				priceIncreaseAlert, lastPriceChange, lastPriceChangeDate);
	}

	public LocalDate anchorDate() {
		if (nextExpected != null) {
			return nextExpected;
		}
		return lastOccurrence == null || pattern == null ? null : pattern.next(lastOccurrence);
	}
}
