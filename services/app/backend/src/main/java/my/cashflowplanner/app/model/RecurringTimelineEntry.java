package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record RecurringTimelineEntry(
		LocalDate date,
		String recurringId,
		String merchant,
		BigDecimal expectedAmount,
		String accountId
) {
}
