package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record TransactionRecord(
		String id,
		String accountId,
		LocalDate date,
		BigDecimal amount,
		Direction direction,
		String categoryLevel1,
		String categoryLevel2,
		String merchant,
		boolean recurring
) {
}
