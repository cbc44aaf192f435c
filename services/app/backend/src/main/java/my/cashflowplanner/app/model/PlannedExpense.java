package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PlannedExpense(
		String id,
		String description,
		BigDecimal amount,
		LocalDate date,
		String accountId,
		String category
) {
}
