package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record AccountBalance(
		String accountId,
		String accountName,
		AccountType accountType,
		BigDecimal currentBalance,
		LocalDate lastUpdated,
		String linkedLoanId
) {
}
