package my.cashflowplanner.app.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import my.cashflowplanner.app.model.AccountBalance;
import my.cashflowplanner.app.model.ExpenseAttribution;
import my.cashflowplanner.app.model.IncomeStream;
import my.cashflowplanner.app.model.LoanSchedule;
import my.cashflowplanner.app.model.PlannedExpense;
import my.cashflowplanner.app.model.RecurringPayment;
import my.cashflowplanner.app.model.SpendingProfile;
import my.cashflowplanner.app.model.TransactionRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Full household snapshot posted by the caller. Unset settings fall back to {@code app.cashflow.forecast.*};
 * {@code today} falls back to the application clock. {@code spendingProfile} is only read by optimisation and is
 * derived from the transactions when absent.
 */
public record CashflowRequest(
		@NotBlank String userId,
		@NotEmpty List<AccountBalance> accounts,
		List<TransactionRecord> transactions,
		List<RecurringPayment> recurringPayments,
		List<IncomeStream> incomeStreams,
		List<LoanSchedule> loanSchedules,
		List<PlannedExpense> plannedExpenses,
		@Min(0) Integer forecastDays,
		Boolean includeConfidenceBands,
		LocalDate today,
		ExpenseAttribution attribution,
		Boolean normaliseIncome,
		SpendingProfile spendingProfile
) {
}
