package my.cashflowplanner.app.model;

import java.util.List;

/**
 * Caller-supplied snapshot a forecast is computed from. Lists are copied on construction, so an input never
 * changes after it is built; the {@code with*} methods return a new input sharing every untouched list.
 */
public record CashflowInput(
		String userId,
		List<AccountBalance> accounts,
		List<TransactionRecord> transactions,
		List<RecurringPayment> recurringPayments,
		List<IncomeStream> incomeStreams,
		List<LoanSchedule> loanSchedules,
		List<PlannedExpense> plannedExpenses,
		ForecastConfig config
) {
	public CashflowInput {
		accounts = copyOf(accounts, "accounts");
		transactions = copyOf(transactions, "transactions");
		recurringPayments = copyOf(recurringPayments, "recurringPayments");
		incomeStreams = copyOf(incomeStreams, "incomeStreams");
		loanSchedules = copyOf(loanSchedules, "loanSchedules");
		plannedExpenses = copyOf(plannedExpenses, "plannedExpenses");
	}

	private static <T> List<T> copyOf(List<T> values, String name) {
		if (values == null) {
			return List.of();
		}
		for (T value : values) {
			if (value == null) {
				throw new IllegalArgumentException(name + " must not contain null entries");
			}
		}
		return List.copyOf(values);
	}

	public CashflowInput withIncomeStreams(List<IncomeStream> streams) {
		return new CashflowInput(userId, accounts, transactions, recurringPayments, streams, loanSchedules,
				plannedExpenses, config);
	}

	public CashflowInput withRecurringPayments(List<RecurringPayment> payments) {
		return new CashflowInput(userId, accounts, transactions, payments, incomeStreams, loanSchedules,
				plannedExpenses, config);
	}

	public CashflowInput withLoanSchedules(List<LoanSchedule> loans) {
		return new CashflowInput(userId, accounts, transactions, recurringPayments, incomeStreams, loans,
				plannedExpenses, config);
	}

	public CashflowInput withPlannedExpenses(List<PlannedExpense> expenses) {
		return new CashflowInput(userId, accounts, transactions, recurringPayments, incomeStreams, loanSchedules,
				expenses, config);
	}

	public CashflowInput withConfig(ForecastConfig forecastConfig) {
		return new CashflowInput(userId, accounts, transactions, recurringPayments, incomeStreams, loanSchedules,
				plannedExpenses, forecastConfig);
	}
}
