package my.cashflowplanner.app.service;

import my.cashflowplanner.app.model.AccountBalance;
import my.cashflowplanner.app.model.CashflowInput;
import my.cashflowplanner.app.model.IncomeStream;
import my.cashflowplanner.app.model.LoanSchedule;
import my.cashflowplanner.app.model.PlannedExpense;
import my.cashflowplanner.app.model.RecurringPayment;
import my.cashflowplanner.app.model.StressParameters;
import my.cashflowplanner.app.model.TransactionRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Boundary checks for caller snapshots. Returns every problem found, the caller decides how to reject.
 */
@Component
public class CashflowInputValidator {
	private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

	public List<String> validate(CashflowInput input, int maxForecastDays) {
		List<String> errors = new ArrayList<>();
		if (input == null) {
			errors.add("Cashflow snapshot is empty");
			return errors;
		}
		if (input.config() != null && input.config().forecastDays() != null) {
			int days = input.config().forecastDays();
			if (days < 0) {
				errors.add("config.forecastDays must not be negative");
			} else if (days > maxForecastDays) {
				errors.add("config.forecastDays must not exceed " + maxForecastDays);
			}
		}
		Set<String> accountIds = new HashSet<>();
		for (AccountBalance account : input.accounts()) {
			if (account.accountId() == null || account.accountId().isBlank()) {
				errors.add("account.accountId is required");
			} else if (!accountIds.add(account.accountId())) {
				errors.add("account.accountId must be unique: " + account.accountId());
			}
			if (account.currentBalance() == null) {
				errors.add("account.currentBalance is required for " + account.accountId());
			}
		}
		for (TransactionRecord tx : input.transactions()) {
			if (tx.date() == null) {
				errors.add("transaction.date is required");
			} else if (tx.amount() == null) {
				errors.add("transaction.amount is required for " + tx.id());
			} else if (tx.direction() == null) {
				errors.add("transaction.direction is required for " + tx.id());
			}
		}
		for (RecurringPayment payment : input.recurringPayments()) {
			if (payment.pattern() == null) {
				errors.add("recurringPayment.pattern is required for " + payment.id());
			}
			if (payment.expectedAmount() == null || payment.expectedAmount().signum() < 0) {
				errors.add("recurringPayment.expectedAmount must be zero or positive for " + payment.id());
			}
			if (payment.active() && payment.nextExpected() == null && payment.lastOccurrence() == null) {
				errors.add("recurringPayment needs nextExpected or lastOccurrence: " + payment.id());
			}
		}
		for (IncomeStream stream : input.incomeStreams()) {
			if (stream.frequency() == null) {
				errors.add("incomeStream.frequency is required for " + stream.id());
			}
			if (stream.monthlyAmount() == null || stream.monthlyAmount().signum() < 0) {
				errors.add("incomeStream.monthlyAmount must be zero or positive for " + stream.id());
			}
			if (stream.volatility() < 0.0 || stream.volatility() > 1.0) {
				errors.add("incomeStream.volatility must be between 0 and 1 for " + stream.id());
			}
		}
		for (LoanSchedule loan : input.loanSchedules()) {
			if (loan.repaymentDay() < 1 || loan.repaymentDay() > 31) {
				errors.add("loan.repaymentDay must be between 1 and 31 for " + loan.loanId());
			}
			if (loan.principal() == null || loan.principal().signum() < 0) {
				errors.add("loan.principal must be zero or positive for " + loan.loanId());
			}
			if (loan.interestRate() == null || loan.interestRate().signum() < 0) {
				errors.add("loan.interestRate must be zero or positive for " + loan.loanId());
			}
			if (loan.monthlyRepayment() == null || loan.monthlyRepayment().signum() < 0) {
				errors.add("loan.monthlyRepayment must be zero or positive for " + loan.loanId());
			}
		}
		for (PlannedExpense expense : input.plannedExpenses()) {
			if (expense.date() == null) {
				errors.add("plannedExpense.date is required");
			} else if (expense.amount() == null || expense.amount().signum() < 0) {
				errors.add("plannedExpense.amount must be zero or positive for " + expense.id());
			}
		}
		return errors;
	}

	public List<String> validate(StressParameters parameters) {
		List<String> errors = new ArrayList<>();
		if (parameters == null) {
			errors.add("Stress parameters are empty");
			return errors;
		}
		if (parameters.incomeDropPercent() != null && outsidePercentRange(parameters.incomeDropPercent())) {
			errors.add("incomeDropPercent must be between 0 and 100");
		}
		if (parameters.incomeDropDurationMonths() != null && parameters.incomeDropDurationMonths() < 0) {
			errors.add("incomeDropDurationMonths must not be negative");
		}
		if (parameters.expenseShockAmount() != null && parameters.expenseShockAmount().signum() < 0) {
			errors.add("expenseShockAmount must not be negative");
		}
		if (parameters.expenseInflationPercent() != null && parameters.expenseInflationPercent().compareTo(ONE_HUNDRED.negate()) < 0) {
			errors.add("expenseInflationPercent must not be below -100");
		}
		return errors;
	}

	private static boolean outsidePercentRange(BigDecimal value) {
		return value.signum() < 0 || value.compareTo(ONE_HUNDRED) > 0;
	}
}
