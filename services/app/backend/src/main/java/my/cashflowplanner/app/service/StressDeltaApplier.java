package my.cashflowplanner.app.service;

import my.cashflowplanner.app.model.CashflowInput;
import my.cashflowplanner.app.model.IncomeStream;
import my.cashflowplanner.app.model.LoanSchedule;
import my.cashflowplanner.app.model.PlannedExpense;
import my.cashflowplanner.app.model.RecurringPayment;
import my.cashflowplanner.app.model.StressParameters;
import my.cashflowplanner.app.service.util.MoneyMath;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a perturbed copy of a snapshot. Only the lists a parameter touches are rebuilt; the original input is
 * never modified.
 */
@Component
public class StressDeltaApplier {
	public static final String EXPENSE_SHOCK_ID = "expense-shock";
	private static final int DEFAULT_SHOCK_DELAY_DAYS = 7;
	private static final BigDecimal BASIS_POINTS = BigDecimal.valueOf(10_000);

	public CashflowInput apply(CashflowInput input, StressParameters parameters) {
		if (parameters == null) {
			return input;
		}
		CashflowInput stressed = input;
		if (parameters.incomeDropPercent() != null) {
			BigDecimal factor = BigDecimal.ONE.subtract(percent(parameters.incomeDropPercent()));
			List<IncomeStream> streams = new ArrayList<>(input.incomeStreams().size());
			for (IncomeStream stream : input.incomeStreams()) {
				streams.add(stream.withMonthlyAmount(MoneyMath.scale(stream.monthlyAmount(), factor)));
			}
			stressed = stressed.withIncomeStreams(streams);
		}
		if (parameters.expenseInflationPercent() != null) {
			BigDecimal factor = BigDecimal.ONE.add(percent(parameters.expenseInflationPercent()));
			List<RecurringPayment> payments = new ArrayList<>(input.recurringPayments().size());
			for (RecurringPayment payment : input.recurringPayments()) {
				payments.add(payment.withExpectedAmount(MoneyMath.scale(payment.expectedAmount(), factor)));
			}
			stressed = stressed.withRecurringPayments(payments);
		}
		if (parameters.interestRateIncreaseBps() != null) {
			BigDecimal increase = BigDecimal.valueOf(parameters.interestRateIncreaseBps())
					.divide(BASIS_POINTS, MathContext.DECIMAL64);
			List<LoanSchedule> loans = new ArrayList<>(input.loanSchedules().size());
			for (LoanSchedule loan : input.loanSchedules()) {
				BigDecimal rate = MoneyMath.safe(loan.interestRate()).add(increase);
				loans.add(loan.withRateAndRepayment(rate, repaymentAt(loan, rate)));
			}
			stressed = stressed.withLoanSchedules(loans);
		}
		if (parameters.expenseShockAmount() != null) {
			LocalDate date = parameters.expenseShockDate() != null
					? parameters.expenseShockDate()
					: input.config().today().plusDays(DEFAULT_SHOCK_DELAY_DAYS);
			List<PlannedExpense> planned = new ArrayList<>(input.plannedExpenses());
			planned.add(new PlannedExpense(EXPENSE_SHOCK_ID, "Unexpected expense (stress test)",
					MoneyMath.money(parameters.expenseShockAmount()), date, null, null));
			stressed = stressed.withPlannedExpenses(planned);
		}
		return stressed;
	}

	/**
	 * Interest-only loans pay the new monthly interest; amortising loans are re-amortised over 30 years.
	 */
	static BigDecimal repaymentAt(LoanSchedule loan, BigDecimal rate) {
		if (loan.interestOnly()) {
			return MoneyMath.interestOnlyMonthlyPayment(loan.principal(), rate);
		}
		return MoneyMath.amortisedMonthlyPayment(loan.principal(), rate);
	}

	private static BigDecimal percent(BigDecimal value) {
		return value.divide(MoneyMath.ONE_HUNDRED, MathContext.DECIMAL64);
	}
}
