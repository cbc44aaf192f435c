package my.cashflowplanner.app.model;

import java.math.BigDecimal;

/**
 * A loan and its repayment terms. {@code interestRate} is an annual fraction (0.062 for 6.2%).
 */
public record LoanSchedule(
		String loanId,
		String loanName,
		BigDecimal principal,
		BigDecimal interestRate,
		BigDecimal monthlyRepayment,
		int repaymentDay,
		boolean interestOnly,
		String offsetAccountId,
		BigDecimal offsetBalance
) {
	public LoanSchedule withRateAndRepayment(BigDecimal rate, BigDecimal repayment) {
		return new LoanSchedule(loanId, loanName, principal, rate, repayment, repaymentDay, interestOnly,
				offsetAccountId, offsetBalance);
	}
}
