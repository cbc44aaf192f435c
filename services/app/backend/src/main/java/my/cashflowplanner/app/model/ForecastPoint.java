package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One simulated day. {@code predictedRecurring} holds every scheduled outflow (recurring payments, loan repayments
 * and planned expenses); {@code predictedNonRecurring} is the pattern-based discretionary estimate.
 * Bounds are only set when confidence bands were requested; {@code shortfallAmount} only when the balance is negative.
 */
public record ForecastPoint(
		LocalDate date,
		BigDecimal predictedBalance,
		BigDecimal predictedIncome,
		BigDecimal predictedExpenses,
		BigDecimal predictedRecurring,
		BigDecimal predictedNonRecurring,
		double confidenceScore,
		double volatilityFactor,
		BigDecimal upperBound,
		BigDecimal lowerBound,
		boolean shortfallRisk,
		BigDecimal shortfallAmount
) {
}
