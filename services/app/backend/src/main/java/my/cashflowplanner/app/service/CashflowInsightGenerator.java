package my.cashflowplanner.app.service;

import my.cashflowplanner.app.model.CashflowForecast;
import my.cashflowplanner.app.model.CashflowInsight;
import my.cashflowplanner.app.model.ForecastSummary;
import my.cashflowplanner.app.model.InsightCategory;
import my.cashflowplanner.app.model.InsightSeverity;
import my.cashflowplanner.app.model.LinkedEntities;
import my.cashflowplanner.app.model.ShortfallAnalysis;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.FundMovementKind;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.FundMovementRecommendation;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.OptimisationResult;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.RepaymentOptimisation;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.SpendingInefficiency;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.SubscriptionAnalysis;
import my.cashflowplanner.app.service.StressTestEngine.StressTestOutput;
import my.cashflowplanner.app.service.StressTestEngine.StressTestResult;
import my.cashflowplanner.app.service.util.MoneyMath;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Translates engine output into user-facing insights. Applies fixed thresholds only; never computes new figures
 * beyond simple ratios of what it is given.
 */
@Service
public class CashflowInsightGenerator {
	private static final int SHORTFALL_CRITICAL_DAYS = 14;
	private static final int SHORTFALL_WARNING_DAYS = 30;
	private static final BigDecimal LOW_BUFFER_MONTHS = BigDecimal.valueOf(2);
	private static final double HIGH_BURN_RATIO = 0.9;
	private static final BigDecimal OPPORTUNITY_FLOOR = new BigDecimal("100");
	private static final BigDecimal LOAN_INSIGHT_FLOOR = new BigDecimal("500");
	private static final int MAX_INEFFICIENCY_INSIGHTS = 5;
	private static final int LATE_BREAK_EVEN_DAY = 20;

	private static final Comparator<CashflowInsight> ORDER = Comparator
			.comparing(CashflowInsight::severity)
			.thenComparing((CashflowInsight insight) -> MoneyMath.safe(insight.valueEstimate()), Comparator.reverseOrder());

	public List<CashflowInsight> generate(String userId,
									  CashflowForecast forecast,
									  OptimisationResult optimisation,
									  StressTestOutput stress,
									  Instant createdAt) {
		InsightFactory factory = new InsightFactory(userId, createdAt);
		List<CashflowInsight> insights = new ArrayList<>();
		if (forecast != null) {
			forecastInsights(forecast, factory, insights);
			liquidityInsights(forecast.summary(), factory, insights);
		}
		if (optimisation != null) {
			optimisationInsights(optimisation, factory, insights);
			subscriptionInsights(optimisation, factory, insights);
		}
		if (stress != null) {
			resilienceInsights(stress, factory, insights);
		}
		insights.sort(ORDER);
		return List.copyOf(insights);
	}

	public List<CashflowInsight> highPriority(List<CashflowInsight> insights) {
		return insights.stream()
				.filter(insight -> insight.severity() == InsightSeverity.CRITICAL || insight.severity() == InsightSeverity.HIGH)
				.toList();
	}

	public List<CashflowInsight> unread(List<CashflowInsight> insights) {
		return insights.stream().filter(insight -> !insight.read() && !insight.dismissed()).toList();
	}

	public BigDecimal totalSavingsPotential(List<CashflowInsight> insights) {
		BigDecimal total = BigDecimal.ZERO;
		for (CashflowInsight insight : insights) {
			total = total.add(MoneyMath.safe(insight.savingsPotential()));
		}
		return MoneyMath.money(total);
	}

	public Map<InsightCategory, List<CashflowInsight>> groupByCategory(List<CashflowInsight> insights) {
		Map<InsightCategory, List<CashflowInsight>> grouped = new EnumMap<>(InsightCategory.class);
		for (CashflowInsight insight : insights) {
			grouped.computeIfAbsent(insight.category(), key -> new ArrayList<>()).add(insight);
		}
		return grouped;
	}

	private void forecastInsights(CashflowForecast forecast, InsightFactory factory, List<CashflowInsight> insights) {
		ShortfallAnalysis shortfalls = forecast.shortfallAnalysis();
		ForecastSummary summary = forecast.summary();
		if (shortfalls.hasShortfall() && shortfalls.firstShortfallDate() != null) {
			long daysUntil = ChronoUnit.DAYS.between(forecast.generatedFor(), shortfalls.firstShortfallDate());
			BigDecimal amount = shortfalls.maxShortfallAmount();
			if (daysUntil <= SHORTFALL_CRITICAL_DAYS) {
				insights.add(factory.create("insight-shortfall-imminent", InsightSeverity.CRITICAL,
						InsightCategory.LIQUIDITY_RISK, "Cash Shortfall Imminent",
						"You are predicted to have a cash shortfall of $" + MoneyMath.round(amount) + " in " + daysUntil
								+ " days. Immediate action required.",
						"Transfer funds from savings or reduce upcoming expenses to avoid overdraft.",
						shortfalls.accountsAtRisk(), List.of(), amount, MoneyMath.scale(amount, 0.1), 0.9,
						LinkedEntities.ofAccounts(shortfalls.accountsAtRisk())));
			} else if (daysUntil <= SHORTFALL_WARNING_DAYS) {
				insights.add(factory.create("insight-shortfall-warning", InsightSeverity.HIGH,
						InsightCategory.LIQUIDITY_RISK, "Cash Shortfall Predicted",
						"Based on current patterns, you may experience a shortfall of $" + MoneyMath.round(amount)
								+ " in approximately " + daysUntil + " days.",
						"Review upcoming expenses and consider adjusting payment schedules or building buffer.",
						shortfalls.accountsAtRisk(), List.of(), amount, null, 0.8, null));
			}
		}
		if (forecast.volatilityIndex() > 50.0) {
			insights.add(factory.create("insight-volatility",
					forecast.volatilityIndex() > 70.0 ? InsightSeverity.HIGH : InsightSeverity.MEDIUM,
					InsightCategory.ANOMALY, "High Cashflow Volatility",
					"Your cashflow volatility index is " + Math.round(forecast.volatilityIndex())
							+ "/100. This indicates unpredictable spending patterns.",
					"Consider creating a budget and tracking expenses more closely to reduce variability.",
					List.of(), List.of(), MoneyMath.scale(summary.monthlyBurnRate(), 0.1), null, 0.85, null));
		}
		BigDecimal net30 = summary.netCashflow30();
		if (net30.signum() < 0) {
			BigDecimal deficit = net30.abs();
			insights.add(factory.create("insight-negative-cashflow",
					net30.compareTo(new BigDecimal("-1000")) < 0 ? InsightSeverity.HIGH : InsightSeverity.MEDIUM,
					InsightCategory.LIQUIDITY_RISK, "Negative Net Cashflow",
					"You are spending $" + MoneyMath.round(deficit) + " more than you earn over the next 30 days.",
					"Review expenses and identify areas to cut back, or explore ways to increase income.",
					List.of(), List.of(), deficit, MoneyMath.scale(deficit, 0.2), 0.9, null));
		}
	}

	private void liquidityInsights(ForecastSummary summary, InsightFactory factory, List<CashflowInsight> insights) {
		BigDecimal burn = summary.monthlyBurnRate();
		if (burn.signum() > 0) {
			BigDecimal months = summary.withdrawableCash().divide(burn, MathContext.DECIMAL64);
			if (months.compareTo(LOW_BUFFER_MONTHS) < 0) {
				insights.add(factory.create("insight-low-buffer",
						months.compareTo(BigDecimal.ONE) < 0 ? InsightSeverity.HIGH : InsightSeverity.MEDIUM,
						InsightCategory.LIQUIDITY_RISK, "Low Emergency Buffer",
						"You only have " + months.setScale(1, RoundingMode.HALF_UP).toPlainString()
								+ " months of expenses in reserve. Recommended: 3-6 months.",
						"Prioritise building an emergency fund of at least 3 months expenses.",
						List.of(), List.of(), MoneyMath.money(burn.multiply(BigDecimal.valueOf(3).subtract(months))), null,
						0.95, null));
			}
		}
		BigDecimal income = summary.totalIncome30().signum() == 0 ? BigDecimal.ONE : summary.totalIncome30();
		double burnRatio = burn.divide(income, MathContext.DECIMAL64).doubleValue();
		if (burnRatio > HIGH_BURN_RATIO) {
			insights.add(factory.create("insight-high-burn-rate",
					burnRatio > 1.0 ? InsightSeverity.HIGH : InsightSeverity.MEDIUM,
					InsightCategory.INEFFICIENCY, "High Burn Rate",
					"You're spending " + Math.round(burnRatio * 100.0) + "% of your income. This leaves little room for savings.",
					"Aim to reduce spending to 70-80% of income.",
					List.of(), List.of(), MoneyMath.scale(burn, 0.1), MoneyMath.scale(burn, 0.1), 0.9, null));
		}
	}

	private void optimisationInsights(OptimisationResult optimisation, InsightFactory factory, List<CashflowInsight> insights) {
		List<SpendingInefficiency> inefficiencies = optimisation.inefficiencies().stream()
				.filter(inefficiency -> inefficiency.potentialSavings().compareTo(OPPORTUNITY_FLOOR) > 0)
				.limit(MAX_INEFFICIENCY_INSIGHTS)
				.toList();
		for (int i = 0; i < inefficiencies.size(); i++) {
			SpendingInefficiency inefficiency = inefficiencies.get(i);
			insights.add(factory.create("insight-ineff-" + i,
					InsightSeverity.fromValue(inefficiency.potentialSavings()),
					inefficiency.category(),
					"Savings Opportunity: " + inefficiency.merchantOrCategory(),
					inefficiency.description(),
					"Review spending in " + inefficiency.merchantOrCategory() + ". Potential savings: $"
							+ MoneyMath.round(inefficiency.potentialSavings()),
					List.of(), List.of(inefficiency.merchantOrCategory()), inefficiency.potentialSavings(),
					inefficiency.potentialSavings(), inefficiency.confidenceScore(), null));
		}

		List<FundMovementRecommendation> movements = optimisation.fundMovements().stream()
				.filter(movement -> movement.projectedBenefit().compareTo(OPPORTUNITY_FLOOR) > 0)
				.toList();
		for (int i = 0; i < movements.size(); i++) {
			FundMovementRecommendation movement = movements.get(i);
			List<String> accounts = List.of(movement.fromAccountId(), movement.toAccountId());
			insights.add(factory.create("insight-fund-move-" + i,
					movement.urgency() == CashflowOptimisationEngine.Urgency.HIGH ? InsightSeverity.HIGH : InsightSeverity.MEDIUM,
					movement.kind() == FundMovementKind.SHORTFALL ? InsightCategory.LIQUIDITY_RISK : InsightCategory.SAVINGS_OPPORTUNITY,
					"Optimise Fund Allocation",
					movement.reason(),
					"Transfer $" + MoneyMath.round(movement.amount()) + " from " + movement.fromAccountName() + " to "
							+ movement.toAccountName(),
					accounts, List.of(), movement.projectedBenefit(), movement.projectedBenefit(), 0.9,
					LinkedEntities.ofAccounts(accounts)));
		}

		List<RepaymentOptimisation> repayments = optimisation.repaymentOptimisations().stream()
				.filter(repayment -> repayment.interestSavings().compareTo(LOAN_INSIGHT_FLOOR) > 0)
				.toList();
		for (int i = 0; i < repayments.size(); i++) {
			RepaymentOptimisation repayment = repayments.get(i);
			insights.add(factory.create("insight-repayment-" + i,
					repayment.interestSavings().compareTo(new BigDecimal("5000")) > 0 ? InsightSeverity.HIGH : InsightSeverity.MEDIUM,
					InsightCategory.SAVINGS_OPPORTUNITY,
					"Loan Optimisation: " + repayment.loanName(),
					repayment.rationale(),
					repayment.recommendedStrategy(),
					List.of(), List.of(), repayment.interestSavings(), repayment.interestSavings(), 0.85,
					repayment.loanId() == null ? null : LinkedEntities.ofLoans(List.of(repayment.loanId()))));
		}

		int breakEven = optimisation.breakEvenDay();
		if (breakEven == -1 || breakEven > LATE_BREAK_EVEN_DAY) {
			boolean never = breakEven == -1;
			insights.add(factory.create("insight-breakeven",
					never ? InsightSeverity.HIGH : InsightSeverity.MEDIUM,
					InsightCategory.LIQUIDITY_RISK,
					never ? "Expenses Exceed Income" : "Late Break-Even Day",
					never
							? "Your monthly expenses exceed your monthly income."
							: "You don't break even until day " + breakEven + " of each month, causing cashflow pressure.",
					"Consider moving payment dates closer to income dates.",
					List.of(), List.of(), MoneyMath.scale(optimisation.summary().totalPotentialSavings(), 0.05), null, 0.8,
					null));
		}
	}

	private void subscriptionInsights(OptimisationResult optimisation, InsightFactory factory, List<CashflowInsight> insights) {
		List<SubscriptionAnalysis> increases = optimisation.subscriptionsWithPriceIncrease();
		for (int i = 0; i < increases.size(); i++) {
			SubscriptionAnalysis subscription = increases.get(i);
			BigDecimal pct = MoneyMath.safe(subscription.priceChangePercent());
			insights.add(factory.create("insight-price-increase-" + i,
					pct.compareTo(new BigDecimal("20")) > 0 ? InsightSeverity.HIGH : InsightSeverity.MEDIUM,
					InsightCategory.SUBSCRIPTION,
					"Price Increase: " + subscription.merchant(),
					subscription.merchant() + " has increased from $" + MoneyMath.money(subscription.previousAmount()).toPlainString()
							+ " to $" + subscription.currentAmount().toPlainString() + " ("
							+ String.format(Locale.ROOT, "%.1f", pct.doubleValue()) + "% increase).",
					"Review if this subscription is still providing value at the new price.",
					List.of(), List.of(MerchantCategoryClassifier.SUBSCRIPTIONS, subscription.category()),
					subscription.yearlyImpact(), subscription.yearlyImpact(), 0.95, null));
		}
		List<SubscriptionAnalysis> subscriptions = optimisation.subscriptions();
		if (subscriptions.size() > 10) {
			BigDecimal monthly = BigDecimal.ZERO;
			for (SubscriptionAnalysis subscription : subscriptions) {
				monthly = monthly.add(subscription.monthlyImpact());
			}
			BigDecimal yearly = MoneyMath.money(monthly.multiply(BigDecimal.valueOf(12)));
			insights.add(factory.create("insight-subscription-count",
					subscriptions.size() > 15 ? InsightSeverity.HIGH : InsightSeverity.MEDIUM,
					InsightCategory.SUBSCRIPTION,
					"Multiple Active Subscriptions",
					"You have " + subscriptions.size() + " active subscriptions costing $" + MoneyMath.round(monthly)
							+ "/month ($" + MoneyMath.round(yearly) + "/year).",
					"Review all subscriptions and cancel any that are not regularly used.",
					List.of(), List.of(MerchantCategoryClassifier.SUBSCRIPTIONS), yearly, MoneyMath.scale(yearly, 0.2), 0.9,
					null));
		}
	}

	private void resilienceInsights(StressTestOutput stress, InsightFactory factory, List<CashflowInsight> insights) {
		BigDecimal emergencyFund = stress.summary().recommendedEmergencyFund();
		if (stress.resilienceScore() < 50) {
			insights.add(factory.create("insight-resilience",
					stress.resilienceScore() < 25 ? InsightSeverity.CRITICAL : InsightSeverity.HIGH,
					InsightCategory.LIQUIDITY_RISK,
					"Low Financial Resilience",
					"Your resilience score is " + stress.resilienceScore()
							+ "/100. You may struggle to handle unexpected financial stress.",
					"Build emergency fund of $" + MoneyMath.round(emergencyFund) + " and reduce fixed costs.",
					List.of(), List.of(), emergencyFund, null, 0.85, null));
		}
		List<String> risks = stress.summary().criticalRisks();
		for (int i = 0; i < risks.size(); i++) {
			String risk = risks.get(i);
			insights.add(factory.create("insight-critical-risk-" + i, InsightSeverity.HIGH, InsightCategory.LIQUIDITY_RISK,
					"Risk Alert: " + risk,
					"Stress testing identified \"" + risk + "\" as a critical vulnerability in your financial position.",
					"Review mitigation strategies in the Stress Test results.",
					List.of(), List.of(), null, null, 0.8, null));
		}
		String worstName = stress.summary().mostVulnerableScenario();
		StressTestResult worst = stress.scenarioResults().stream()
				.filter(result -> result.scenarioName().equals(worstName))
				.findFirst()
				.orElse(null);
		if (worst != null && worst.survivalTime() < 3.0) {
			insights.add(factory.create("insight-vulnerable-scenario",
					worst.survivalTime() < 1.0 ? InsightSeverity.CRITICAL : InsightSeverity.HIGH,
					InsightCategory.LIQUIDITY_RISK,
					"Vulnerable to: " + worstName,
					"Under the \"" + worstName + "\" scenario, you would only survive "
							+ String.format(Locale.ROOT, "%.1f", worst.survivalTime()) + " months before running out of funds.",
					"Build buffer of $" + MoneyMath.round(worst.requiredSavings()) + " or increase income by $"
							+ MoneyMath.round(worst.requiredIncomeIncrease()) + "/month.",
					List.of(), List.of(), worst.requiredSavings(), null, 0.75, null));
		}
	}

	private record InsightFactory(String userId, Instant createdAt) {
		CashflowInsight create(String id,
							   InsightSeverity severity,
							   InsightCategory category,
							   String title,
							   String description,
							   String action,
							   List<String> accounts,
							   List<String> categories,
							   BigDecimal value,
							   BigDecimal savings,
							   double confidence,
							   LinkedEntities linked) {
			return new CashflowInsight(id, userId, severity, category, title, description, action, accounts, categories,
					value, savings, confidence, linked, false, false, false, createdAt);
		}
	}
}
