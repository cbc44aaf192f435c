package my.cashflowplanner.app.service;

import my.cashflowplanner.app.config.CashflowProperties;
import my.cashflowplanner.app.model.CashflowStrategy;
import my.cashflowplanner.app.model.InsightCategory;
import my.cashflowplanner.app.model.InsightSeverity;
import my.cashflowplanner.app.model.StrategyStatus;
import my.cashflowplanner.app.model.StrategyStep;
import my.cashflowplanner.app.model.StrategyType;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.FundMovementKind;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.FundMovementRecommendation;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.PaymentScheduleOptimisation;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.RepaymentOptimisation;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.SpendingInefficiency;
import my.cashflowplanner.app.service.util.MoneyMath;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns optimisation findings into ranked strategies and governs their lifecycle.
 */
@Component
public class CashflowStrategyPlanner {
	public static final int HIGH_PRIORITY = 70;
	private static final int MAX_INEFFICIENCY_STRATEGIES = 5;
	private static final int MAX_REPAYMENT_STRATEGIES = 3;

	private final Duration expiry;

	public CashflowStrategyPlanner(CashflowProperties properties) {
		this.expiry = Duration.ofDays(properties.strategy().expiryDays());
	}

	public List<CashflowStrategy> plan(List<SpendingInefficiency> inefficiencies,
								   List<FundMovementRecommendation> fundMovements,
								   List<PaymentScheduleOptimisation> schedule,
								   List<RepaymentOptimisation> repayments,
								   Instant generatedAt) {
		Instant expiresAt = generatedAt == null ? null : generatedAt.plus(expiry);
		List<CashflowStrategy> strategies = new ArrayList<>();

		for (int i = 0; i < Math.min(MAX_INEFFICIENCY_STRATEGIES, inefficiencies.size()); i++) {
			SpendingInefficiency inefficiency = inefficiencies.get(i);
			strategies.add(new CashflowStrategy(
					"strategy-ineff-" + i,
					StrategyType.REDUCE_WASTE,
					InsightSeverity.fromValue(inefficiency.potentialSavings()).priority(),
					"Reduce " + inefficiency.merchantOrCategory() + " spending",
					inefficiency.description(),
					"Current spend: $" + MoneyMath.round(inefficiency.currentSpend()) + ". Potential savings: $"
							+ MoneyMath.round(inefficiency.potentialSavings()) + ".",
					inefficiency.confidenceScore(),
					inefficiency.potentialSavings(),
					inefficiencySteps(inefficiency),
					List.of(),
					List.of(),
					List.of(),
					StrategyStatus.PENDING,
					expiresAt
			));
		}

		for (int i = 0; i < fundMovements.size(); i++) {
			FundMovementRecommendation movement = fundMovements.get(i);
			strategies.add(new CashflowStrategy(
					"strategy-fund-" + i,
					movement.kind() == FundMovementKind.SHORTFALL ? StrategyType.PREVENT_SHORTFALL : StrategyType.MAXIMISE_OFFSET,
					switch (movement.urgency()) {
						case HIGH -> 90;
						case MEDIUM -> 60;
						case LOW -> 30;
					},
					"Transfer funds to " + movement.toAccountName(),
					movement.reason(),
					null,
					0.9,
					movement.projectedBenefit(),
					List.of(
							new StrategyStep(1, "TRANSFER", "Transfer $" + MoneyMath.round(movement.amount()) + " from "
									+ movement.fromAccountName() + " to " + movement.toAccountName(), false),
							new StrategyStep(2, "MONITOR", "Monitor account balances for 30 days", true)
					),
					List.of(movement.fromAccountId(), movement.toAccountId()),
					List.of(),
					List.of(),
					StrategyStatus.PENDING,
					expiresAt
			));
		}

		for (int i = 0; i < Math.min(MAX_REPAYMENT_STRATEGIES, repayments.size()); i++) {
			RepaymentOptimisation repayment = repayments.get(i);
			BigDecimal savings = repayment.interestSavings();
			strategies.add(new CashflowStrategy(
					"strategy-repay-" + i,
					StrategyType.REPAYMENT_OPTIMISE,
					repaymentPriority(savings),
					repayment.recommendedStrategy(),
					repayment.rationale(),
					"Save $" + MoneyMath.round(savings) + " in interest. Pay off " + repayment.termReductionMonths()
							+ " months earlier.",
					0.85,
					savings,
					List.of(
							new StrategyStep(1, "CONTACT_LENDER", "Contact lender to change repayment strategy", false),
							new StrategyStep(2, "ADJUST_PAYMENT", "Adjust payment from $"
									+ MoneyMath.round(repayment.currentMonthlyPayment()) + " to $"
									+ MoneyMath.round(repayment.recommendedMonthlyPayment()) + "/month", false)
					),
					List.of(),
					repayment.loanId() == null ? List.of() : List.of(repayment.loanId()),
					List.of(),
					StrategyStatus.PENDING,
					expiresAt
			));
		}

		for (int i = 0; i < schedule.size(); i++) {
			PaymentScheduleOptimisation optimisation = schedule.get(i);
			strategies.add(new CashflowStrategy(
					"strategy-schedule-" + i,
					StrategyType.SCHEDULE_OPTIMISE,
					50,
					"Optimise payment schedule",
					optimisation.benefitDescription(),
					null,
					0.7,
					optimisation.projectedBenefit(),
					List.of(
							new StrategyStep(1, "REVIEW", "Review which payments can have their dates changed", false),
							new StrategyStep(2, "RESCHEDULE", "Contact service providers to reschedule payment dates", false)
					),
					List.of(),
					List.of(),
					optimisation.currentSchedule().stream()
							.map(CashflowOptimisationEngine.ScheduledPayment::recurringId)
							.filter(Objects::nonNull)
							.toList(),
					StrategyStatus.PENDING,
					expiresAt
			));
		}

		strategies.sort(Comparator.comparingInt(CashflowStrategy::priority).reversed());
		return List.copyOf(strategies);
	}

	/**
	 * Moves a strategy to {@code target}. A pending strategy past its expiry can only become EXPIRED.
	 *
	 * @throws IllegalArgumentException when the transition is not allowed
	 */
	public CashflowStrategy transition(CashflowStrategy strategy, StrategyStatus target, Instant now) {
		if (strategy == null || target == null) {
			throw new IllegalArgumentException("Strategy and target status are required");
		}
		CashflowStrategy current = expireIfDue(strategy, now);
		if (current.status() == StrategyStatus.EXPIRED && target != StrategyStatus.EXPIRED) {
			throw new IllegalArgumentException("Strategy " + strategy.id() + " has expired");
		}
		if (current.status() == target && target == StrategyStatus.EXPIRED) {
			return current;
		}
		if (!current.status().canTransitionTo(target)) {
			throw new IllegalArgumentException("Cannot move strategy " + strategy.id() + " from "
					+ current.status() + " to " + target);
		}
		return current.withStatus(target);
	}

	public CashflowStrategy expireIfDue(CashflowStrategy strategy, Instant now) {
		if (strategy.status() == StrategyStatus.PENDING && strategy.isExpiredAt(now)) {
			return strategy.withStatus(StrategyStatus.EXPIRED);
		}
		return strategy;
	}

	static int repaymentPriority(BigDecimal savings) {
		if (savings.compareTo(new BigDecimal("5000")) > 0) {
			return 85;
		}
		if (savings.compareTo(new BigDecimal("1000")) > 0) {
			return 65;
		}
		return 45;
	}

	private static List<StrategyStep> inefficiencySteps(SpendingInefficiency inefficiency) {
		String subject = inefficiency.merchantOrCategory();
		if (inefficiency.category() == InsightCategory.SUBSCRIPTION) {
			return List.of(
					new StrategyStep(1, "REVIEW", "Review usage of " + subject, false),
					new StrategyStep(2, "EVALUATE", "Determine if subscription is still providing value", false),
					new StrategyStep(3, "CANCEL_OR_DOWNGRADE", "Cancel or downgrade if not needed", false)
			);
		}
		BigDecimal budget = inefficiency.benchmarkSpend() != null
				? inefficiency.benchmarkSpend()
				: MoneyMath.scale(inefficiency.currentSpend(), new BigDecimal("0.7"));
		return List.of(
				new StrategyStep(1, "ANALYSE", "Review " + subject + " transactions", false),
				new StrategyStep(2, "SET_BUDGET", "Set budget of $" + MoneyMath.round(budget) + "/month", false),
				new StrategyStep(3, "TRACK", "Track spending against budget for 30 days", true)
		);
	}
}
