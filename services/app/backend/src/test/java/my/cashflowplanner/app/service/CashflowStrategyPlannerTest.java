package my.cashflowplanner.app.service;

import my.cashflowplanner.app.config.CashflowProperties;
import my.cashflowplanner.app.model.CashflowStrategy;
import my.cashflowplanner.app.model.InsightCategory;
import my.cashflowplanner.app.model.StrategyStatus;
import my.cashflowplanner.app.model.StrategyStep;
import my.cashflowplanner.app.model.StrategyType;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.FundMovementKind;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.FundMovementRecommendation;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.PaymentScheduleOptimisation;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.RepaymentOptimisation;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.ScheduledPayment;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.SpendingInefficiency;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.Urgency;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static my.cashflowplanner.app.support.CashflowFixtures.TODAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CashflowStrategyPlannerTest {
	private static final Instant NOW = Instant.parse("2025-01-01T09:00:00Z");

	private final CashflowStrategyPlanner planner = new CashflowStrategyPlanner(CashflowProperties.defaults());

	@Test
	void ranksStrategiesByPriority() {
		SpendingInefficiency dining = new SpendingInefficiency("ineff-dining", InsightCategory.INEFFICIENCY, "Dining Out",
				"Dining Out spending is 200% above average", new BigDecimal("800"), new BigDecimal("200"),
				new BigDecimal("600"), 0.8, null);
		FundMovementRecommendation offset = new FundMovementRecommendation(FundMovementKind.OFFSET, "savings",
				"Savings", "offset", "Offset", new BigDecimal("15000"), "Earn more interest", new BigDecimal("900"),
				Urgency.HIGH);
		RepaymentOptimisation repayment = new RepaymentOptimisation("home", "Home loan", "Interest only",
				"Switch to principal and interest", new BigDecimal("1500"), new BigDecimal("2100"),
				new BigDecimal("2000"), 24, "Reduce total interest");
		PaymentScheduleOptimisation schedule = new PaymentScheduleOptimisation("Move bills after payday",
				List.of(new ScheduledPayment(TODAY.plusDays(2), "Gym", new BigDecimal("50"), "main", "gym")),
				List.of(new ScheduledPayment(TODAY.plusDays(22), "Gym", new BigDecimal("50"), "main", "gym")),
				"Smoother cashflow", new BigDecimal("8"));

		List<CashflowStrategy> strategies = planner.plan(List.of(dining), List.of(offset), List.of(schedule),
				List.of(repayment), NOW);

		assertThat(strategies).extracting(CashflowStrategy::id)
				.containsExactly("strategy-fund-0", "strategy-ineff-0", "strategy-repay-0", "strategy-schedule-0");
		assertThat(strategies).extracting(CashflowStrategy::priority).containsExactly(90, 75, 65, 50);
		assertThat(strategies).allSatisfy(strategy -> {
			assertThat(strategy.status()).isEqualTo(StrategyStatus.PENDING);
			assertThat(strategy.expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
		});

		CashflowStrategy fund = strategies.get(0);
		assertThat(fund.type()).isEqualTo(StrategyType.MAXIMISE_OFFSET);
		assertThat(fund.affectedAccountIds()).containsExactly("savings", "offset");
		assertThat(fund.recommendedSteps()).extracting(StrategyStep::action).containsExactly("TRANSFER", "MONITOR");

		CashflowStrategy waste = strategies.get(1);
		assertThat(waste.type()).isEqualTo(StrategyType.REDUCE_WASTE);
		assertThat(waste.projectedBenefit()).isEqualByComparingTo("600");
		assertThat(waste.recommendedSteps()).extracting(StrategyStep::action)
				.containsExactly("ANALYSE", "SET_BUDGET", "TRACK");

		assertThat(strategies.get(2).affectedLoanIds()).containsExactly("home");
		assertThat(strategies.get(3).affectedRecurringIds()).containsExactly("gym");
	}

	@Test
	void subscriptionInefficienciesGetCancellationSteps() {
		SpendingInefficiency adobe = new SpendingInefficiency("ineff-sub-adobe", InsightCategory.SUBSCRIPTION, "Adobe",
				"High-value subscription", new BigDecimal("80"), null, new BigDecimal("960"), 0.6, null);

		List<CashflowStrategy> strategies = planner.plan(List.of(adobe), List.of(), List.of(), List.of(), NOW);

		assertThat(strategies).singleElement().satisfies(strategy -> {
			assertThat(strategy.priority()).isEqualTo(75);
			assertThat(strategy.recommendedSteps()).extracting(StrategyStep::action)
					.containsExactly("REVIEW", "EVALUATE", "CANCEL_OR_DOWNGRADE");
		});
	}

	@Test
	void shortfallMovementsPreventShortfalls() {
		FundMovementRecommendation rescue = new FundMovementRecommendation(FundMovementKind.SHORTFALL, "savings",
				"Savings", "main", "Main", new BigDecimal("1080"), "Prevent predicted shortfall", new BigDecimal("900"),
				Urgency.LOW);

		CashflowStrategy strategy = planner.plan(List.of(), List.of(rescue), List.of(), List.of(), NOW).get(0);

		assertThat(strategy.type()).isEqualTo(StrategyType.PREVENT_SHORTFALL);
		assertThat(strategy.priority()).isEqualTo(30);
	}

	@Test
	void acceptsPendingStrategy() {
		CashflowStrategy accepted = planner.transition(pending(NOW.plusSeconds(60)), StrategyStatus.ACCEPTED, NOW);

		assertThat(accepted.status()).isEqualTo(StrategyStatus.ACCEPTED);
		assertThat(accepted.id()).isEqualTo("strategy-test");
	}

	@Test
	void settledStrategiesCannotMove() {
		CashflowStrategy dismissed = pending(null).withStatus(StrategyStatus.DISMISSED);

		assertThatThrownBy(() -> planner.transition(dismissed, StrategyStatus.ACCEPTED, NOW))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Cannot move strategy strategy-test from DISMISSED to ACCEPTED");
		assertThatThrownBy(() -> planner.transition(pending(null), StrategyStatus.PENDING, NOW))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void expiredStrategyCanOnlyExpire() {
		CashflowStrategy stale = pending(NOW.minusSeconds(1));

		assertThatThrownBy(() -> planner.transition(stale, StrategyStatus.ACCEPTED, NOW))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Strategy strategy-test has expired");
		assertThat(planner.transition(stale, StrategyStatus.EXPIRED, NOW).status()).isEqualTo(StrategyStatus.EXPIRED);
	}

	@Test
	void expiresOnlyPendingStrategiesPastTheirDeadline() {
		assertThat(planner.expireIfDue(pending(NOW.minusSeconds(1)), NOW).status()).isEqualTo(StrategyStatus.EXPIRED);
		assertThat(planner.expireIfDue(pending(NOW.plusSeconds(1)), NOW).status()).isEqualTo(StrategyStatus.PENDING);
		assertThat(planner.expireIfDue(pending(null), NOW).status()).isEqualTo(StrategyStatus.PENDING);
		CashflowStrategy accepted = pending(NOW.minusSeconds(1)).withStatus(StrategyStatus.ACCEPTED);
		assertThat(planner.expireIfDue(accepted, NOW)).isSameAs(accepted);
	}

	@Test
	void rejectsMissingTransitionArguments() {
		assertThatThrownBy(() -> planner.transition(null, StrategyStatus.ACCEPTED, NOW))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Strategy and target status are required");
	}

	@Test
	void repaymentPriorityFollowsSavings() {
		assertThat(CashflowStrategyPlanner.repaymentPriority(new BigDecimal("27000"))).isEqualTo(85);
		assertThat(CashflowStrategyPlanner.repaymentPriority(new BigDecimal("5000"))).isEqualTo(65);
		assertThat(CashflowStrategyPlanner.repaymentPriority(new BigDecimal("1000"))).isEqualTo(45);
	}

	private static CashflowStrategy pending(Instant expiresAt) {
		return new CashflowStrategy("strategy-test", StrategyType.OPTIMISE, 50, "Test", "Summary", null, 0.5,
				BigDecimal.TEN, List.of(), List.of(), List.of(), List.of(), StrategyStatus.PENDING, expiresAt);
	}
}
