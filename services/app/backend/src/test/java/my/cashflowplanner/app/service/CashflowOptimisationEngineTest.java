package my.cashflowplanner.app.service;

import my.cashflowplanner.app.config.CashflowProperties;
import my.cashflowplanner.app.config.CategoryBenchmarks;
import my.cashflowplanner.app.model.AccountType;
import my.cashflowplanner.app.model.CashflowForecast;
import my.cashflowplanner.app.model.CashflowStrategy;
import my.cashflowplanner.app.model.CategoryAverage;
import my.cashflowplanner.app.model.InsightCategory;
import my.cashflowplanner.app.model.OffsetAccount;
import my.cashflowplanner.app.model.RecurrencePattern;
import my.cashflowplanner.app.model.RecurringPayment;
import my.cashflowplanner.app.model.SpendingProfile;
import my.cashflowplanner.app.model.StrategyStatus;
import my.cashflowplanner.app.model.StrategyType;
import my.cashflowplanner.app.model.TrendDirection;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.FundMovementKind;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.FundMovementRecommendation;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.OptimisationInput;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.OptimisationResult;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.PaymentScheduleOptimisation;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.RepaymentOptimisation;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.SpendingInefficiency;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.SubscriptionAnalysis;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.Urgency;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static my.cashflowplanner.app.support.CashflowFixtures.TODAY;
import static my.cashflowplanner.app.support.CashflowFixtures.account;
import static my.cashflowplanner.app.support.CashflowFixtures.forecastEngine;
import static my.cashflowplanner.app.support.CashflowFixtures.input;
import static my.cashflowplanner.app.support.CashflowFixtures.loan;
import static my.cashflowplanner.app.support.CashflowFixtures.monthlyPayment;
import static my.cashflowplanner.app.support.CashflowFixtures.monthlySalary;
import static my.cashflowplanner.app.support.CashflowFixtures.offsetAccount;
import static my.cashflowplanner.app.support.CashflowFixtures.priceChangedPayment;
import static org.assertj.core.api.Assertions.assertThat;

class CashflowOptimisationEngineTest {
	private static final Instant GENERATED_AT = Instant.parse("2025-01-01T00:00:00Z");

	private final CashflowForecastEngine forecastEngine = forecastEngine();
	private final CashflowOptimisationEngine engine = new CashflowOptimisationEngine(
			CategoryBenchmarks.australianHousehold(), new CashflowStrategyPlanner(CashflowProperties.defaults()));

	@Test
	void flagsCategoryOnlyAboveOneAndAHalfTimesBenchmark() {
		List<SpendingInefficiency> over = engine.detectInefficiencies(profile("Groceries", "901"), List.of());
		List<SpendingInefficiency> atLimit = engine.detectInefficiencies(profile("Groceries", "900"), List.of());

		assertThat(atLimit).isEmpty();
		assertThat(over).singleElement().satisfies(inefficiency -> {
			assertThat(inefficiency.id()).isEqualTo("ineff-groceries");
			assertThat(inefficiency.category()).isEqualTo(InsightCategory.INEFFICIENCY);
			assertThat(inefficiency.benchmarkSpend()).isEqualByComparingTo(new BigDecimal("600"));
			assertThat(inefficiency.potentialSavings()).isEqualByComparingTo(new BigDecimal("301"));
			assertThat(inefficiency.description()).isEqualTo("Spending in Groceries is 50% above average");
			assertThat(inefficiency.confidenceScore()).isEqualTo(0.8);
		});
	}

	@Test
	void categoriesWithoutBenchmarkAreIgnored() {
		assertThat(engine.detectInefficiencies(profile("Pets", "5000"), List.of())).isEmpty();
	}

	@Test
	void expensiveMonthlySubscriptionsAreReviewed() {
		RecurringPayment adobe = monthlyPayment("adobe", "Adobe Creative Cloud", "80", TODAY.plusDays(3), "main");
		RecurringPayment netflix = monthlyPayment("netflix", "Netflix", "22.99", TODAY.plusDays(4), "main");

		List<SpendingInefficiency> found = engine.detectInefficiencies(SpendingProfile.empty(), List.of(adobe, netflix));

		assertThat(found).singleElement().satisfies(inefficiency -> {
			assertThat(inefficiency.id()).isEqualTo("ineff-adobe");
			assertThat(inefficiency.category()).isEqualTo(InsightCategory.SUBSCRIPTION);
			assertThat(inefficiency.potentialSavings()).isEqualByComparingTo(new BigDecimal("960"));
			assertThat(inefficiency.description()).contains("$80.00/month");
		});
	}

	@Test
	void moreThanTwoActiveStreamingServicesSuggestConsolidation() {
		List<RecurringPayment> recurring = List.of(
				monthlyPayment("netflix", "Netflix", "22.99", TODAY, "main"),
				monthlyPayment("disney", "Disney Plus", "13.99", TODAY, "main"),
				monthlyPayment("stan", "Stan", "12", TODAY, "main"),
				monthlyPayment("binge", "Binge", "10", TODAY, "main"),
				new RecurringPayment("paramount", "Paramount+", "main", RecurrencePattern.MONTHLY, new BigDecimal("9"),
						TODAY, null, false, null, null, null));

		List<SpendingInefficiency> found = engine.detectInefficiencies(SpendingProfile.empty(), recurring);

		assertThat(found).singleElement().satisfies(inefficiency -> {
			assertThat(inefficiency.id()).isEqualTo("ineff-streaming-overlap");
			assertThat(inefficiency.description()).isEqualTo("You have 4 streaming services. Consider consolidating.");
			assertThat(inefficiency.potentialSavings()).isEqualByComparingTo(new BigDecimal("360"));
			assertThat(inefficiency.currentSpend()).isEqualByComparingTo(new BigDecimal("707.76"));
		});
	}

	@Test
	void priceChangeAboveFivePercentIsAnIncrease() {
		List<SubscriptionAnalysis> analyses = engine.analyseSubscriptions(List.of(
				priceChangedPayment("netflix", "Netflix", "25", "5"),
				priceChangedPayment("insurer", "Insurer", "100", "3")));

		SubscriptionAnalysis netflix = analyses.stream().filter(a -> a.recurringId().equals("netflix")).findFirst().orElseThrow();
		SubscriptionAnalysis insurer = analyses.stream().filter(a -> a.recurringId().equals("insurer")).findFirst().orElseThrow();
		assertThat(netflix.previousAmount()).isEqualByComparingTo(new BigDecimal("20.00"));
		assertThat(netflix.priceChangePercent()).isEqualByComparingTo(new BigDecimal("25.00"));
		assertThat(netflix.hasPriceIncrease()).isTrue();
		assertThat(netflix.yearlyImpact()).isEqualByComparingTo(new BigDecimal("300"));
		assertThat(netflix.category()).isEqualTo(MerchantCategoryClassifier.ENTERTAINMENT);
		assertThat(insurer.hasPriceIncrease()).isFalse();
		assertThat(analyses.get(0).recurringId()).isEqualTo("insurer");
	}

	@Test
	void idleBalanceIsMovedIntoLinkedOffset() {
		CashflowForecast forecast = forecastEngine.generate(input(
				List.of(account("main", AccountType.TRANSACTIONAL, "20000"), offsetAccount("offset", "4000", "home")),
				List.of(), List.of(), List.of(),
				List.of(loan("home", "400000", "0.06", "2400", 28, false, "offset")),
				30));

		List<FundMovementRecommendation> movements = engine.recommendFundMovements(forecast,
				List.of(new OffsetAccount("offset", "Home offset", new BigDecimal("1000"), "home")),
				List.of(loan("home", "400000", "0.06", "2400", 28, false, "offset")));

		assertThat(movements).singleElement().satisfies(movement -> {
			assertThat(movement.kind()).isEqualTo(FundMovementKind.OFFSET);
			assertThat(movement.fromAccountId()).isEqualTo("main");
			assertThat(movement.toAccountId()).isEqualTo("offset");
			assertThat(movement.amount()).isEqualByComparingTo(new BigDecimal("15000"));
			assertThat(movement.projectedBenefit()).isEqualByComparingTo(new BigDecimal("900"));
			assertThat(movement.urgency()).isEqualTo(Urgency.HIGH);
		});
	}

	@Test
	void healthyAccountCoversPredictedShortfall() {
		CashflowForecast forecast = forecastEngine.generate(input(
				List.of(account("main", AccountType.TRANSACTIONAL, "100"), account("savings", AccountType.SAVINGS, "5000")),
				List.of(),
				List.of(monthlyPayment("rego", "Car Rego", "1000", TODAY.plusDays(2), "main")),
				List.of(), List.of(), 10));

		List<FundMovementRecommendation> movements = engine.recommendFundMovements(forecast, List.of(), List.of());

		assertThat(movements).singleElement().satisfies(movement -> {
			assertThat(movement.kind()).isEqualTo(FundMovementKind.SHORTFALL);
			assertThat(movement.fromAccountId()).isEqualTo("savings");
			assertThat(movement.toAccountId()).isEqualTo("main");
			assertThat(movement.amount()).isEqualByComparingTo(new BigDecimal("1080"));
			assertThat(movement.projectedBenefit()).isEqualByComparingTo(new BigDecimal("900"));
			assertThat(movement.reason()).isEqualTo("Prevent predicted shortfall of $900 in main account");
		});
	}

	@Test
	void suggestsPrincipalAndInterestAndExtraRepaymentsWhenCashflowAllows() {
		CashflowForecast forecast = forecastEngine.generate(input(
				List.of(account("main", AccountType.TRANSACTIONAL, "10000")),
				List.of(), List.of(),
				List.of(monthlySalary("salary", "5000", TODAY.plusDays(1), "main")),
				List.of(loan("home", "300000", "0.06", "1500", 15, true, null),
						loan("car", "20000", "0.08", "450", 15, false, null)),
				30));

		List<RepaymentOptimisation> optimisations = engine.optimiseRepayments(
				List.of(loan("home", "300000", "0.06", "1500", 15, true, null),
						loan("car", "20000", "0.08", "450", 15, false, null)),
				List.of(), forecast);

		assertThat(forecast.summary().netCashflow30()).isEqualByComparingTo(new BigDecimal("3050"));
		assertThat(optimisations).hasSize(2);
		RepaymentOptimisation principalAndInterest = optimisations.get(0);
		assertThat(principalAndInterest.loanId()).isEqualTo("home");
		assertThat(principalAndInterest.recommendedStrategy()).isEqualTo("Principal & Interest");
		assertThat(principalAndInterest.interestSavings()).isEqualByComparingTo(new BigDecimal("27000"));
		assertThat(principalAndInterest.termReductionMonths()).isEqualTo(60);
		RepaymentOptimisation extra = optimisations.get(1);
		assertThat(extra.loanId()).isEqualTo("car");
		assertThat(extra.recommendedMonthlyPayment()).isEqualByComparingTo(new BigDecimal("950"));
		assertThat(extra.interestSavings()).isEqualByComparingTo(new BigDecimal("4800"));
		assertThat(extra.termReductionMonths()).isEqualTo(133);
	}

	@Test
	void underutilisedOffsetIsReported() {
		CashflowForecast forecast = forecastEngine.generate(input(
				List.of(account("main", AccountType.TRANSACTIONAL, "1000")),
				List.of(), List.of(), List.of(), List.of(), 30));

		List<RepaymentOptimisation> optimisations = engine.optimiseRepayments(
				List.of(loan("home", "500000", "0.05", "3000", 1, false, "offset")),
				List.of(new OffsetAccount("offset", "Offset", new BigDecimal("2000"), "home")),
				forecast);

		assertThat(optimisations).singleElement().satisfies(optimisation -> {
			assertThat(optimisation.currentStrategy()).isEqualTo("Underutilised offset");
			assertThat(optimisation.interestSavings()).isEqualByComparingTo(new BigDecimal("2500"));
			assertThat(optimisation.termReductionMonths()).isEqualTo(12);
		});
	}

	@Test
	void earlyPaymentsMoveToThreeDaysAfterLateIncome() {
		List<RecurringPayment> recurring = List.of(
				monthlyPayment("a", "Power", "100", LocalDate.of(2025, 1, 2), "main"),
				monthlyPayment("b", "Water", "100", LocalDate.of(2025, 1, 5), "main"),
				monthlyPayment("c", "Phone", "100", LocalDate.of(2025, 1, 8), "main"),
				monthlyPayment("d", "Internet", "100", LocalDate.of(2025, 1, 10), "main"));
		CashflowForecast forecast = forecastEngine.generate(input(
				List.of(account("main", AccountType.TRANSACTIONAL, "5000")),
				List.of(), recurring,
				List.of(monthlySalary("salary", "4000", LocalDate.of(2025, 1, 20), "main")),
				List.of(), 30));

		List<PaymentScheduleOptimisation> schedule = engine.optimisePaymentSchedule(recurring, forecast);
		List<PaymentScheduleOptimisation> tooFew = engine.optimisePaymentSchedule(recurring.subList(0, 3), forecast);

		assertThat(tooFew).isEmpty();
		assertThat(schedule).singleElement().satisfies(optimisation -> {
			assertThat(optimisation.optimisedSchedule()).allSatisfy(payment ->
					assertThat(payment.date()).isEqualTo(LocalDate.of(2025, 1, 23)));
			assertThat(optimisation.currentSchedule()).extracting(CashflowOptimisationEngine.ScheduledPayment::recurringId)
					.containsExactly("a", "b", "c", "d");
			assertThat(optimisation.projectedBenefit()).isEqualByComparingTo(new BigDecimal("8"));
		});
	}

	@Test
	void breakEvenDayIsWhenIncomeFirstCoversExpenses() {
		CashflowForecast breaksEven = forecastEngine.generate(input(
				List.of(account("main", AccountType.TRANSACTIONAL, "1000")),
				List.of(),
				List.of(monthlyPayment("rent", "Landlord", "200", TODAY, "main")),
				List.of(monthlySalary("salary", "500", TODAY.plusDays(4), "main")),
				List.of(), 30));
		CashflowForecast never = forecastEngine.generate(input(
				List.of(account("main", AccountType.TRANSACTIONAL, "1000")),
				List.of(),
				List.of(monthlyPayment("rent", "Landlord", "200", TODAY, "main")),
				List.of(), List.of(), 30));

		assertThat(engine.breakEvenDay(breaksEven)).isEqualTo(5);
		assertThat(engine.breakEvenDay(never)).isEqualTo(-1);
	}

	@Test
	void optimiseRanksStrategiesAndSetsExpiry() {
		CashflowForecast forecast = forecastEngine.generate(input(
				List.of(account("main", AccountType.TRANSACTIONAL, "20000"), offsetAccount("offset", "1000", "home")),
				List.of(), List.of(),
				List.of(monthlySalary("salary", "6000", TODAY.plusDays(1), "main")),
				List.of(loan("home", "400000", "0.06", "2400", 28, false, "offset")),
				30));

		OptimisationResult result = engine.optimise(new OptimisationInput(
				"user-1",
				forecast,
				profile("Groceries", "1200"),
				List.of(priceChangedPayment("netflix", "Netflix", "25", "5")),
				List.of(loan("home", "400000", "0.06", "2400", 28, false, "offset")),
				List.of(new OffsetAccount("offset", "Offset", new BigDecimal("1000"), "home")),
				GENERATED_AT));

		assertThat(result.userId()).isEqualTo("user-1");
		assertThat(result.subscriptionsWithPriceIncrease()).extracting(SubscriptionAnalysis::recurringId).containsExactly("netflix");
		assertThat(result.strategies()).isNotEmpty();
		assertThat(result.strategies()).extracting(CashflowStrategy::priority).isSortedAccordingTo((a, b) -> Integer.compare(b, a));
		assertThat(result.strategies()).allSatisfy(strategy -> {
			assertThat(strategy.status()).isEqualTo(StrategyStatus.PENDING);
			assertThat(strategy.expiresAt()).isEqualTo(GENERATED_AT.plus(Duration.ofDays(30)));
		});
		assertThat(result.strategies()).extracting(CashflowStrategy::type)
				.contains(StrategyType.REDUCE_WASTE, StrategyType.MAXIMISE_OFFSET, StrategyType.REPAYMENT_OPTIMISE);
		assertThat(result.summary().inefficiencyCount()).isEqualTo(1);
		assertThat(result.summary().priceIncreaseCount()).isEqualTo(1);
		assertThat(result.summary().strategyCount()).isEqualTo(result.strategies().size());
		assertThat(result.summary().totalPotentialSavings()).isGreaterThan(new BigDecimal("600"));
	}

	private static SpendingProfile profile(String category, String avgMonthly) {
		return new SpendingProfile(Map.of(category, new CategoryAverage(new BigDecimal(avgMonthly), TrendDirection.STABLE, 0.1)),
				0.1, new BigDecimal(avgMonthly));
	}
}
