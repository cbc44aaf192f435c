package my.cashflowplanner.app.service;

import my.cashflowplanner.app.config.CategoryBenchmarks;
import my.cashflowplanner.app.model.AccountForecast;
import my.cashflowplanner.app.model.CashflowForecast;
import my.cashflowplanner.app.model.CashflowStrategy;
import my.cashflowplanner.app.model.CategoryAverage;
import my.cashflowplanner.app.model.ForecastPoint;
import my.cashflowplanner.app.model.InsightCategory;
import my.cashflowplanner.app.model.LoanSchedule;
import my.cashflowplanner.app.model.OffsetAccount;
import my.cashflowplanner.app.model.RecurrencePattern;
import my.cashflowplanner.app.model.RecurringPayment;
import my.cashflowplanner.app.model.ShortfallAnalysis;
import my.cashflowplanner.app.model.SpendingProfile;
import my.cashflowplanner.app.model.StrategyType;
import my.cashflowplanner.app.model.TrendDirection;
import my.cashflowplanner.app.service.util.MoneyMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Looks for money left on the table in a finished forecast: overspent categories, subscriptions worth reviewing,
 * idle balances that could sit in an offset account, badly timed payments and loan repayment improvements.
 */
@Service
public class CashflowOptimisationEngine {
	private static final Logger logger = LoggerFactory.getLogger(CashflowOptimisationEngine.class);

	static final BigDecimal INEFFICIENCY_MULTIPLIER = new BigDecimal("1.5");
	static final BigDecimal MIN_SAVINGS_TO_REPORT = new BigDecimal("20");
	static final BigDecimal SUBSCRIPTION_REVIEW_FLOOR = new BigDecimal("50");
	static final BigDecimal PRICE_INCREASE_THRESHOLD = new BigDecimal("0.05");
	static final BigDecimal OFFSET_BUFFER = new BigDecimal("5000");
	static final BigDecimal MIN_OFFSET_TRANSFER = new BigDecimal("1000");
	static final BigDecimal OFFSET_BENEFIT_THRESHOLD = new BigDecimal("100");
	static final BigDecimal HIGH_URGENCY_BENEFIT = new BigDecimal("500");
	static final BigDecimal EXTRA_REPAYMENT_CAP = new BigDecimal("500");
	static final BigDecimal STREAMING_MONTHLY_ESTIMATE = new BigDecimal("15");
	private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
	private static final int MID_MONTH = 15;
	private static final int DEFAULT_INCOME_DAY = 15;
	private static final int SCHEDULE_DAYS_AFTER_INCOME = 3;
	private static final int MIN_EARLY_PAYMENTS = 3;
	private static final int BREAK_EVEN_WINDOW = 30;
	private static final int STREAMING_KEEP = 2;

	private final CategoryBenchmarks benchmarks;
	private final CashflowStrategyPlanner strategyPlanner;

	public CashflowOptimisationEngine(CategoryBenchmarks benchmarks, CashflowStrategyPlanner strategyPlanner) {
		this.benchmarks = benchmarks;
		this.strategyPlanner = strategyPlanner;
	}

	public OptimisationResult optimise(OptimisationInput input) {
		long started = System.nanoTime();
		List<RecurringPayment> recurring = input.recurringPayments() == null ? List.of() : input.recurringPayments();
		List<LoanSchedule> loans = input.loans() == null ? List.of() : input.loans();
		List<OffsetAccount> offsets = input.offsetAccounts() == null ? List.of() : input.offsetAccounts();
		SpendingProfile profile = input.spendingProfile() == null ? SpendingProfile.empty() : input.spendingProfile();

		List<SpendingInefficiency> inefficiencies = detectInefficiencies(profile, recurring);
		List<SubscriptionAnalysis> subscriptions = analyseSubscriptions(recurring);
		List<SubscriptionAnalysis> priceIncreases = subscriptions.stream()
				.filter(SubscriptionAnalysis::hasPriceIncrease)
				.toList();
		List<FundMovementRecommendation> fundMovements = recommendFundMovements(input.forecast(), offsets, loans);
		List<PaymentScheduleOptimisation> schedule = optimisePaymentSchedule(recurring, input.forecast());
		List<RepaymentOptimisation> repayments = optimiseRepayments(loans, offsets, input.forecast());
		int breakEvenDay = breakEvenDay(input.forecast());

		List<CashflowStrategy> strategies = strategyPlanner.plan(inefficiencies, fundMovements, schedule, repayments,
				input.generatedAt());
		OptimisationSummary summary = summarise(inefficiencies, subscriptions, priceIncreases, strategies);
		if (logger.isDebugEnabled()) {
			logger.debug("Optimisation produced {} inefficiencies and {} strategies in {} ms.",
					inefficiencies.size(), strategies.size(), (System.nanoTime() - started) / 1_000_000);
		}
		return new OptimisationResult(
				input.userId(),
				input.generatedAt(),
				inefficiencies,
				subscriptions,
				priceIncreases,
				fundMovements,
				schedule,
				repayments,
				breakEvenDay,
				strategies,
				summary
		);
	}

	/**
	 * Category spend above one and a half times its benchmark, expensive monthly entertainment or subscription
	 * payments, and more than two concurrent streaming services. Sorted by potential saving, largest first.
	 */
	List<SpendingInefficiency> detectInefficiencies(SpendingProfile profile, List<RecurringPayment> recurring) {
		List<SpendingInefficiency> found = new ArrayList<>();
		for (Map.Entry<String, CategoryAverage> entry : profile.categoryAverages().entrySet()) {
			String category = entry.getKey();
			CategoryAverage average = entry.getValue();
			Optional<BigDecimal> benchmark = benchmarks.benchmarkFor(category);
			if (benchmark.isEmpty() || average == null || average.avgMonthly() == null) {
				continue;
			}
			BigDecimal avgMonthly = average.avgMonthly();
			if (avgMonthly.compareTo(benchmark.get().multiply(INEFFICIENCY_MULTIPLIER)) <= 0) {
				continue;
			}
			BigDecimal saving = MoneyMath.money(avgMonthly.subtract(benchmark.get()));
			if (saving.compareTo(MIN_SAVINGS_TO_REPORT) < 0) {
				continue;
			}
			long abovePct = Math.round(MoneyMath.ratio(avgMonthly, benchmark.get()).doubleValue() * 100.0 - 100.0);
			found.add(new SpendingInefficiency(
					"ineff-" + slug(category),
					InsightCategory.INEFFICIENCY,
					category,
					"Spending in " + category + " is " + abovePct + "% above average",
					MoneyMath.money(avgMonthly),
					MoneyMath.money(benchmark.get()),
					saving,
					0.8,
					new InefficiencyEvidence(MoneyMath.money(avgMonthly), average.trend(), MoneyMath.money(benchmark.get()))
			));
		}

		int streaming = 0;
		BigDecimal streamingMonthly = BigDecimal.ZERO;
		for (RecurringPayment payment : recurring) {
			if (!payment.active()) {
				continue;
			}
			BigDecimal amount = MoneyMath.safe(payment.expectedAmount());
			if (MerchantCategoryClassifier.isStreamingService(payment.merchant())) {
				streaming++;
				streamingMonthly = streamingMonthly.add(amount);
			}
			if (payment.pattern() != RecurrencePattern.MONTHLY || amount.compareTo(SUBSCRIPTION_REVIEW_FLOOR) <= 0) {
				continue;
			}
			String category = MerchantCategoryClassifier.classify(payment.merchant());
			if (!MerchantCategoryClassifier.ENTERTAINMENT.equals(category)
					&& !MerchantCategoryClassifier.SUBSCRIPTIONS.equals(category)) {
				continue;
			}
			BigDecimal yearly = MoneyMath.money(amount.multiply(TWELVE));
			found.add(new SpendingInefficiency(
					"ineff-" + payment.id(),
					InsightCategory.SUBSCRIPTION,
					payment.merchant(),
					payment.merchant() + " costs $" + MoneyMath.money(amount).toPlainString()
							+ "/month - consider if still providing value",
					yearly,
					null,
					yearly,
					0.5,
					new InefficiencyEvidence(MoneyMath.money(amount), TrendDirection.STABLE, null)
			));
		}
		if (streaming > STREAMING_KEEP) {
			BigDecimal yearlyCost = MoneyMath.money(streamingMonthly.multiply(TWELVE));
			found.add(new SpendingInefficiency(
					"ineff-streaming-overlap",
					InsightCategory.INEFFICIENCY,
					"Streaming Services",
					"You have " + streaming + " streaming services. Consider consolidating.",
					yearlyCost,
					null,
					MoneyMath.money(STREAMING_MONTHLY_ESTIMATE.multiply(TWELVE).multiply(BigDecimal.valueOf(streaming - STREAMING_KEEP))),
					0.7,
					new InefficiencyEvidence(MoneyMath.money(streamingMonthly), TrendDirection.STABLE, null)
			));
		}
		found.sort(Comparator.comparing(SpendingInefficiency::potentialSavings).reversed());
		return List.copyOf(found);
	}

	/**
	 * Active monthly payments with their price history. The previous amount is {@code expected - lastPriceChange};
	 * a rise of more than five percent of the previous amount counts as a price increase.
	 */
	List<SubscriptionAnalysis> analyseSubscriptions(List<RecurringPayment> recurring) {
		List<SubscriptionAnalysis> analyses = new ArrayList<>();
		for (RecurringPayment payment : recurring) {
			if (!payment.active() || payment.pattern() != RecurrencePattern.MONTHLY) {
				continue;
			}
			BigDecimal current = MoneyMath.money(payment.expectedAmount());
			BigDecimal change = payment.lastPriceChange();
			BigDecimal previous = null;
			BigDecimal changePct = null;
			boolean increase = false;
			if (change != null && change.signum() != 0) {
				previous = MoneyMath.money(current.subtract(change));
				if (previous.signum() != 0) {
					BigDecimal fraction = MoneyMath.ratio(change, previous);
					changePct = fraction.multiply(MoneyMath.ONE_HUNDRED).setScale(2, RoundingMode.HALF_UP);
					increase = change.signum() > 0 && fraction.compareTo(PRICE_INCREASE_THRESHOLD) > 0;
				}
			}
			analyses.add(new SubscriptionAnalysis(
					payment.id(),
					payment.merchant(),
					current,
					previous,
					changePct,
					increase,
					payment.lastOccurrence(),
					current,
					MoneyMath.money(current.multiply(TWELVE)),
					MerchantCategoryClassifier.classify(payment.merchant())
			));
		}
		analyses.sort(Comparator.comparing(SubscriptionAnalysis::yearlyImpact).reversed());
		return List.copyOf(analyses);
	}

	List<FundMovementRecommendation> recommendFundMovements(CashflowForecast forecast,
														List<OffsetAccount> offsets,
														List<LoanSchedule> loans) {
		List<FundMovementRecommendation> recommendations = new ArrayList<>();
		for (OffsetAccount offset : offsets) {
			Optional<LoanSchedule> loan = loans.stream()
					.filter(candidate -> candidate.loanId() != null && candidate.loanId().equals(offset.linkedLoanId()))
					.findFirst();
			if (loan.isEmpty()) {
				continue;
			}
			BigDecimal rate = MoneyMath.safe(loan.get().interestRate());
			for (AccountForecast account : forecast.accountForecasts()) {
				if (account.accountId().equals(offset.id())) {
					continue;
				}
				BigDecimal excess = account.averageBalance().subtract(OFFSET_BUFFER);
				if (excess.compareTo(MIN_OFFSET_TRANSFER) <= 0) {
					continue;
				}
				BigDecimal benefit = MoneyMath.money(excess.multiply(rate));
				if (benefit.compareTo(OFFSET_BENEFIT_THRESHOLD) < 0) {
					continue;
				}
				recommendations.add(new FundMovementRecommendation(
						FundMovementKind.OFFSET,
						account.accountId(),
						account.accountName(),
						offset.id(),
						offset.name(),
						MoneyMath.money(excess),
						"Moving funds to offset account saves $" + MoneyMath.round(benefit) + "/year in interest",
						benefit,
						benefit.compareTo(HIGH_URGENCY_BENEFIT) > 0 ? Urgency.HIGH : Urgency.MEDIUM
				));
			}
		}

		ShortfallAnalysis shortfalls = forecast.shortfallAnalysis();
		if (shortfalls.hasShortfall()) {
			BigDecimal shortfall = shortfalls.maxShortfallAmount();
			Optional<AccountForecast> source = forecast.accountForecasts().stream()
					.filter(account -> account.averageBalance().compareTo(shortfall.multiply(INEFFICIENCY_MULTIPLIER)) >= 0)
					.filter(account -> !shortfalls.accountsAtRisk().contains(account.accountId()))
					.findFirst();
			Optional<AccountForecast> target = forecast.accountForecasts().stream()
					.filter(account -> shortfalls.accountsAtRisk().contains(account.accountId()))
					.findFirst();
			if (source.isPresent() && target.isPresent()) {
				recommendations.add(new FundMovementRecommendation(
						FundMovementKind.SHORTFALL,
						source.get().accountId(),
						source.get().accountName(),
						target.get().accountId(),
						target.get().accountName(),
						MoneyMath.scale(shortfall, new BigDecimal("1.2")),
						"Prevent predicted shortfall of $" + MoneyMath.round(shortfall) + " in " + target.get().accountName(),
						MoneyMath.money(shortfall),
						Urgency.HIGH
				));
			}
		}
		recommendations.sort(Comparator.comparing(FundMovementRecommendation::projectedBenefit).reversed());
		return List.copyOf(recommendations);
	}

	/**
	 * When income lands after mid-month but more than three payments fall on or before the 15th, suggests moving
	 * them to three days after the income day. The benefit is a 2% proxy for avoided overdraft cost.
	 */
	List<PaymentScheduleOptimisation> optimisePaymentSchedule(List<RecurringPayment> recurring, CashflowForecast forecast) {
		int incomeDay = primaryIncomeDay(forecast.globalForecast());
		List<RecurringPayment> early = new ArrayList<>();
		for (RecurringPayment payment : recurring) {
			LocalDate reference = referenceDate(payment);
			if (payment.active() && reference != null && reference.getDayOfMonth() <= MID_MONTH) {
				early.add(payment);
			}
		}
		if (incomeDay <= MID_MONTH || early.size() <= MIN_EARLY_PAYMENTS) {
			return List.of();
		}
		List<ScheduledPayment> current = new ArrayList<>();
		List<ScheduledPayment> optimised = new ArrayList<>();
		BigDecimal total = BigDecimal.ZERO;
		for (RecurringPayment payment : early) {
			LocalDate reference = referenceDate(payment);
			BigDecimal amount = MoneyMath.money(payment.expectedAmount());
			total = total.add(amount);
			YearMonth month = YearMonth.from(reference);
			LocalDate moved = month.atDay(Math.min(incomeDay + SCHEDULE_DAYS_AFTER_INCOME, month.lengthOfMonth()));
			current.add(new ScheduledPayment(reference, payment.merchant(), amount, payment.accountId(), payment.id()));
			optimised.add(new ScheduledPayment(moved, payment.merchant(), amount, payment.accountId(), payment.id()));
		}
		return List.of(new PaymentScheduleOptimisation(
				"Align payment dates with income",
				current,
				optimised,
				"Moving " + early.size() + " payments to after your income date reduces cashflow stress",
				MoneyMath.scale(total, new BigDecimal("0.02"))
		));
	}

	List<RepaymentOptimisation> optimiseRepayments(List<LoanSchedule> loans, List<OffsetAccount> offsets, CashflowForecast forecast) {
		BigDecimal net30 = forecast.summary() == null ? BigDecimal.ZERO : forecast.summary().netCashflow30();
		List<RepaymentOptimisation> optimisations = new ArrayList<>();
		for (LoanSchedule loan : loans) {
			BigDecimal principal = MoneyMath.safe(loan.principal());
			BigDecimal rate = MoneyMath.safe(loan.interestRate());
			BigDecimal repayment = MoneyMath.money(loan.monthlyRepayment());
			if (loan.interestOnly()) {
				BigDecimal principalAndInterest = MoneyMath.amortisedMonthlyPayment(principal, rate);
				BigDecimal extraNeeded = principalAndInterest.subtract(repayment);
				if (extraNeeded.compareTo(net30) < 0) {
					optimisations.add(new RepaymentOptimisation(
							loan.loanId(),
							loan.loanName(),
							"Interest Only",
							"Principal & Interest",
							repayment,
							principalAndInterest,
							interestOnlySavings(principal, rate),
							60,
							"Your cashflow can support P&I payments, saving significant interest long-term"
					));
				}
			}
			Optional<OffsetAccount> offset = offsets.stream()
					.filter(candidate -> loan.loanId() != null && loan.loanId().equals(candidate.linkedLoanId()))
					.findFirst();
			BigDecimal tenPercent = principal.multiply(new BigDecimal("0.1"));
			if (offset.isPresent() && MoneyMath.safe(offset.get().balance()).compareTo(tenPercent) < 0) {
				BigDecimal saving = MoneyMath.money(tenPercent.multiply(rate));
				optimisations.add(new RepaymentOptimisation(
						loan.loanId(),
						loan.loanName(),
						"Underutilised offset",
						"Maximise offset balance",
						repayment,
						repayment,
						saving,
						12,
						"Building offset balance to 10% of loan ($" + MoneyMath.round(tenPercent) + ") saves $"
								+ MoneyMath.round(saving) + "/year"
				));
			}
			if (!loan.interestOnly() && net30.compareTo(EXTRA_REPAYMENT_CAP) > 0) {
				BigDecimal extra = MoneyMath.money(MoneyMath.min(EXTRA_REPAYMENT_CAP, net30.multiply(new BigDecimal("0.5"))));
				BigDecimal annualExtra = extra.multiply(TWELVE);
				BigDecimal saved = MoneyMath.money(annualExtra.multiply(rate).multiply(BigDecimal.TEN));
				int termReduction = repayment.signum() == 0
						? 0
						: (int) MoneyMath.round(annualExtra.multiply(BigDecimal.TEN).divide(repayment, MathContext.DECIMAL64));
				optimisations.add(new RepaymentOptimisation(
						loan.loanId(),
						loan.loanName(),
						"Minimum repayments",
						"Extra $" + MoneyMath.round(extra) + "/month repayments",
						repayment,
						repayment.add(extra),
						saved,
						termReduction,
						"Extra repayments reduce principal faster, saving interest"
				));
			}
		}
		optimisations.sort(Comparator.comparing(RepaymentOptimisation::interestSavings).reversed());
		return List.copyOf(optimisations);
	}

	/**
	 * Day of month on which cumulative income first covers cumulative expenses within the first 30 days, or -1.
	 */
	int breakEvenDay(CashflowForecast forecast) {
		BigDecimal income = BigDecimal.ZERO;
		BigDecimal expenses = BigDecimal.ZERO;
		List<ForecastPoint> points = forecast.globalForecast();
		for (int i = 0; i < Math.min(BREAK_EVEN_WINDOW, points.size()); i++) {
			ForecastPoint point = points.get(i);
			income = income.add(point.predictedIncome());
			expenses = expenses.add(point.predictedExpenses());
			if (income.compareTo(expenses) >= 0) {
				return point.date().getDayOfMonth();
			}
		}
		return -1;
	}

	/**
	 * Five years of interest-only interest less the same at a flat 70%, a rough stand-in for what principal and
	 * interest repayments would have cost. Not an amortisation schedule.
	 */
	static BigDecimal interestOnlySavings(BigDecimal principal, BigDecimal rate) {
		BigDecimal interestOnly = principal.multiply(rate).multiply(BigDecimal.valueOf(5));
		return MoneyMath.money(interestOnly.subtract(interestOnly.multiply(new BigDecimal("0.7"))));
	}

	static int primaryIncomeDay(List<ForecastPoint> points) {
		Map<Integer, Integer> counts = new TreeMap<>();
		for (ForecastPoint point : points) {
			if (point.predictedIncome().signum() > 0) {
				counts.merge(point.date().getDayOfMonth(), 1, Integer::sum);
			}
		}
		int best = DEFAULT_INCOME_DAY;
		int bestCount = 0;
		for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
			if (entry.getValue() > bestCount) {
				best = entry.getKey();
				bestCount = entry.getValue();
			}
		}
		return best;
	}

	OptimisationSummary summarise(List<SpendingInefficiency> inefficiencies,
								  List<SubscriptionAnalysis> subscriptions,
								  List<SubscriptionAnalysis> priceIncreases,
								  List<CashflowStrategy> strategies) {
		BigDecimal total = BigDecimal.ZERO;
		for (SpendingInefficiency inefficiency : inefficiencies) {
			total = total.add(inefficiency.potentialSavings());
		}
		int highPriority = 0;
		for (CashflowStrategy strategy : strategies) {
			if (strategy.type() != StrategyType.REDUCE_WASTE) {
				total = total.add(MoneyMath.safe(strategy.projectedBenefit()));
			}
			if (strategy.priority() >= CashflowStrategyPlanner.HIGH_PRIORITY) {
				highPriority++;
			}
		}
		return new OptimisationSummary(MoneyMath.money(total), inefficiencies.size(), subscriptions.size(),
				priceIncreases.size(), strategies.size(), highPriority);
	}

	private static LocalDate referenceDate(RecurringPayment payment) {
		return payment.lastOccurrence() != null ? payment.lastOccurrence() : payment.nextExpected();
	}

	static String slug(String value) {
		return value.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", "-");
	}

	public enum FundMovementKind {
		OFFSET,
		SHORTFALL
	}

	public enum Urgency {
		HIGH,
		MEDIUM,
		LOW
	}

	public record OptimisationInput(
			String userId,
			CashflowForecast forecast,
			SpendingProfile spendingProfile,
			List<RecurringPayment> recurringPayments,
			List<LoanSchedule> loans,
			List<OffsetAccount> offsetAccounts,
			Instant generatedAt
	) {
	}

	public record InefficiencyEvidence(
			BigDecimal averageMonthlySpend,
			TrendDirection trendDirection,
			BigDecimal comparableBenchmark
	) {
	}

	public record SpendingInefficiency(
			String id,
			InsightCategory category,
			String merchantOrCategory,
			String description,
			BigDecimal currentSpend,
			BigDecimal benchmarkSpend,
			BigDecimal potentialSavings,
			double confidenceScore,
			InefficiencyEvidence evidence
	) {
	}

	public record SubscriptionAnalysis(
			String recurringId,
			String merchant,
			BigDecimal currentAmount,
			BigDecimal previousAmount,
			BigDecimal priceChangePercent,
			boolean hasPriceIncrease,
			LocalDate firstSeen,
			BigDecimal monthlyImpact,
			BigDecimal yearlyImpact,
			String category
	) {
	}

	public record FundMovementRecommendation(
			FundMovementKind kind,
			String fromAccountId,
			String fromAccountName,
			String toAccountId,
			String toAccountName,
			BigDecimal amount,
			String reason,
			BigDecimal projectedBenefit,
			Urgency urgency
	) {
	}

	public record ScheduledPayment(LocalDate date, String description, BigDecimal amount, String accountId, String recurringId) {
	}

	public record PaymentScheduleOptimisation(
			String description,
			List<ScheduledPayment> currentSchedule,
			List<ScheduledPayment> optimisedSchedule,
			String benefitDescription,
			BigDecimal projectedBenefit
	) {
		public PaymentScheduleOptimisation {
			currentSchedule = List.copyOf(currentSchedule);
			optimisedSchedule = List.copyOf(optimisedSchedule);
		}
	}

	public record RepaymentOptimisation(
			String loanId,
			String loanName,
			String currentStrategy,
			String recommendedStrategy,
			BigDecimal currentMonthlyPayment,
			BigDecimal recommendedMonthlyPayment,
			BigDecimal interestSavings,
			int termReductionMonths,
			String rationale
	) {
	}

	public record OptimisationSummary(
			BigDecimal totalPotentialSavings,
			int inefficiencyCount,
			int subscriptionCount,
			int priceIncreaseCount,
			int strategyCount,
			int highPriorityActions
	) {
	}

	public record OptimisationResult(
			String userId,
			Instant generatedAt,
			List<SpendingInefficiency> inefficiencies,
			List<SubscriptionAnalysis> subscriptions,
			List<SubscriptionAnalysis> subscriptionsWithPriceIncrease,
			List<FundMovementRecommendation> fundMovements,
			List<PaymentScheduleOptimisation> scheduleOptimisations,
			List<RepaymentOptimisation> repaymentOptimisations,
			int breakEvenDay,
			List<CashflowStrategy> strategies,
			OptimisationSummary summary
	) {
	}
}
