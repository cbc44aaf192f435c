package my.cashflowplanner.app.service;

import jakarta.annotation.PreDestroy;
import my.cashflowplanner.app.config.CashflowProperties;
import my.cashflowplanner.app.model.CashflowForecast;
import my.cashflowplanner.app.model.CashflowInput;
import my.cashflowplanner.app.model.CashflowStrategy;
import my.cashflowplanner.app.model.ForecastPoint;
import my.cashflowplanner.app.model.StrategyStatus;
import my.cashflowplanner.app.model.StrategyStep;
import my.cashflowplanner.app.model.StrategyType;
import my.cashflowplanner.app.model.StressScenario;
import my.cashflowplanner.app.model.StressScenarioType;
import my.cashflowplanner.app.service.util.MoneyMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Re-runs the forecast under perturbed snapshots and scores how long the household survives each one.
 * Scenario simulations are independent and run on a bounded worker pool; results keep scenario order.
 */
@Service
public class StressTestEngine {
	private static final Logger logger = LoggerFactory.getLogger(StressTestEngine.class);
	private static final double FULL_SCORE_MONTHS = 3.0;
	private static final double DAYS_PER_MONTH = 30.0;
	private static final BigDecimal BUFFER_FACTOR = new BigDecimal("1.5");
	private static final BigDecimal REDUCTION_TRIGGER = new BigDecimal("1000");

	private final CashflowForecastEngine forecastEngine;
	private final StressDeltaApplier deltaApplier;
	private final ExecutorService executor;

	public StressTestEngine(CashflowForecastEngine forecastEngine,
							StressDeltaApplier deltaApplier,
							CashflowProperties properties) {
		this.forecastEngine = forecastEngine;
		this.deltaApplier = deltaApplier;
		this.executor = Executors.newFixedThreadPool(properties.stress().parallelism());
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	public StressTestOutput run(CashflowInput input, List<StressScenario> scenarios, Instant generatedAt) {
		long started = System.nanoTime();
		List<Callable<CashflowForecast>> tasks = new ArrayList<>(scenarios.size() + 1);
		tasks.add(() -> forecastEngine.generate(input));
		for (StressScenario scenario : scenarios) {
			tasks.add(() -> forecastEngine.generate(deltaApplier.apply(input, scenario.parameters())));
		}
		List<CashflowForecast> forecasts = invokeInOrder(tasks);
		CashflowForecast baseline = forecasts.get(0);

		List<StressTestResult> results = new ArrayList<>(scenarios.size());
		for (int i = 0; i < scenarios.size(); i++) {
			results.add(analyse(scenarios.get(i), baseline, forecasts.get(i + 1)));
		}
		int resilience = resilienceScore(results);
		StressTestSummary summary = summarise(results, baseline);
		if (logger.isDebugEnabled()) {
			logger.debug("Stress tested {} scenarios in {} ms (resilience={}).",
					scenarios.size(), (System.nanoTime() - started) / 1_000_000, resilience);
		}
		return new StressTestOutput(input.userId(), generatedAt, baselineResult(baseline), results, resilience, summary);
	}

	public StressTestResult runSingle(CashflowInput input, StressScenario scenario) {
		List<CashflowForecast> forecasts = invokeInOrder(List.of(
				() -> forecastEngine.generate(input),
				() -> forecastEngine.generate(deltaApplier.apply(input, scenario.parameters()))
		));
		return analyse(scenario, forecasts.get(0), forecasts.get(1));
	}

	StressTestResult baselineResult(CashflowForecast baseline) {
		double survival = survivalMonths(baseline);
		return new StressTestResult(
				"baseline",
				"Baseline (No Stress)",
				null,
				baseline.globalForecast(),
				baseline.globalForecast(),
				survival,
				baseline.shortfallAnalysis().maxShortfallAmount(),
				MoneyMath.ZERO,
				0,
				List.of(),
				MoneyMath.ZERO,
				MoneyMath.ZERO,
				contribution(survival)
		);
	}

	StressTestResult analyse(StressScenario scenario, CashflowForecast baseline, CashflowForecast stressed) {
		double survival = survivalMonths(stressed);
		BigDecimal impact = MoneyMath.money(endBalance(stressed).subtract(endBalance(baseline)));
		int daysAdded = stressed.shortfallAnalysis().totalShortfallDays() - baseline.shortfallAnalysis().totalShortfallDays();
		BigDecimal requiredSavings = MoneyMath.ZERO;
		BigDecimal requiredIncrease = MoneyMath.ZERO;
		if (stressed.shortfallAnalysis().hasShortfall()) {
			BigDecimal shortfall = stressed.shortfallAnalysis().maxShortfallAmount();
			requiredSavings = MoneyMath.scale(shortfall, BUFFER_FACTOR);
			requiredIncrease = MoneyMath.money(shortfall.doubleValue() / Math.max(1.0, survival));
		}
		return new StressTestResult(
				scenario.id(),
				scenario.name(),
				scenario.type(),
				baseline.globalForecast(),
				stressed.globalForecast(),
				survival,
				stressed.shortfallAnalysis().maxShortfallAmount(),
				impact,
				daysAdded,
				mitigations(scenario, stressed, impact),
				requiredSavings,
				requiredIncrease,
				contribution(survival)
		);
	}

	/**
	 * Months until the first shortfall day, or the whole horizon in months when there is none.
	 */
	static double survivalMonths(CashflowForecast forecast) {
		LocalDate first = forecast.shortfallAnalysis().firstShortfallDate();
		if (!forecast.shortfallAnalysis().hasShortfall() || first == null) {
			return forecast.metadata().forecastDays() / DAYS_PER_MONTH;
		}
		long days = ChronoUnit.DAYS.between(forecast.generatedFor(), first);
		return Math.max(0L, days) / DAYS_PER_MONTH;
	}

	static double contribution(double survivalMonths) {
		return Math.min(100.0, survivalMonths / FULL_SCORE_MONTHS * 100.0);
	}

	/**
	 * Average of the per-scenario contributions, rounded. Zero when nothing was tested.
	 */
	static int resilienceScore(List<StressTestResult> results) {
		if (results.isEmpty()) {
			return 0;
		}
		double total = 0.0;
		for (StressTestResult result : results) {
			total += result.resilienceContribution();
		}
		return (int) Math.round(total / results.size());
	}

	StressTestSummary summarise(List<StressTestResult> results, CashflowForecast baseline) {
		BigDecimal burnBuffer = MoneyMath.scale(baseline.summary().monthlyBurnRate(), BigDecimal.valueOf(3));
		if (results.isEmpty()) {
			return new StressTestSummary("None", 0.0, 0.0, burnBuffer, List.of());
		}
		StressTestResult worst = results.get(0);
		double totalSurvival = 0.0;
		BigDecimal maxShortfall = BigDecimal.ZERO;
		for (StressTestResult result : results) {
			if (result.survivalTime() < worst.survivalTime()) {
				worst = result;
			}
			totalSurvival += result.survivalTime();
			maxShortfall = MoneyMath.max(maxShortfall, result.maxShortfallAmount());
		}
		double shortest = worst.survivalTime();
		double average = totalSurvival / results.size();

		Set<String> risks = new LinkedHashSet<>();
		if (shortest < 1.0) {
			risks.add("Insufficient emergency buffer");
		}
		if (average < 2.0) {
			risks.add("Low cashflow resilience");
		}
		for (StressTestResult result : results) {
			if (result.survivalTime() >= 1.0) {
				continue;
			}
			if (result.scenarioType() == StressScenarioType.INTEREST_RATE_RISE) {
				risks.add("High interest rate sensitivity");
			}
			if (result.scenarioType() == StressScenarioType.INCOME_DROP) {
				risks.add("High income dependency");
			}
		}
		BigDecimal emergencyFund = MoneyMath.max(MoneyMath.scale(maxShortfall, BUFFER_FACTOR), burnBuffer);
		return new StressTestSummary(worst.scenarioName(), shortest, average, MoneyMath.money(emergencyFund),
				List.copyOf(risks));
	}

	private List<CashflowStrategy> mitigations(StressScenario scenario, CashflowForecast stressed, BigDecimal impact) {
		List<CashflowStrategy> strategies = new ArrayList<>();
		String prefix = "mitigate-" + scenario.id();
		if (stressed.shortfallAnalysis().hasShortfall()) {
			BigDecimal shortfall = stressed.shortfallAnalysis().maxShortfallAmount();
			BigDecimal target = MoneyMath.scale(shortfall, BUFFER_FACTOR);
			strategies.add(mitigation(prefix + "-emergency", StrategyType.PREVENT_SHORTFALL, 95, "Build Emergency Fund",
					"Build an emergency fund of $" + MoneyMath.round(target) + " to survive this scenario", 0.9, shortfall,
					List.of(
							new StrategyStep(1, "OPEN_ACCOUNT", "Open a dedicated high-interest savings account", false),
							new StrategyStep(2, "AUTOMATE", "Set up automatic transfer of $"
									+ MoneyMath.round(MoneyMath.divide(target, 12)) + "/month", false),
							new StrategyStep(3, "REVIEW", "Review progress quarterly and adjust as needed", true)
					)));
			if (impact.abs().compareTo(REDUCTION_TRIGGER) > 0) {
				strategies.add(mitigation(prefix + "-reduce", StrategyType.REDUCE_WASTE, 85, "Reduce Discretionary Spending",
						"Cut non-essential expenses to improve cashflow resilience", 0.8,
						MoneyMath.scale(impact.abs(), new BigDecimal("0.3")),
						List.of(
								new StrategyStep(1, "REVIEW", "Review all subscription services", false),
								new StrategyStep(2, "CANCEL", "Cancel or pause non-essential subscriptions", false),
								new StrategyStep(3, "BUDGET", "Set strict budgets for entertainment and dining", false)
						)));
			}
		}
		if (scenario.type() == StressScenarioType.INCOME_DROP) {
			strategies.add(mitigation(prefix + "-income", StrategyType.OPTIMISE, 80, "Diversify Income Sources",
					"Consider additional income streams to reduce single-source dependency", 0.7, MoneyMath.ZERO,
					List.of(
							new StrategyStep(1, "ASSESS", "Identify skills that could generate additional income", false),
							new StrategyStep(2, "EXPLORE", "Research side income opportunities", false)
					)));
		}
		if (scenario.type() == StressScenarioType.INTEREST_RATE_RISE) {
			strategies.add(mitigation(prefix + "-lock", StrategyType.REPAYMENT_OPTIMISE, 75, "Consider Fixed Rate Option",
					"Lock in current rates with a fixed-rate period to protect against future rises", 0.75,
					MoneyMath.scale(impact.abs(), new BigDecimal("0.5")),
					List.of(
							new StrategyStep(1, "RESEARCH", "Compare fixed-rate options from your lender", false),
							new StrategyStep(2, "CALCULATE", "Calculate break-even point for fixing", false),
							new StrategyStep(3, "DECIDE", "Consider splitting loan between fixed and variable", true)
					)));
		}
		return List.copyOf(strategies);
	}

	private static CashflowStrategy mitigation(String id, StrategyType type, int priority, String title, String summary,
											   double confidence, BigDecimal benefit, List<StrategyStep> steps) {
		return new CashflowStrategy(id, type, priority, title, summary, null, confidence, benefit, steps,
				List.of(), List.of(), List.of(), StrategyStatus.PENDING, null);
	}

	private static BigDecimal endBalance(CashflowForecast forecast) {
		ForecastPoint last = forecast.lastPoint();
		return last == null ? BigDecimal.ZERO : last.predictedBalance();
	}

	private List<CashflowForecast> invokeInOrder(List<Callable<CashflowForecast>> tasks) {
		try {
			List<Future<CashflowForecast>> futures = executor.invokeAll(tasks);
			List<CashflowForecast> forecasts = new ArrayList<>(futures.size());
			for (Future<CashflowForecast> future : futures) {
				forecasts.add(future.get());
			}
			return forecasts;
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Stress test interrupted", ex);
		} catch (ExecutionException ex) {
			Throwable cause = ex.getCause();
			if (cause instanceof RuntimeException runtime) {
				throw runtime;
			}
			throw new IllegalStateException("Stress scenario failed", cause);
		}
	}

	public record StressTestResult(
			String scenarioId,
			String scenarioName,
			StressScenarioType scenarioType,
			List<ForecastPoint> originalForecast,
			List<ForecastPoint> stressedForecast,
			double survivalTime,
			BigDecimal maxShortfallAmount,
			BigDecimal balanceImpact,
			int shortfallDaysAdded,
			List<CashflowStrategy> mitigationStrategies,
			BigDecimal requiredSavings,
			BigDecimal requiredIncomeIncrease,
			double resilienceContribution
	) {
	}

	public record StressTestSummary(
			String mostVulnerableScenario,
			double shortestSurvivalTime,
			double averageSurvivalTime,
			BigDecimal recommendedEmergencyFund,
			List<String> criticalRisks
	) {
	}

	public record StressTestOutput(
			String userId,
			Instant generatedAt,
			StressTestResult baselineResult,
			List<StressTestResult> scenarioResults,
			int resilienceScore,
			StressTestSummary summary
	) {
	}
}
