package my.cashflowplanner.app.service;

import my.cashflowplanner.app.config.CashflowProperties;
import my.cashflowplanner.app.dto.CashflowRequest;
import my.cashflowplanner.app.dto.CustomScenarioRequest;
import my.cashflowplanner.app.dto.InsightRequest;
import my.cashflowplanner.app.dto.InsightResponse;
import my.cashflowplanner.app.dto.OptimisationResponse;
import my.cashflowplanner.app.dto.StressTestRequest;
import my.cashflowplanner.app.dto.TransactionImportResponse;
import my.cashflowplanner.app.importer.TransactionCsvParser;
import my.cashflowplanner.app.model.AccountBalance;
import my.cashflowplanner.app.model.AccountType;
import my.cashflowplanner.app.model.CashflowForecast;
import my.cashflowplanner.app.model.CashflowInput;
import my.cashflowplanner.app.model.CashflowInsight;
import my.cashflowplanner.app.model.CashflowStrategy;
import my.cashflowplanner.app.model.ForecastConfig;
import my.cashflowplanner.app.model.IncomeStream;
import my.cashflowplanner.app.model.InsightCategory;
import my.cashflowplanner.app.model.OffsetAccount;
import my.cashflowplanner.app.model.SpendingProfile;
import my.cashflowplanner.app.model.StrategyStatus;
import my.cashflowplanner.app.model.StressScenario;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.OptimisationInput;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.OptimisationResult;
import my.cashflowplanner.app.service.IncomeNormalizer.NormalisedIncome;
import my.cashflowplanner.app.service.ShortfallSummaryAnalyzer.QuickForecast;
import my.cashflowplanner.app.service.StressTestEngine.StressTestOutput;
import my.cashflowplanner.app.service.StressTestEngine.StressTestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the REST layer. Resolves defaults from configuration and the clock, rejects invalid snapshots,
 * then delegates to the engines. Nothing is stored between calls.
 */
@Service
public class CashflowService {
	private static final Logger logger = LoggerFactory.getLogger(CashflowService.class);
	private static final int QUICK_FORECAST_DEFAULT_DAYS = 30;

	private final Clock clock;
	private final CashflowProperties properties;
	private final CashflowInputValidator validator;
	private final CashflowForecastEngine forecastEngine;
	private final SpendingPatternAnalyzer patternAnalyzer;
	private final ShortfallSummaryAnalyzer summaryAnalyzer;
	private final CashflowOptimisationEngine optimisationEngine;
	private final CashflowInsightGenerator insightGenerator;
	private final StressTestEngine stressTestEngine;
	private final StressScenarioLibrary scenarioLibrary;
	private final CashflowStrategyPlanner strategyPlanner;
	private final IncomeNormalizer incomeNormalizer;
	private final TransactionCsvParser csvParser;

	public CashflowService(Clock clock,
						   CashflowProperties properties,
						   CashflowInputValidator validator,
						   CashflowForecastEngine forecastEngine,
						   SpendingPatternAnalyzer patternAnalyzer,
						   ShortfallSummaryAnalyzer summaryAnalyzer,
						   CashflowOptimisationEngine optimisationEngine,
						   CashflowInsightGenerator insightGenerator,
						   StressTestEngine stressTestEngine,
						   StressScenarioLibrary scenarioLibrary,
						   CashflowStrategyPlanner strategyPlanner,
						   IncomeNormalizer incomeNormalizer,
						   TransactionCsvParser csvParser) {
		this.clock = clock;
		this.properties = properties;
		this.validator = validator;
		this.forecastEngine = forecastEngine;
		this.patternAnalyzer = patternAnalyzer;
		this.summaryAnalyzer = summaryAnalyzer;
		this.optimisationEngine = optimisationEngine;
		this.insightGenerator = insightGenerator;
		this.stressTestEngine = stressTestEngine;
		this.scenarioLibrary = scenarioLibrary;
		this.strategyPlanner = strategyPlanner;
		this.incomeNormalizer = incomeNormalizer;
		this.csvParser = csvParser;
	}

	public CashflowForecast forecast(CashflowRequest request) {
		CashflowInput input = toInput(request);
		logger.info("Forecasting {} days for user {} across {} accounts.",
				input.config().forecastDays(), input.userId(), input.accounts().size());
		return forecastEngine.generate(input);
	}

	public OptimisationResponse optimise(CashflowRequest request) {
		CashflowInput input = toInput(request);
		logger.info("Optimising cashflow for user {}.", input.userId());
		CashflowForecast forecast = forecastEngine.generate(input);
		OptimisationResult optimisation = optimise(input, forecast, request.spendingProfile());
		return new OptimisationResponse(forecast, optimisation);
	}

	public InsightResponse insights(InsightRequest request) {
		CashflowInput input = toInput(request.snapshot());
		boolean includeStress = Boolean.TRUE.equals(request.includeStressTest());
		logger.info("Generating insights for user {} (stress={}).", input.userId(), includeStress);
		Instant now = clock.instant();
		CashflowForecast forecast = forecastEngine.generate(input);
		OptimisationResult optimisation = optimise(input, forecast, request.snapshot().spendingProfile());
		StressTestOutput stress = includeStress
				? stressTestEngine.run(input, scenarioLibrary.predefined(), now)
				: null;
		List<CashflowInsight> insights = insightGenerator.generate(input.userId(), forecast, optimisation, stress, now);

		Map<InsightCategory, Integer> counts = new EnumMap<>(InsightCategory.class);
		insightGenerator.groupByCategory(insights).forEach((category, items) -> counts.put(category, items.size()));
		return new InsightResponse(
				insights,
				insightGenerator.highPriority(insights).size(),
				insightGenerator.unread(insights).size(),
				insightGenerator.totalSavingsPotential(insights),
				counts
		);
	}

	public QuickForecast quickForecast(BigDecimal currentBalance,
									   BigDecimal monthlyIncome,
									   BigDecimal monthlyExpenses,
									   Integer days) {
		int horizon = days == null ? QUICK_FORECAST_DEFAULT_DAYS : days;
		if (horizon < 0 || horizon > properties.forecast().maxDays()) {
			throw new IllegalArgumentException("days must be between 0 and " + properties.forecast().maxDays());
		}
		if (currentBalance == null || monthlyIncome == null || monthlyExpenses == null) {
			throw new IllegalArgumentException("currentBalance, monthlyIncome and monthlyExpenses are required");
		}
		return summaryAnalyzer.quickForecast(currentBalance, monthlyIncome, monthlyExpenses, horizon);
	}

	public List<StressScenario> scenarios() {
		return scenarioLibrary.predefined();
	}

	public StressTestOutput stressTest(StressTestRequest request) {
		CashflowInput input = toInput(request.snapshot());
		List<StressScenario> scenarios = resolveScenarios(request.scenarioIds());
		logger.info("Running {} stress scenarios for user {}.", scenarios.size(), input.userId());
		return stressTestEngine.run(input, scenarios, clock.instant());
	}

	public StressTestResult customStressTest(CustomScenarioRequest request) {
		List<String> errors = validator.validate(request.parameters());
		if (!errors.isEmpty()) {
			throw new IllegalArgumentException(String.join("; ", errors));
		}
		CashflowInput input = toInput(request.snapshot());
		StressScenario scenario = scenarioLibrary.custom(request.name(), request.description(), request.parameters());
		logger.info("Running custom stress scenario {} for user {}.", scenario.id(), input.userId());
		return stressTestEngine.runSingle(input, scenario);
	}

	public TransactionImportResponse importTransactions(byte[] payload, String accountId) {
		TransactionCsvParser.ImportResult result = csvParser.parse(payload, accountId);
		logger.info("Imported {} transactions ({} rows skipped).",
				result.transactions().size(), result.skippedRows().size());
		return new TransactionImportResponse(
				result.transactions(),
				result.skippedRows(),
				patternAnalyzer.analyze(result.transactions()),
				patternAnalyzer.buildProfile(result.transactions())
		);
	}

	public NormalisedIncome normaliseIncome(List<IncomeStream> streams) {
		List<String> errors = new ArrayList<>();
		for (IncomeStream stream : streams) {
			if (stream == null || stream.monthlyAmount() == null || stream.type() == null || stream.frequency() == null) {
				errors.add("income stream " + (stream == null ? "<null>" : stream.id())
						+ " needs a type, frequency and monthlyAmount");
			} else if (stream.monthlyAmount().signum() < 0) {
				errors.add("income stream " + stream.id() + " has a negative monthlyAmount");
			}
		}
		if (!errors.isEmpty()) {
			throw new IllegalArgumentException(String.join("; ", errors));
		}
		return incomeNormalizer.normalise(streams);
	}

	public CashflowStrategy transitionStrategy(CashflowStrategy strategy, StrategyStatus target) {
		CashflowStrategy updated = strategyPlanner.transition(strategy, target, clock.instant());
		logger.info("Strategy {} moved to {}.", updated.id(), updated.status());
		return updated;
	}

	/**
	 * Applies configured defaults, optional income normalisation and validation.
	 *
	 * @throws IllegalArgumentException listing every validation problem
	 */
	CashflowInput toInput(CashflowRequest request) {
		if (request == null) {
			throw new IllegalArgumentException("Cashflow snapshot is empty");
		}
		CashflowProperties.Forecast defaults = properties.forecast();
		LocalDate today = request.today() == null ? LocalDate.now(clock) : request.today();
		boolean bands = request.includeConfidenceBands() == null
				? defaults.includeConfidenceBands()
				: request.includeConfidenceBands();
		ForecastConfig config = new ForecastConfig(request.forecastDays(), bands, today, request.attribution())
				.withDefaults(defaults.defaultDays(), defaults.attribution());
		CashflowInput input = new CashflowInput(
				request.userId(),
				request.accounts(),
				request.transactions(),
				request.recurringPayments(),
				request.incomeStreams(),
				request.loanSchedules(),
				request.plannedExpenses(),
				config
		);
		List<String> errors = validator.validate(input, defaults.maxDays());
		if (!errors.isEmpty()) {
			throw new IllegalArgumentException(String.join("; ", errors));
		}
		if (Boolean.TRUE.equals(request.normaliseIncome())) {
			input = input.withIncomeStreams(incomeNormalizer.normalise(input.incomeStreams()).forecastStreams());
		}
		return input;
	}

	private OptimisationResult optimise(CashflowInput input, CashflowForecast forecast, SpendingProfile profile) {
		SpendingProfile resolved = profile == null ? patternAnalyzer.buildProfile(input.transactions()) : profile;
		return optimisationEngine.optimise(new OptimisationInput(
				input.userId(),
				forecast,
				resolved,
				input.recurringPayments(),
				input.loanSchedules(),
				offsetAccounts(input.accounts()),
				clock.instant()
		));
	}

	private List<OffsetAccount> offsetAccounts(List<AccountBalance> accounts) {
		return accounts.stream()
				.filter(account -> account.accountType() == AccountType.OFFSET && account.linkedLoanId() != null)
				.map(account -> new OffsetAccount(account.accountId(), account.accountName(), account.currentBalance(),
						account.linkedLoanId()))
				.toList();
	}

	private List<StressScenario> resolveScenarios(List<String> ids) {
		if (ids == null || ids.isEmpty()) {
			return scenarioLibrary.predefined();
		}
		List<StressScenario> scenarios = new ArrayList<>();
		for (String id : ids) {
			scenarios.add(scenarioLibrary.find(id)
					.orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown stress scenario: " + id)));
		}
		return scenarios;
	}
}
