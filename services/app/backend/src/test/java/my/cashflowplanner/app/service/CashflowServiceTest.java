package my.cashflowplanner.app.service;

import my.cashflowplanner.app.config.CashflowProperties;
import my.cashflowplanner.app.dto.CashflowRequest;
import my.cashflowplanner.app.dto.CustomScenarioRequest;
import my.cashflowplanner.app.dto.StressTestRequest;
import my.cashflowplanner.app.importer.TransactionCsvParser;
import my.cashflowplanner.app.model.AccountType;
import my.cashflowplanner.app.model.CashflowForecast;
import my.cashflowplanner.app.model.CashflowInput;
import my.cashflowplanner.app.model.CashflowStrategy;
import my.cashflowplanner.app.model.ExpenseAttribution;
import my.cashflowplanner.app.model.IncomeFrequency;
import my.cashflowplanner.app.model.IncomeStream;
import my.cashflowplanner.app.model.IncomeType;
import my.cashflowplanner.app.model.StrategyStatus;
import my.cashflowplanner.app.model.StrategyType;
import my.cashflowplanner.app.model.StressParameters;
import my.cashflowplanner.app.model.StressScenario;
import my.cashflowplanner.app.support.CashflowFixtures;
import my.cashflowplanner.app.tax.AustralianIncomeTaxCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static my.cashflowplanner.app.support.CashflowFixtures.account;
import static my.cashflowplanner.app.support.CashflowFixtures.monthlyPayment;
import static my.cashflowplanner.app.support.CashflowFixtures.monthlySalary;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class CashflowServiceTest {
	private static final Instant NOW = Instant.parse("2025-03-01T08:00:00Z");
	private static final LocalDate CLOCK_DATE = LocalDate.of(2025, 3, 1);

	@Mock
	private CashflowForecastEngine forecastEngine;

	@Mock
	private CashflowOptimisationEngine optimisationEngine;

	@Mock
	private CashflowInsightGenerator insightGenerator;

	@Mock
	private StressTestEngine stressTestEngine;

	@Mock
	private TransactionCsvParser csvParser;

	private final StressScenarioLibrary scenarioLibrary = new StressScenarioLibrary();

	private CashflowService service;

	@BeforeEach
	void setUp() {
		service = service(forecastEngine);
	}

	private CashflowService service(CashflowForecastEngine engine) {
		CashflowProperties properties = CashflowProperties.defaults();
		return new CashflowService(
				Clock.fixed(NOW, ZoneOffset.UTC),
				properties,
				new CashflowInputValidator(),
				engine,
				new SpendingPatternAnalyzer(),
				new ShortfallSummaryAnalyzer(),
				optimisationEngine,
				insightGenerator,
				stressTestEngine,
				scenarioLibrary,
				new CashflowStrategyPlanner(properties),
				new IncomeNormalizer(new AustralianIncomeTaxCalculator()),
				csvParser);
	}

	@Test
	void forecastFillsDefaultsFromConfigurationAndClock() {
		service.forecast(request(null, null));

		ArgumentCaptor<CashflowInput> captor = ArgumentCaptor.forClass(CashflowInput.class);
		verify(forecastEngine).generate(captor.capture());
		CashflowInput input = captor.getValue();
		assertThat(input.userId()).isEqualTo("user-1");
		assertThat(input.config().today()).isEqualTo(CLOCK_DATE);
		assertThat(input.config().forecastDays()).isEqualTo(90);
		assertThat(input.config().includeConfidenceBands()).isTrue();
		assertThat(input.config().attribution()).isEqualTo(ExpenseAttribution.OWNING_ACCOUNT);
	}

	@Test
	void explicitSettingsWin() {
		CashflowRequest request = new CashflowRequest("user-1",
				List.of(account("main", AccountType.TRANSACTIONAL, "1000")),
				null, null, null, null, null, 30, false, LocalDate.of(2025, 1, 1), ExpenseAttribution.EVERY_ACCOUNT,
				null, null);

		CashflowInput input = service.toInput(request);

		assertThat(input.config().forecastDays()).isEqualTo(30);
		assertThat(input.config().includeConfidenceBands()).isFalse();
		assertThat(input.config().today()).isEqualTo(LocalDate.of(2025, 1, 1));
		assertThat(input.config().attribution()).isEqualTo(ExpenseAttribution.EVERY_ACCOUNT);
		assertThat(input.transactions()).isEmpty();
	}

	@Test
	void normalisesGrossIncomeWhenAsked() {
		CashflowRequest request = new CashflowRequest("user-1",
				List.of(account("main", AccountType.TRANSACTIONAL, "1000")),
				null, null, List.of(monthlySalary("salary", "5000", CLOCK_DATE.plusDays(1), "main")), null, null,
				null, null, null, null, true, null);

		CashflowInput input = service.toInput(request);

		assertThat(input.incomeStreams()).singleElement()
				.satisfies(stream -> assertThat(stream.monthlyAmount()).isEqualByComparingTo("4176"));
	}

	@Test
	void weeklySalaryIsForecastAfterTax() {
		IncomeStream weekly = new IncomeStream("salary", "Salary", IncomeType.SALARY, new BigDecimal("1500"),
				IncomeFrequency.WEEKLY, LocalDate.of(2025, 1, 2), 0.0, "main");
		CashflowRequest request = new CashflowRequest("user-1",
				List.of(account("main", AccountType.TRANSACTIONAL, "1000")),
				null, null, List.of(weekly), null, null, 10, false, LocalDate.of(2025, 1, 1), null, true, null);

		CashflowForecast forecast = service(CashflowFixtures.forecastEngine()).forecast(request);

		// 1197.15 net a week, spread as 1197.15 * 4.33 * 7 / 30 per occurrence
		assertThat(forecast.globalForecast())
				.filteredOn(point -> point.date().equals(LocalDate.of(2025, 1, 2)))
				.singleElement()
				.satisfies(point -> assertThat(point.predictedIncome()).isEqualByComparingTo("1209.52"));
		assertThat(forecast.globalForecast())
				.filteredOn(point -> point.date().equals(LocalDate.of(2025, 1, 9)))
				.singleElement()
				.satisfies(point -> assertThat(point.predictedIncome()).isEqualByComparingTo("1209.52"));
	}

	@Test
	void normaliseIncomeRequiresFrequency() {
		IncomeStream noFrequency = new IncomeStream("salary", "Salary", IncomeType.SALARY, new BigDecimal("1500"),
				null, null, 0.0, null);

		assertThatThrownBy(() -> service.normaliseIncome(List.of(noFrequency)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("income stream salary needs a type, frequency and monthlyAmount");
	}

	@Test
	void rejectsInvalidSnapshotWithEveryProblem() {
		CashflowRequest request = new CashflowRequest("user-1",
				List.of(account("main", AccountType.TRANSACTIONAL, "100"), account("main", AccountType.SAVINGS, "5")),
				null, null, null, null, null, 5000, null, null, null, null, null);

		assertThatThrownBy(() -> service.forecast(request))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("config.forecastDays must not exceed 1825; account.accountId must be unique: main");
		verifyNoInteractions(forecastEngine);
	}

	@Test
	void rejectsNullListEntriesAsInvalidInput() {
		CashflowRequest request = new CashflowRequest("user-1",
				Arrays.asList(account("main", AccountType.TRANSACTIONAL, "100"), null),
				null, null, Arrays.asList((IncomeStream) null), null, null, null, null, null, null, null, null);

		assertThatThrownBy(() -> service.forecast(request))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("accounts must not contain null entries");
		verifyNoInteractions(forecastEngine);
	}

	@Test
	void unknownStressScenarioIsNotFound() {
		StressTestRequest request = new StressTestRequest(request(null, null), List.of("income-drop-50", "meteor"));

		assertThatThrownBy(() -> service.stressTest(request))
				.isInstanceOfSatisfying(ResponseStatusException.class, ex -> {
					assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
					assertThat(ex.getReason()).isEqualTo("Unknown stress scenario: meteor");
				});
		verifyNoInteractions(stressTestEngine);
	}

	@Test
	void emptyScenarioSelectionRunsWholeLibrary() {
		service.stressTest(new StressTestRequest(request(null, null), List.of()));

		verify(stressTestEngine).run(any(CashflowInput.class), eq(scenarioLibrary.predefined()), eq(NOW));
	}

	@Test
	void customScenarioParametersAreValidatedFirst() {
		CustomScenarioRequest request = new CustomScenarioRequest(request(null, null), "Job loss", null,
				new StressParameters(new BigDecimal("150"), null, null, null, null, null));

		assertThatThrownBy(() -> service.customStressTest(request))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("incomeDropPercent must be between 0 and 100");
		verifyNoInteractions(stressTestEngine);
	}

	@Test
	void customScenarioRunsWithDerivedId() {
		StressParameters parameters = new StressParameters(new BigDecimal("100"), 3, null, null, null, null);

		service.customStressTest(new CustomScenarioRequest(request(null, null), "Job loss", null, parameters));

		ArgumentCaptor<StressScenario> captor = ArgumentCaptor.forClass(StressScenario.class);
		verify(stressTestEngine).runSingle(any(CashflowInput.class), captor.capture());
		assertThat(captor.getValue().id()).isEqualTo("custom-job-loss");
		assertThat(captor.getValue().parameters()).isEqualTo(parameters);
	}

	@Test
	void quickForecastDefaultsToThirtyDays() {
		ShortfallSummaryAnalyzer.QuickForecast forecast = service.quickForecast(new BigDecimal("1000"),
				new BigDecimal("4500"), new BigDecimal("3000"), null);

		assertThat(forecast.days()).isEqualTo(30);
		assertThat(forecast.endBalance()).isEqualByComparingTo("2500");
		assertThat(forecast.hasShortfall()).isFalse();
	}

	@Test
	void quickForecastRejectsHorizonOutsideBounds() {
		assertThatThrownBy(() -> service.quickForecast(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, -1))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("days must be between 0 and 1825");
		assertThatThrownBy(() -> service.quickForecast(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, 1826))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> service.quickForecast(null, BigDecimal.ONE, BigDecimal.ONE, 30))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void normaliseIncomeRejectsNegativeAmounts() {
		IncomeStream negative = new IncomeStream("side", "Side hustle", IncomeType.OTHER, new BigDecimal("-5"),
				IncomeFrequency.MONTHLY, null, 0.0, null);

		assertThatThrownBy(() -> service.normaliseIncome(List.of(negative)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("income stream side has a negative monthlyAmount");
	}

	@Test
	void transitionUsesServiceClock() {
		CashflowStrategy expired = new CashflowStrategy("strategy-fund-0", StrategyType.MAXIMISE_OFFSET, 90, "Move",
				null, null, 0.9, BigDecimal.TEN, null, null, null, null, StrategyStatus.PENDING,
				NOW.minusSeconds(3600));
		CashflowStrategy live = new CashflowStrategy("strategy-fund-1", StrategyType.MAXIMISE_OFFSET, 90, "Move",
				null, null, 0.9, BigDecimal.TEN, null, null, null, null, StrategyStatus.PENDING,
				NOW.plusSeconds(3600));

		assertThatThrownBy(() -> service.transitionStrategy(expired, StrategyStatus.ACCEPTED))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Strategy strategy-fund-0 has expired");
		assertThat(service.transitionStrategy(live, StrategyStatus.DISMISSED).status())
				.isEqualTo(StrategyStatus.DISMISSED);
	}

	private static CashflowRequest request(Integer days, LocalDate today) {
		return new CashflowRequest("user-1",
				List.of(account("main", AccountType.TRANSACTIONAL, "10000")),
				null,
				List.of(monthlyPayment("rent", "Landlord", "4500", CLOCK_DATE.plusDays(5), "main")),
				List.of(monthlySalary("salary", "5000", CLOCK_DATE.plusDays(1), "main")),
				null, null, days, null, today, null, null, null);
	}
}
