package my.cashflowplanner.app.service;

import my.cashflowplanner.app.model.StressParameters;
import my.cashflowplanner.app.model.StressScenario;
import my.cashflowplanner.app.model.StressScenarioType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class StressScenarioLibraryTest {
	private final StressScenarioLibrary library = new StressScenarioLibrary();

	@Test
	void predefinedScenariosAreStable() {
		assertThat(library.predefined()).extracting(StressScenario::id).containsExactly(
				"income-drop-50", "income-loss-100", "expense-shock-5k", "expense-shock-15k",
				"rate-rise-100bp", "rate-rise-200bp", "inflation-high", "combined-mild", "combined-severe");
		assertThat(library.find("rate-rise-200bp")).get()
				.extracting(scenario -> scenario.parameters().interestRateIncreaseBps()).isEqualTo(200);
		assertThat(library.find("nope")).isEmpty();
	}

	@Test
	void incomeDropDescriptionsDoNotPromiseARecovery() {
		assertThat(library.find("income-drop-50")).get().extracting(StressScenario::description)
				.isEqualTo("Simulates a 50% reduction in income across the forecast horizon");
		assertThat(StressScenarioLibrary.describe(new StressParameters(new BigDecimal("100"), 6, null, null, null, null)))
				.isEqualTo("100% income drop across the forecast horizon");
	}

	@Test
	void customScenarioIdIsDerivedFromName() {
		StressParameters parameters = new StressParameters(new BigDecimal("40"), 4, new BigDecimal("2500"), null, null, 75);

		StressScenario first = library.custom("  Job loss in March! ", null, parameters);
		StressScenario second = library.custom("Job loss in March!", "mine", parameters);

		assertThat(first.id()).isEqualTo("custom-job-loss-in-march");
		assertThat(second.id()).isEqualTo(first.id());
		assertThat(first.type()).isEqualTo(StressScenarioType.CUSTOM);
		assertThat(first.description()).isEqualTo("40% income drop across the forecast horizon, $2500 unexpected expense, +0.75% interest rate");
		assertThat(second.description()).isEqualTo("mine");
		assertThat(library.custom(null, null, parameters).name()).isEqualTo("Custom Scenario");
	}

	@Test
	void describeFallsBackForEmptyParameters() {
		assertThat(StressScenarioLibrary.describe(null)).isEqualTo("Custom scenario");
		assertThat(StressScenarioLibrary.describe(new StressParameters(null, null, null, null, null, null)))
				.isEqualTo("Custom scenario");
	}
}
