package my.cashflowplanner.app.service;

import my.cashflowplanner.app.model.StressParameters;
import my.cashflowplanner.app.model.StressScenario;
import my.cashflowplanner.app.model.StressScenarioType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Component
public class StressScenarioLibrary {
	private static final List<StressScenario> PREDEFINED = List.of(
			new StressScenario("income-drop-50", "Income Drop 50%", StressScenarioType.INCOME_DROP,
					"Simulates a 50% reduction in income across the forecast horizon",
					new StressParameters(new BigDecimal("50"), 3, null, null, null, null)),
			new StressScenario("income-loss-100", "Complete Income Loss", StressScenarioType.INCOME_DROP,
					"Simulates complete loss of income across the forecast horizon",
					new StressParameters(new BigDecimal("100"), 6, null, null, null, null)),
			new StressScenario("expense-shock-5k", "Unexpected $5,000 Expense", StressScenarioType.EXPENSE_SHOCK,
					"Simulates an unexpected $5,000 expense (e.g., car repair, medical)",
					new StressParameters(null, null, new BigDecimal("5000"), null, null, null)),
			new StressScenario("expense-shock-15k", "Major Expense $15,000", StressScenarioType.EXPENSE_SHOCK,
					"Simulates a major expense of $15,000 (e.g., roof replacement)",
					new StressParameters(null, null, new BigDecimal("15000"), null, null, null)),
			new StressScenario("rate-rise-100bp", "Interest Rate +1%", StressScenarioType.INTEREST_RATE_RISE,
					"Simulates a 1% (100 basis points) interest rate increase",
					new StressParameters(null, null, null, null, null, 100)),
			new StressScenario("rate-rise-200bp", "Interest Rate +2%", StressScenarioType.INTEREST_RATE_RISE,
					"Simulates a 2% (200 basis points) interest rate increase",
					new StressParameters(null, null, null, null, null, 200)),
			new StressScenario("inflation-high", "High Inflation (8%)", StressScenarioType.INFLATION,
					"Simulates 8% annual inflation affecting expenses",
					new StressParameters(null, null, null, null, new BigDecimal("8"), null)),
			new StressScenario("combined-mild", "Mild Combined Stress", StressScenarioType.CUSTOM,
					"25% income drop + 3% inflation + 0.5% rate rise",
					new StressParameters(new BigDecimal("25"), 6, null, null, new BigDecimal("3"), 50)),
			new StressScenario("combined-severe", "Severe Combined Stress", StressScenarioType.CUSTOM,
					"50% income drop + 5% inflation + 1.5% rate rise + $10k expense",
					new StressParameters(new BigDecimal("50"), 3, new BigDecimal("10000"), null, new BigDecimal("5"), 150))
	);

	public List<StressScenario> predefined() {
		return PREDEFINED;
	}

	public Optional<StressScenario> find(String id) {
		return PREDEFINED.stream().filter(scenario -> scenario.id().equals(id)).findFirst();
	}

	/**
	 * Scenario for a caller-defined parameter set. The id is derived from the name so the same request always
	 * yields the same scenario.
	 */
	public StressScenario custom(String name, String description, StressParameters parameters) {
		String resolvedName = name == null || name.isBlank() ? "Custom Scenario" : name.trim();
		String resolvedDescription = description == null || description.isBlank()
				? describe(parameters)
				: description;
		return new StressScenario("custom-" + slug(resolvedName), resolvedName, StressScenarioType.CUSTOM,
				resolvedDescription, parameters);
	}

	public static String describe(StressParameters parameters) {
		if (parameters == null) {
			return "Custom scenario";
		}
		List<String> parts = new ArrayList<>();
		if (parameters.incomeDropPercent() != null) {
			// the drop is applied over the whole horizon whatever the recorded duration
			parts.add(parameters.incomeDropPercent().stripTrailingZeros().toPlainString()
					+ "% income drop across the forecast horizon");
		}
		if (parameters.expenseShockAmount() != null) {
			parts.add("$" + parameters.expenseShockAmount().stripTrailingZeros().toPlainString() + " unexpected expense");
		}
		if (parameters.interestRateIncreaseBps() != null) {
			parts.add("+" + BigDecimal.valueOf(parameters.interestRateIncreaseBps(), 2).stripTrailingZeros().toPlainString()
					+ "% interest rate");
		}
		if (parameters.expenseInflationPercent() != null) {
			parts.add(parameters.expenseInflationPercent().stripTrailingZeros().toPlainString() + "% expense inflation");
		}
		return parts.isEmpty() ? "Custom scenario" : String.join(", ", parts);
	}

	private static String slug(String value) {
		String slug = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
		return slug.isEmpty() ? "scenario" : slug;
	}
}
