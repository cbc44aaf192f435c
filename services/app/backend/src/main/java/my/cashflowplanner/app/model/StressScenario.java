package my.cashflowplanner.app.model;

public record StressScenario(
		String id,
		String name,
		StressScenarioType type,
		String description,
		StressParameters parameters
) {
}
