package my.cashflowplanner.app.model;

import java.time.LocalDate;

/**
 * Simulation settings. {@code today} anchors day 0; the service fills it from its clock when absent.
 */
public record ForecastConfig(
		Integer forecastDays,
		boolean includeConfidenceBands,
		LocalDate today,
		ExpenseAttribution attribution
) {
	public ForecastConfig withToday(LocalDate date) {
		return new ForecastConfig(forecastDays, includeConfidenceBands, date, attribution);
	}

	public ForecastConfig withDefaults(int defaultDays, ExpenseAttribution defaultAttribution) {
		return new ForecastConfig(
				forecastDays == null ? defaultDays : forecastDays,
				includeConfidenceBands,
				today,
				attribution == null ? defaultAttribution : attribution);
	}
}
