package my.cashflowplanner.app.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Complete forecast for one snapshot. {@code generatedFor} is the "today" the simulation was anchored on, so two runs
 * over the same snapshot produce equal forecasts.
 */
public record CashflowForecast(
		String userId,
		LocalDate generatedFor,
		List<ForecastPoint> globalForecast,
		List<AccountForecast> accountForecasts,
		ShortfallAnalysis shortfallAnalysis,
		List<RecurringTimelineEntry> recurringTimeline,
		double volatilityIndex,
		ForecastSummary summary,
		ForecastMetadata metadata
) {
	public CashflowForecast {
		globalForecast = globalForecast == null ? List.of() : List.copyOf(globalForecast);
		accountForecasts = accountForecasts == null ? List.of() : List.copyOf(accountForecasts);
		recurringTimeline = recurringTimeline == null ? List.of() : List.copyOf(recurringTimeline);
	}

	public ForecastPoint lastPoint() {
		return globalForecast.isEmpty() ? null : globalForecast.get(globalForecast.size() - 1);
	}
}
