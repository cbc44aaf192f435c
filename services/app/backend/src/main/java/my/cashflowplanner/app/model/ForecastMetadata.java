package my.cashflowplanner.app.model;

public record ForecastMetadata(
		int inputTransactionCount,
		int recurringPaymentCount,
		int forecastDays,
		ExpenseAttribution attribution
) {
}
