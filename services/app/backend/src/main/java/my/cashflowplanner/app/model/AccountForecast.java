package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record AccountForecast(
		String accountId,
		String accountName,
		AccountType accountType,
		List<ForecastPoint> forecasts,
		BigDecimal averageBalance,
		BigDecimal minBalance,
		BigDecimal maxBalance,
		List<LocalDate> shortfallDays
) {
	public AccountForecast {
		forecasts = forecasts == null ? List.of() : List.copyOf(forecasts);
		shortfallDays = shortfallDays == null ? List.of() : List.copyOf(shortfallDays);
	}

	public boolean hasShortfall() {
		return !shortfallDays.isEmpty();
	}
}
