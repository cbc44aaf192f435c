package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record ShortfallAnalysis(
		boolean hasShortfall,
		List<LocalDate> shortfallDates,
		BigDecimal maxShortfallAmount,
		int totalShortfallDays,
		LocalDate firstShortfallDate,
		List<String> accountsAtRisk
) {
	public ShortfallAnalysis {
		shortfallDates = shortfallDates == null ? List.of() : List.copyOf(shortfallDates);
		accountsAtRisk = accountsAtRisk == null ? List.of() : List.copyOf(accountsAtRisk);
	}
}
