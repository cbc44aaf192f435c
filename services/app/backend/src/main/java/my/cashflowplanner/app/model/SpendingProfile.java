package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-category monthly spending with trend, the optimisation engine's view of historical spend.
 * {@code categoryAverages} keeps category insertion order.
 */
public record SpendingProfile(
		Map<String, CategoryAverage> categoryAverages,
		double overallVolatility,
		BigDecimal predictedMonthlySpend
) {
	public SpendingProfile {
		categoryAverages = categoryAverages == null
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(categoryAverages));
	}

	public static SpendingProfile empty() {
		return new SpendingProfile(Map.of(), 0.0, BigDecimal.ZERO);
	}
}
