package my.cashflowplanner.app.config;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Typical monthly household spend per category, used as the yardstick for spending inefficiencies.
 */
public final class CategoryBenchmarks {
	private final Map<String, BigDecimal> benchmarks;

	public CategoryBenchmarks(Map<String, BigDecimal> benchmarks) {
		this.benchmarks = Collections.unmodifiableMap(new LinkedHashMap<>(benchmarks == null ? Map.of() : benchmarks));
	}

	public static CategoryBenchmarks australianHousehold() {
		Map<String, BigDecimal> table = new LinkedHashMap<>();
		table.put("Food & Dining", new BigDecimal("800"));
		table.put("Groceries", new BigDecimal("600"));
		table.put("Dining Out", new BigDecimal("200"));
		table.put("Subscriptions", new BigDecimal("100"));
		table.put("Entertainment", new BigDecimal("150"));
		table.put("Utilities", new BigDecimal("350"));
		table.put("Transport", new BigDecimal("400"));
		table.put("Insurance", new BigDecimal("300"));
		table.put("Shopping", new BigDecimal("250"));
		table.put("Health", new BigDecimal("150"));
		return new CategoryBenchmarks(table);
	}

	public static CategoryBenchmarks fromProperties(CashflowProperties properties) {
		Map<String, BigDecimal> configured = properties == null ? Map.of() : properties.optimisation().benchmarks();
		return configured.isEmpty() ? australianHousehold() : new CategoryBenchmarks(configured);
	}

	public Optional<BigDecimal> benchmarkFor(String category) {
		if (category == null) {
			return Optional.empty();
		}
		BigDecimal value = benchmarks.get(category);
		return value == null || value.signum() <= 0 ? Optional.empty() : Optional.of(value);
	}

	public Map<String, BigDecimal> asMap() {
		return benchmarks;
	}
}
