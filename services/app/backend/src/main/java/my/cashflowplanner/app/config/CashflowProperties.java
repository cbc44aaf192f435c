package my.cashflowplanner.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import my.cashflowplanner.app.model.ExpenseAttribution;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app.cashflow")
public record CashflowProperties(
		@Valid Forecast forecast,
		@Valid Optimisation optimisation,
		@Valid Stress stress,
		@Valid Strategy strategy
) {
	public CashflowProperties {
		forecast = forecast == null ? new Forecast(null, null, null, null) : forecast;
		optimisation = optimisation == null ? new Optimisation(null) : optimisation;
		stress = stress == null ? new Stress(null) : stress;
		strategy = strategy == null ? new Strategy(null) : strategy;
	}

	public static CashflowProperties defaults() {
		return new CashflowProperties(null, null, null, null);
	}

	public record Forecast(
			@Min(0) Integer defaultDays,
			@Min(1) Integer maxDays,
			Boolean includeConfidenceBands,
			ExpenseAttribution attribution
	) {
		public Forecast {
			defaultDays = defaultDays == null ? 90 : defaultDays;
			maxDays = maxDays == null ? 1825 : maxDays;
			includeConfidenceBands = includeConfidenceBands == null ? Boolean.TRUE : includeConfidenceBands;
			attribution = attribution == null ? ExpenseAttribution.OWNING_ACCOUNT : attribution;
		}
	}

	/**
	 * {@code benchmarks} maps a spending category to a typical monthly household spend. An empty table falls back to
	 * the built-in Australian one.
	 */
	public record Optimisation(Map<String, BigDecimal> benchmarks) {
		public Optimisation {
			benchmarks = benchmarks == null ? Map.of() : Map.copyOf(benchmarks);
		}
	}

	public record Stress(@Min(1) @Max(64) Integer parallelism) {
		public Stress {
			parallelism = parallelism == null ? 4 : parallelism;
		}
	}

	public record Strategy(@Min(1) Integer expiryDays) {
		public Strategy {
			expiryDays = expiryDays == null ? 30 : expiryDays;
		}
	}
}
