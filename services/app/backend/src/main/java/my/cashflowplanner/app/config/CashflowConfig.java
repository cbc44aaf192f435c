package my.cashflowplanner.app.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CashflowConfig {
	private static final Logger logger = LoggerFactory.getLogger(CashflowConfig.class);

	@Bean
	@ConditionalOnMissingBean
	public Clock clock() {
		return Clock.systemDefaultZone();
	}

	@Bean
	public CategoryBenchmarks categoryBenchmarks(CashflowProperties properties) {
		CategoryBenchmarks benchmarks = CategoryBenchmarks.fromProperties(properties);
		logger.info("Cashflow benchmarks loaded ({} categories).", benchmarks.asMap().size());
		return benchmarks;
	}
}
