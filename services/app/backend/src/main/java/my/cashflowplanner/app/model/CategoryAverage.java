package my.cashflowplanner.app.model;

import java.math.BigDecimal;

public record CategoryAverage(BigDecimal avgMonthly, TrendDirection trend, double volatility) {
}
