package my.cashflowplanner.app.model;

public enum InsightCategory {
	RECURRING,
	ANOMALY,
	INEFFICIENCY,
	LIQUIDITY_RISK,
	SUBSCRIPTION,
	SAVINGS_OPPORTUNITY
}
