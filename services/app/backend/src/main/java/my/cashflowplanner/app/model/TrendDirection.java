package my.cashflowplanner.app.model;

public enum TrendDirection {
	INCREASING,
	STABLE,
	DECREASING
}
