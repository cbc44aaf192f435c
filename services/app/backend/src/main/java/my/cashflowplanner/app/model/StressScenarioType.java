package my.cashflowplanner.app.model;

public enum StressScenarioType {
	INCOME_DROP,
	EXPENSE_SHOCK,
	INTEREST_RATE_RISE,
	INFLATION,
	CUSTOM
}
