package my.cashflowplanner.app.model;

public enum StrategyType {
	OPTIMISE,
	PREVENT_SHORTFALL,
	MAXIMISE_OFFSET,
	REDUCE_WASTE,
	REPAYMENT_OPTIMISE,
	SCHEDULE_OPTIMISE
}
