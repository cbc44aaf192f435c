package my.cashflowplanner.app.model;

/**
 * Strategy lifecycle. Only a PENDING strategy may move, and only to one of the other three states.
 */
public enum StrategyStatus {
	PENDING,
	ACCEPTED,
	DISMISSED,
	EXPIRED;

	public boolean canTransitionTo(StrategyStatus target) {
		return this == PENDING && target != null && target != PENDING;
	}
}
