package my.cashflowplanner.app.model;

/**
 * Decides which accounts carry income, loan repayments and the non-recurring spend estimate.
 * <p>
 * {@link #EVERY_ACCOUNT} applies those flows to every simulated account, which double counts them when
 * several accounts are forecast together. {@link #OWNING_ACCOUNT} charges each flow once, to the account
 * that owns it (see {@code ForecastSimulator}).
 */
public enum ExpenseAttribution {
	EVERY_ACCOUNT,
	OWNING_ACCOUNT
}
