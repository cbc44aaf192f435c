package my.cashflowplanner.app.tax;

public enum PayFrequency {
	WEEKLY(52),
	FORTNIGHTLY(26),
	MONTHLY(12),
	ANNUAL(1);

	private final int periodsPerYear;

	PayFrequency(int periodsPerYear) {
		this.periodsPerYear = periodsPerYear;
	}

	public int periodsPerYear() {
		return periodsPerYear;
	}
}
