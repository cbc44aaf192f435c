package my.cashflowplanner.app.model;

import java.time.LocalDate;

public enum RecurrencePattern {
	WEEKLY,
	FORTNIGHTLY,
	MONTHLY,
	QUARTERLY,
	ANNUALLY;

	/**
	 * Returns the occurrence {@code steps} periods after {@code anchor}. Months and years are counted from the
	 * anchor each time, so a payment anchored on the 31st lands on the last day of short months without
	 * drifting to the 28th afterwards.
	 */
	public LocalDate advance(LocalDate anchor, long steps) {
		return switch (this) {
			case WEEKLY -> anchor.plusWeeks(steps);
			case FORTNIGHTLY -> anchor.plusWeeks(2 * steps);
			case MONTHLY -> anchor.plusMonths(steps);
			case QUARTERLY -> anchor.plusMonths(3 * steps);
			case ANNUALLY -> anchor.plusYears(steps);
		};
	}

	public LocalDate next(LocalDate anchor) {
		return advance(anchor, 1);
	}
}
