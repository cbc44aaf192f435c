package my.cashflowplanner.app.model;

import java.math.BigDecimal;

public enum InsightSeverity {
	CRITICAL(100, new BigDecimal("1000")),
	HIGH(75, new BigDecimal("500")),
	MEDIUM(50, new BigDecimal("100")),
	LOW(25, BigDecimal.ZERO);

	private final int priority;
	private final BigDecimal valueFloor;

	InsightSeverity(int priority, BigDecimal valueFloor) {
		this.priority = priority;
		this.valueFloor = valueFloor;
	}

	public int priority() {
		return priority;
	}

	/**
	 * Maps a monetary estimate onto a severity: 1000 and above is CRITICAL, 500 HIGH, 100 MEDIUM, anything else LOW.
	 */
	public static InsightSeverity fromValue(BigDecimal value) {
		if (value == null) {
			return LOW;
		}
		for (InsightSeverity severity : values()) {
			if (value.compareTo(severity.valueFloor) >= 0) {
				return severity;
			}
		}
		return LOW;
	}
}
