package my.cashflowplanner.app.model;

public enum Direction {
	IN,
	OUT
}
