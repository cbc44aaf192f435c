package my.cashflowplanner.app.model;

public enum IncomeType {
	SALARY,
	RENT,
	INVESTMENT,
	OTHER
}
