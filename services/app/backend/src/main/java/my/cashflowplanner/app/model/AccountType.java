package my.cashflowplanner.app.model;

public enum AccountType {
	OFFSET,
	SAVINGS,
	TRANSACTIONAL,
	CREDIT_CARD
}
