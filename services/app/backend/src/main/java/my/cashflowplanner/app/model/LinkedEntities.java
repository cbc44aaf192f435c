package my.cashflowplanner.app.model;

import java.util.List;

public record LinkedEntities(List<String> loans, List<String> accounts, List<String> recurring) {
	public LinkedEntities {
		loans = loans == null ? List.of() : List.copyOf(loans);
		accounts = accounts == null ? List.of() : List.copyOf(accounts);
		recurring = recurring == null ? List.of() : List.copyOf(recurring);
	}

	public static LinkedEntities ofAccounts(List<String> accountIds) {
		return new LinkedEntities(List.of(), accountIds, List.of());
	}

	public static LinkedEntities ofLoans(List<String> loanIds) {
		return new LinkedEntities(loanIds, List.of(), List.of());
	}
}
