package my.cashflowplanner.app.dto;

import my.cashflowplanner.app.model.SpendingProfile;
import my.cashflowplanner.app.model.TransactionRecord;
import my.cashflowplanner.app.service.SpendingPatternAnalyzer.SpendingPatterns;

import java.util.List;

public record TransactionImportResponse(
		List<TransactionRecord> transactions,
		List<String> skippedRows,
		SpendingPatterns patterns,
		SpendingProfile profile
) {
}
