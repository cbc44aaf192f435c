package my.cashflowplanner.app.dto;

import my.cashflowplanner.app.model.CashflowInsight;
import my.cashflowplanner.app.model.InsightCategory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record InsightResponse(
		List<CashflowInsight> insights,
		int highPriorityCount,
		int unreadCount,
		BigDecimal totalSavingsPotential,
		Map<InsightCategory, Integer> countByCategory
) {
}
