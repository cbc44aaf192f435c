package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Presentation record derived from engine output. Never used as input to another computation.
 */
public record CashflowInsight(
		String id,
		String userId,
		InsightSeverity severity,
		InsightCategory category,
		String title,
		String description,
		String recommendedAction,
		List<String> impactedAccountIds,
		List<String> impactedCategories,
		BigDecimal valueEstimate,
		BigDecimal savingsPotential,
		double confidenceScore,
		LinkedEntities linkedEntities,
		boolean read,
		boolean dismissed,
		boolean actioned,
		Instant createdAt
) {
	public CashflowInsight {
		impactedAccountIds = impactedAccountIds == null ? List.of() : List.copyOf(impactedAccountIds);
		impactedCategories = impactedCategories == null ? List.of() : List.copyOf(impactedCategories);
	}

	public CashflowInsight markRead() {
		return new CashflowInsight(id, userId, severity, category, title, description, recommendedAction,
				impactedAccountIds, impactedCategories, valueEstimate, savingsPotential, confidenceScore, linkedEntities,
				true, dismissed, actioned, createdAt);
	}

	public CashflowInsight dismiss() {
		return new CashflowInsight(id, userId, severity, category, title, description, recommendedAction,
				impactedAccountIds, impactedCategories, valueEstimate, savingsPotential, confidenceScore, linkedEntities,
				read, true, actioned, createdAt);
	}

	public CashflowInsight markActioned() {
		return new CashflowInsight(id, userId, severity, category, title, description, recommendedAction,
				impactedAccountIds, impactedCategories, valueEstimate, savingsPotential, confidenceScore, linkedEntities,
				true, dismissed, true, createdAt);
	}
}
