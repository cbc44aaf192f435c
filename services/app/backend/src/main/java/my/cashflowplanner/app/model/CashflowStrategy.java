package my.cashflowplanner.app.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record CashflowStrategy(
		String id,
		StrategyType type,
		int priority,
		String title,
		String summary,
		String detail,
		double confidence,
		BigDecimal projectedBenefit,
		List<StrategyStep> recommendedSteps,
		List<String> affectedAccountIds,
		List<String> affectedLoanIds,
		List<String> affectedRecurringIds,
		StrategyStatus status,
		Instant expiresAt
) {
	public CashflowStrategy {
		recommendedSteps = recommendedSteps == null ? List.of() : List.copyOf(recommendedSteps);
		affectedAccountIds = affectedAccountIds == null ? List.of() : List.copyOf(affectedAccountIds);
		affectedLoanIds = affectedLoanIds == null ? List.of() : List.copyOf(affectedLoanIds);
		affectedRecurringIds = affectedRecurringIds == null ? List.of() : List.copyOf(affectedRecurringIds);
		status = status == null ? StrategyStatus.PENDING : status;
	}

	public CashflowStrategy withStatus(StrategyStatus newStatus) {
		return new CashflowStrategy(id, type, priority, title, summary, detail, confidence, projectedBenefit,
				recommendedSteps, affectedAccountIds, affectedLoanIds, affectedRecurringIds, newStatus, expiresAt);
	}

	public boolean isExpiredAt(Instant now) {
		return expiresAt != null && now != null && now.isAfter(expiresAt);
	}
}
