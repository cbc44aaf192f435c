package my.cashflowplanner.app.service;

import my.cashflowplanner.app.model.CategoryAverage;
import my.cashflowplanner.app.model.Direction;
import my.cashflowplanner.app.model.SpendingProfile;
import my.cashflowplanner.app.model.TransactionRecord;
import my.cashflowplanner.app.model.TrendDirection;
import my.cashflowplanner.app.service.util.MoneyMath;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Derives spending statistics from transaction history. Only outgoing transactions count and their absolute amount
 * is used, whatever sign the caller stored.
 */
@Service
public class SpendingPatternAnalyzer {
	public static final String UNCATEGORISED = "UNCATEGORISED";
	private static final double TREND_THRESHOLD = 0.1;
	private static final int TREND_WINDOW = 3;

	public SpendingPatterns analyze(List<TransactionRecord> transactions) {
		List<TransactionRecord> expenses = expenses(transactions);
		if (expenses.isEmpty()) {
			return SpendingPatterns.empty();
		}
		BigDecimal[] weekdayTotals = new BigDecimal[7];
		int[] weekdayCounts = new int[7];
		for (int i = 0; i < 7; i++) {
			weekdayTotals[i] = BigDecimal.ZERO;
		}
		Map<String, BigDecimal> categoryTotals = new LinkedHashMap<>();
		TreeMap<YearMonth, BigDecimal> monthlyTotals = new TreeMap<>();
		TreeMap<LocalDate, BigDecimal> dailyTotals = new TreeMap<>();
		BigDecimal totalSpend = BigDecimal.ZERO;

		for (TransactionRecord tx : expenses) {
			BigDecimal amount = tx.amount().abs();
			int weekday = weekdayIndex(tx.date());
			weekdayTotals[weekday] = weekdayTotals[weekday].add(amount);
			weekdayCounts[weekday]++;
			categoryTotals.merge(category(tx), amount, BigDecimal::add);
			monthlyTotals.merge(YearMonth.from(tx.date()), amount, BigDecimal::add);
			dailyTotals.merge(tx.date(), amount, BigDecimal::add);
			totalSpend = totalSpend.add(amount);
		}

		List<BigDecimal> weekdayAverages = new ArrayList<>(7);
		for (int i = 0; i < 7; i++) {
			weekdayAverages.add(weekdayCounts[i] == 0
					? MoneyMath.ZERO
					: MoneyMath.divide(weekdayTotals[i], weekdayCounts[i]));
		}

		int months = Math.max(1, monthlyTotals.size());
		Map<String, BigDecimal> categoryAverages = new LinkedHashMap<>();
		categoryTotals.forEach((category, total) -> categoryAverages.put(category, MoneyMath.divide(total, months)));

		long range = ChronoUnit.DAYS.between(dailyTotals.firstKey(), dailyTotals.lastKey());
		BigDecimal dailyAverage = MoneyMath.divide(totalSpend, Math.max(1L, range));

		return new SpendingPatterns(
				dailyAverage,
				List.copyOf(weekdayAverages),
				Map.copyOf(categoryAverages),
				coefficientOfVariation(dailyTotals.values()),
				trend(monthlyTotals)
		);
	}

	/**
	 * Builds the per-category profile the optimisation engine compares against its benchmarks. Category averages
	 * divide by every month seen in the history, not only the months the category occurred in.
	 */
	public SpendingProfile buildProfile(List<TransactionRecord> transactions) {
		List<TransactionRecord> expenses = expenses(transactions);
		if (expenses.isEmpty()) {
			return SpendingProfile.empty();
		}
		Map<String, TreeMap<YearMonth, BigDecimal>> byCategory = new LinkedHashMap<>();
		TreeMap<LocalDate, BigDecimal> dailyTotals = new TreeMap<>();
		Set<YearMonth> months = new HashSet<>();
		for (TransactionRecord tx : expenses) {
			BigDecimal amount = tx.amount().abs();
			YearMonth month = YearMonth.from(tx.date());
			months.add(month);
			byCategory.computeIfAbsent(category(tx), key -> new TreeMap<>()).merge(month, amount, BigDecimal::add);
			dailyTotals.merge(tx.date(), amount, BigDecimal::add);
		}
		int monthCount = Math.max(1, months.size());
		Map<String, CategoryAverage> averages = new LinkedHashMap<>();
		BigDecimal predicted = BigDecimal.ZERO;
		for (Map.Entry<String, TreeMap<YearMonth, BigDecimal>> entry : byCategory.entrySet()) {
			BigDecimal total = MoneyMath.sum(entry.getValue().values());
			BigDecimal avgMonthly = MoneyMath.divide(total, monthCount);
			predicted = predicted.add(avgMonthly);
			averages.put(entry.getKey(), new CategoryAverage(
					avgMonthly,
					trend(entry.getValue()),
					coefficientOfVariation(entry.getValue().values())));
		}
		return new SpendingProfile(averages, coefficientOfVariation(dailyTotals.values()), MoneyMath.money(predicted));
	}

	/**
	 * Sunday is 0, Saturday is 6.
	 */
	public static int weekdayIndex(LocalDate date) {
		return date.getDayOfWeek().getValue() % 7;
	}

	static double coefficientOfVariation(Collection<BigDecimal> values) {
		if (values == null || values.size() < 2) {
			return 0.0;
		}
		double sum = 0.0;
		for (BigDecimal value : values) {
			sum += value.doubleValue();
		}
		double mean = sum / values.size();
		if (mean == 0.0) {
			return 0.0;
		}
		double variance = 0.0;
		for (BigDecimal value : values) {
			double diff = value.doubleValue() - mean;
			variance += diff * diff;
		}
		variance = variance / values.size();
		return Math.sqrt(variance) / mean;
	}

	static TrendDirection trend(TreeMap<YearMonth, BigDecimal> monthlyTotals) {
		if (monthlyTotals == null || monthlyTotals.size() < TREND_WINDOW) {
			return TrendDirection.STABLE;
		}
		List<BigDecimal> recent = new ArrayList<>(monthlyTotals.descendingMap().values()).subList(0, TREND_WINDOW);
		BigDecimal first = recent.get(TREND_WINDOW - 1);
		BigDecimal last = recent.get(0);
		if (first.signum() == 0) {
			return TrendDirection.STABLE;
		}
		double change = last.subtract(first).doubleValue() / first.doubleValue();
		if (change > TREND_THRESHOLD) {
			return TrendDirection.INCREASING;
		}
		if (change < -TREND_THRESHOLD) {
			return TrendDirection.DECREASING;
		}
		return TrendDirection.STABLE;
	}

	private static List<TransactionRecord> expenses(List<TransactionRecord> transactions) {
		if (transactions == null) {
			return List.of();
		}
		List<TransactionRecord> expenses = new ArrayList<>();
		for (TransactionRecord tx : transactions) {
			if (tx != null && tx.direction() == Direction.OUT && tx.date() != null && tx.amount() != null) {
				expenses.add(tx);
			}
		}
		return expenses;
	}

	private static String category(TransactionRecord tx) {
		String category = tx.categoryLevel1();
		return category == null || category.isBlank() ? UNCATEGORISED : category;
	}

	public record SpendingPatterns(
			BigDecimal dailyAverage,
			List<BigDecimal> weekdayAverages,
			Map<String, BigDecimal> categoryAverages,
			double volatility,
			TrendDirection trend
	) {
		public static SpendingPatterns empty() {
			return new SpendingPatterns(MoneyMath.ZERO, List.of(MoneyMath.ZERO, MoneyMath.ZERO, MoneyMath.ZERO,
					MoneyMath.ZERO, MoneyMath.ZERO, MoneyMath.ZERO, MoneyMath.ZERO), Map.of(), 0.0, TrendDirection.STABLE);
		}

		public BigDecimal weekdayAverage(LocalDate date) {
			return weekdayAverages.get(weekdayIndex(date));
		}
	}
}
