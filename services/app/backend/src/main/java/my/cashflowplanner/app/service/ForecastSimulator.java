package my.cashflowplanner.app.service;

import my.cashflowplanner.app.model.AccountBalance;
import my.cashflowplanner.app.model.AccountForecast;
import my.cashflowplanner.app.model.ForecastPoint;
import my.cashflowplanner.app.service.SpendingPatternAnalyzer.SpendingPatterns;
import my.cashflowplanner.app.service.util.MoneyMath;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Walks each account forward one day at a time and merges the per-account series into a household series.
 */
@Service
public class ForecastSimulator {
	static final double CONFIDENCE_BASE = 0.95;
	static final double CONFIDENCE_DECAY_RATE = 0.002;
	static final double VOLATILITY_WEIGHT = 0.3;
	static final double CONFIDENCE_FLOOR = 0.1;

	public AccountForecast simulateAccount(AccountBalance account,
									   AccountDrivers drivers,
									   LocalDate today,
									   int forecastDays,
									   boolean includeConfidenceBands) {
		BigDecimal opening = MoneyMath.money(account.currentBalance());
		SpendingPatterns patterns = drivers.patterns();
		double volatility = patterns.volatility();
		double dailyAverage = patterns.dailyAverage().doubleValue();

		List<ForecastPoint> points = new ArrayList<>(Math.max(0, forecastDays));
		List<LocalDate> shortfallDays = new ArrayList<>();
		BigDecimal balance = opening;
		BigDecimal min = opening;
		BigDecimal max = opening;
		BigDecimal total = BigDecimal.ZERO;

		for (int day = 0; day < forecastDays; day++) {
			LocalDate date = today.plusDays(day);
			BigDecimal income = drivers.incomeOn(date);
			BigDecimal scheduled = drivers.scheduledOn(date);
			BigDecimal nonRecurring = patterns.weekdayAverage(date);
			BigDecimal expenses = scheduled.add(nonRecurring);
			balance = balance.add(income).subtract(expenses);
			min = min.min(balance);
			max = max.max(balance);
			total = total.add(balance);

			boolean shortfall = balance.signum() < 0;
			if (shortfall) {
				shortfallDays.add(date);
			}
			BigDecimal upper = null;
			BigDecimal lower = null;
			if (includeConfidenceBands) {
				BigDecimal halfWidth = MoneyMath.money(bandHalfWidth(dailyAverage, volatility, day));
				upper = balance.add(halfWidth);
				lower = balance.subtract(halfWidth);
			}
			points.add(new ForecastPoint(
					date,
					balance,
					income,
					expenses,
					scheduled,
					nonRecurring,
					confidence(day, volatility),
					volatility,
					upper,
					lower,
					shortfall,
					shortfall ? balance.abs() : null
			));
		}

		BigDecimal average = points.isEmpty() ? MoneyMath.ZERO : MoneyMath.divide(total, points.size());
		return new AccountForecast(account.accountId(), account.accountName(), account.accountType(), points,
				average, min, max, shortfallDays);
	}

	/**
	 * Household series keyed by date: balances and flows are summed, confidence takes the weakest account and
	 * volatility the most volatile. A day is short when any account is, and the shortfall amount sums only the
	 * accounts that are short.
	 */
	public List<ForecastPoint> mergeGlobal(List<AccountForecast> accountForecasts, boolean includeConfidenceBands) {
		Map<LocalDate, DayTotals> byDate = new TreeMap<>();
		for (AccountForecast forecast : accountForecasts) {
			for (ForecastPoint point : forecast.forecasts()) {
				byDate.computeIfAbsent(point.date(), key -> new DayTotals()).add(point);
			}
		}
		List<ForecastPoint> global = new ArrayList<>(byDate.size());
		for (Map.Entry<LocalDate, DayTotals> entry : byDate.entrySet()) {
			global.add(entry.getValue().toPoint(entry.getKey(), includeConfidenceBands));
		}
		return List.copyOf(global);
	}

	static double confidence(int day, double volatility) {
		double decay = Math.exp(-CONFIDENCE_DECAY_RATE * day);
		double penalty = 1.0 - volatility * VOLATILITY_WEIGHT;
		return Math.max(CONFIDENCE_FLOOR, CONFIDENCE_BASE * decay * penalty);
	}

	static double bandHalfWidth(double dailyAverage, double volatility, int day) {
		return dailyAverage * volatility * Math.sqrt(day + 1.0);
	}

	/**
	 * Per-account inputs for one simulation: income and scheduled outflows indexed by date, plus the patterns the
	 * discretionary estimate and confidence come from.
	 */
	public record AccountDrivers(
			Map<LocalDate, BigDecimal> income,
			Map<LocalDate, BigDecimal> scheduled,
			SpendingPatterns patterns
	) {
		public AccountDrivers {
			income = income == null ? Map.of() : Map.copyOf(income);
			scheduled = scheduled == null ? Map.of() : Map.copyOf(scheduled);
			patterns = patterns == null ? SpendingPatterns.empty() : patterns;
		}

		BigDecimal incomeOn(LocalDate date) {
			return MoneyMath.money(income.get(date));
		}

		BigDecimal scheduledOn(LocalDate date) {
			return MoneyMath.money(scheduled.get(date));
		}
	}

	private static final class DayTotals {
		private BigDecimal balance = BigDecimal.ZERO;
		private BigDecimal income = BigDecimal.ZERO;
		private BigDecimal expenses = BigDecimal.ZERO;
		private BigDecimal recurring = BigDecimal.ZERO;
		private BigDecimal nonRecurring = BigDecimal.ZERO;
		private BigDecimal upper = BigDecimal.ZERO;
		private BigDecimal lower = BigDecimal.ZERO;
		private BigDecimal shortfall = BigDecimal.ZERO;
		private double minConfidence = 1.0;
		private double maxVolatility = 0.0;
		private boolean anyShortfall;

		void add(ForecastPoint point) {
			balance = balance.add(point.predictedBalance());
			income = income.add(point.predictedIncome());
			expenses = expenses.add(point.predictedExpenses());
			recurring = recurring.add(point.predictedRecurring());
			nonRecurring = nonRecurring.add(point.predictedNonRecurring());
			upper = upper.add(MoneyMath.safe(point.upperBound()));
			lower = lower.add(MoneyMath.safe(point.lowerBound()));
			minConfidence = Math.min(minConfidence, point.confidenceScore());
			maxVolatility = Math.max(maxVolatility, point.volatilityFactor());
			if (point.shortfallRisk()) {
				anyShortfall = true;
				shortfall = shortfall.add(MoneyMath.safe(point.shortfallAmount()));
			}
		}

		ForecastPoint toPoint(LocalDate date, boolean includeConfidenceBands) {
			return new ForecastPoint(
					date,
					MoneyMath.money(balance),
					MoneyMath.money(income),
					MoneyMath.money(expenses),
					MoneyMath.money(recurring),
					MoneyMath.money(nonRecurring),
					minConfidence,
					maxVolatility,
					includeConfidenceBands ? MoneyMath.money(upper) : null,
					includeConfidenceBands ? MoneyMath.money(lower) : null,
					anyShortfall,
					anyShortfall ? MoneyMath.money(shortfall) : null
			);
		}
	}
}
