package my.cashflowplanner.app.service;

import my.cashflowplanner.app.model.AccountBalance;
import my.cashflowplanner.app.model.AccountForecast;
import my.cashflowplanner.app.model.ForecastPoint;
import my.cashflowplanner.app.model.ForecastSummary;
import my.cashflowplanner.app.model.ShortfallAnalysis;
import my.cashflowplanner.app.service.SpendingPatternAnalyzer.SpendingPatterns;
import my.cashflowplanner.app.service.util.MoneyMath;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

@Service
public class ShortfallSummaryAnalyzer {
	private static final int SHORT_WINDOW = 30;
	private static final int LONG_WINDOW = 90;
	private static final int BURN_BUFFER_MONTHS = 3;

	public ShortfallAnalysis analyseShortfalls(List<AccountForecast> accountForecasts, List<ForecastPoint> globalForecast) {
		List<LocalDate> dates = new ArrayList<>();
		BigDecimal worst = MoneyMath.ZERO;
		for (ForecastPoint point : globalForecast) {
			if (!point.shortfallRisk()) {
				continue;
			}
			dates.add(point.date());
			worst = MoneyMath.max(worst, point.shortfallAmount());
		}
		List<String> atRisk = new ArrayList<>();
		for (AccountForecast forecast : accountForecasts) {
			if (forecast.hasShortfall() && !atRisk.contains(forecast.accountId())) {
				atRisk.add(forecast.accountId());
			}
		}
		return new ShortfallAnalysis(
				!dates.isEmpty(),
				dates,
				MoneyMath.money(worst),
				dates.size(),
				dates.isEmpty() ? null : dates.get(0),
				atRisk
		);
	}

	/**
	 * Withdrawable cash is measured against the accounts' current balances rather than the first simulated day, so
	 * day-0 cash events do not shift it.
	 */
	public ForecastSummary summarise(List<ForecastPoint> globalForecast,
								 SpendingPatterns patterns,
								 List<AccountBalance> accounts,
								 LocalDate today) {
		Window first30 = window(globalForecast, SHORT_WINDOW);
		Window first90 = window(globalForecast, LONG_WINDOW);
		BigDecimal monthlyBurn = MoneyMath.money(patterns.dailyAverage().multiply(BigDecimal.valueOf(30)));
		BigDecimal threeMonthBurn = MoneyMath.money(monthlyBurn.multiply(BigDecimal.valueOf(BURN_BUFFER_MONTHS)));
		BigDecimal currentBalance = BigDecimal.ZERO;
		for (AccountBalance account : accounts) {
			currentBalance = currentBalance.add(MoneyMath.safe(account.currentBalance()));
		}
		BigDecimal withdrawable = MoneyMath.money(MoneyMath.max(BigDecimal.ZERO, currentBalance.subtract(threeMonthBurn)));
		return new ForecastSummary(
				first30.averageBalance(),
				first30.income(),
				first30.expenses(),
				first30.income().subtract(first30.expenses()),
				first90.averageBalance(),
				first90.income(),
				first90.expenses(),
				first90.income().subtract(first90.expenses()),
				monthlyBurn,
				threeMonthBurn,
				withdrawable,
				today
		);
	}

	public double volatilityIndex(SpendingPatterns patterns) {
		return Math.min(100.0, patterns.volatility() * 100.0);
	}

	/**
	 * Straight-line projection for dashboards: {@code balance + (income - expenses) / 30 * days}.
	 */
	public QuickForecast quickForecast(BigDecimal currentBalance, BigDecimal monthlyIncome, BigDecimal monthlyExpenses, int days) {
		BigDecimal dailyNet = MoneyMath.ratio(MoneyMath.safe(monthlyIncome).subtract(MoneyMath.safe(monthlyExpenses)),
				BigDecimal.valueOf(30));
		BigDecimal end = MoneyMath.money(MoneyMath.safe(currentBalance).add(dailyNet.multiply(BigDecimal.valueOf(days))));
		return new QuickForecast(end, end.signum() < 0, days);
	}

	/**
	 * Whole days the balance lasts at the given burn rate. Empty when nothing is burnt, zero when already
	 * overdrawn.
	 */
	public OptionalLong daysUntilShortfall(BigDecimal currentBalance, BigDecimal dailyBurnRate) {
		if (dailyBurnRate == null || dailyBurnRate.signum() <= 0) {
			return OptionalLong.empty();
		}
		BigDecimal balance = MoneyMath.safe(currentBalance);
		if (balance.signum() <= 0) {
			return OptionalLong.of(0);
		}
		return OptionalLong.of(balance.divide(dailyBurnRate, 0, RoundingMode.FLOOR).longValue());
	}

	private static Window window(List<ForecastPoint> points, int days) {
		List<ForecastPoint> slice = points.subList(0, Math.min(days, points.size()));
		BigDecimal balance = BigDecimal.ZERO;
		BigDecimal income = BigDecimal.ZERO;
		BigDecimal expenses = BigDecimal.ZERO;
		for (ForecastPoint point : slice) {
			balance = balance.add(point.predictedBalance());
			income = income.add(point.predictedIncome());
			expenses = expenses.add(point.predictedExpenses());
		}
		BigDecimal average = slice.isEmpty() ? MoneyMath.ZERO : MoneyMath.divide(balance, slice.size());
		return new Window(average, MoneyMath.money(income), MoneyMath.money(expenses));
	}

	private record Window(BigDecimal averageBalance, BigDecimal income, BigDecimal expenses) {
	}

	public record QuickForecast(BigDecimal endBalance, boolean hasShortfall, int days) {
	}
}
