package my.cashflowplanner.app.service.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Cent-precision arithmetic shared by the engines. Amounts leaving an engine are always scale 2, HALF_UP.
 */
public final class MoneyMath {
	public static final int SCALE = 2;
	public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);
	public static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
	private static final int AMORTISATION_YEARS = 30;

	private MoneyMath() {
	}

	public static BigDecimal money(BigDecimal value) {
		return value == null ? ZERO : value.setScale(SCALE, RoundingMode.HALF_UP);
	}

	public static BigDecimal money(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return ZERO;
		}
		return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP);
	}

	public static BigDecimal safe(BigDecimal value) {
		return value == null ? BigDecimal.ZERO : value;
	}

	public static BigDecimal sum(Collection<BigDecimal> values) {
		BigDecimal total = BigDecimal.ZERO;
		if (values == null) {
			return money(total);
		}
		for (BigDecimal value : values) {
			total = total.add(safe(value));
		}
		return money(total);
	}

	/**
	 * Divides and rounds to cents, returning zero when the divisor is missing or zero.
	 */
	public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
		if (divisor == null || divisor.signum() == 0) {
			return ZERO;
		}
		return safe(dividend).divide(divisor, SCALE, RoundingMode.HALF_UP);
	}

	public static BigDecimal divide(BigDecimal dividend, long divisor) {
		return divide(dividend, BigDecimal.valueOf(divisor));
	}

	/**
	 * Unrounded ratio for intermediate calculations, zero on a zero divisor.
	 */
	public static BigDecimal ratio(BigDecimal dividend, BigDecimal divisor) {
		if (divisor == null || divisor.signum() == 0) {
			return BigDecimal.ZERO;
		}
		return safe(dividend).divide(divisor, MathContext.DECIMAL64);
	}

	public static BigDecimal percentOf(BigDecimal value, BigDecimal percent) {
		return money(safe(value).multiply(safe(percent)).divide(ONE_HUNDRED, MathContext.DECIMAL64));
	}

	public static BigDecimal scale(BigDecimal value, BigDecimal factor) {
		return money(safe(value).multiply(safe(factor)));
	}

	public static BigDecimal scale(BigDecimal value, double factor) {
		return money(safe(value).multiply(BigDecimal.valueOf(factor)));
	}

	public static BigDecimal max(BigDecimal left, BigDecimal right) {
		return safe(left).compareTo(safe(right)) >= 0 ? safe(left) : safe(right);
	}

	public static BigDecimal min(BigDecimal left, BigDecimal right) {
		return safe(left).compareTo(safe(right)) <= 0 ? safe(left) : safe(right);
	}

	public static long round(BigDecimal value) {
		return safe(value).setScale(0, RoundingMode.HALF_UP).longValue();
	}

	/**
	 * Standard amortised principal and interest payment over {@link #AMORTISATION_YEARS} years of monthly
	 * instalments. A zero rate falls back to straight-line principal repayment.
	 */
	public static BigDecimal amortisedMonthlyPayment(BigDecimal principal, BigDecimal annualRate) {
		return amortisedMonthlyPayment(principal, annualRate, AMORTISATION_YEARS);
	}

	public static BigDecimal amortisedMonthlyPayment(BigDecimal principal, BigDecimal annualRate, int years) {
		double p = safe(principal).doubleValue();
		int payments = Math.max(1, years * 12);
		double monthlyRate = safe(annualRate).doubleValue() / 12.0;
		if (monthlyRate == 0.0) {
			return money(p / payments);
		}
		double growth = Math.pow(1.0 + monthlyRate, payments);
		return money(p * (monthlyRate * growth) / (growth - 1.0));
	}

	public static BigDecimal interestOnlyMonthlyPayment(BigDecimal principal, BigDecimal annualRate) {
		return money(safe(principal).multiply(safe(annualRate)).divide(BigDecimal.valueOf(12), MathContext.DECIMAL64));
	}
}
