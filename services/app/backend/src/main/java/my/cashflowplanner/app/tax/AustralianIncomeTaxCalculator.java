package my.cashflowplanner.app.tax;

import my.cashflowplanner.app.service.util.MoneyMath;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Resident rates for the 2024-25 income year with a flat Medicare levy and the Low Income Tax Offset.
 * Tax-free threshold is always claimed; levy reductions and surcharges are not modelled.
 */
@Component
public class AustralianIncomeTaxCalculator implements IncomeTaxCalculator {
	private static final List<Bracket> BRACKETS = List.of(
			new Bracket(new BigDecimal("18200"), BigDecimal.ZERO, new BigDecimal("0.16")),
			new Bracket(new BigDecimal("45000"), new BigDecimal("4288"), new BigDecimal("0.30")),
			new Bracket(new BigDecimal("135000"), new BigDecimal("31288"), new BigDecimal("0.37")),
			new Bracket(new BigDecimal("190000"), new BigDecimal("51638"), new BigDecimal("0.45"))
	);
	private static final BigDecimal MEDICARE_RATE = new BigDecimal("0.02");

	private static final BigDecimal LITO_MAX = new BigDecimal("700");
	private static final BigDecimal LITO_FULL_THRESHOLD = new BigDecimal("37500");
	private static final BigDecimal LITO_SECOND_THRESHOLD = new BigDecimal("45000");
	private static final BigDecimal LITO_CUTOFF = new BigDecimal("66667");
	private static final BigDecimal LITO_FIRST_WITHDRAWAL = new BigDecimal("0.05");
	private static final BigDecimal LITO_SECOND_WITHDRAWAL = new BigDecimal("0.015");

	@Override
	public TakeHomePay takeHomePay(BigDecimal grossAmount, PayFrequency frequency) {
		if (grossAmount == null || frequency == null) {
			throw new IllegalArgumentException("Gross amount and pay frequency are required");
		}
		if (grossAmount.signum() < 0) {
			throw new IllegalArgumentException("Gross amount must not be negative");
		}
		BigDecimal periods = BigDecimal.valueOf(frequency.periodsPerYear());
		BigDecimal annualGross = grossAmount.multiply(periods);

		BigDecimal payg = incomeTax(annualGross);
		BigDecimal medicare = medicareLevy(annualGross);
		BigDecimal offset = lowIncomeOffset(annualGross);
		BigDecimal netTax = MoneyMath.max(BigDecimal.ZERO, payg.add(medicare).subtract(offset));
		BigDecimal annualNet = annualGross.subtract(netTax);

		BigDecimal effectiveRate = annualGross.signum() > 0
				? MoneyMath.money(netTax.multiply(MoneyMath.ONE_HUNDRED).divide(annualGross, MathContext.DECIMAL64))
				: MoneyMath.ZERO;
		return new TakeHomePay(
				MoneyMath.money(grossAmount),
				MoneyMath.divide(annualNet, periods),
				MoneyMath.divide(payg, periods),
				MoneyMath.divide(medicare, periods),
				effectiveRate
		);
	}

	BigDecimal incomeTax(BigDecimal taxableIncome) {
		BigDecimal tax = BigDecimal.ZERO;
		for (Bracket bracket : BRACKETS) {
			if (taxableIncome.compareTo(bracket.threshold()) > 0) {
				tax = bracket.baseAmount().add(taxableIncome.subtract(bracket.threshold()).multiply(bracket.rate()));
			}
		}
		return tax;
	}

	BigDecimal medicareLevy(BigDecimal taxableIncome) {
		return taxableIncome.signum() > 0 ? taxableIncome.multiply(MEDICARE_RATE) : BigDecimal.ZERO;
	}

	BigDecimal lowIncomeOffset(BigDecimal taxableIncome) {
		if (taxableIncome.signum() <= 0 || taxableIncome.compareTo(LITO_CUTOFF) >= 0) {
			return BigDecimal.ZERO;
		}
		if (taxableIncome.compareTo(LITO_FULL_THRESHOLD) <= 0) {
			return LITO_MAX;
		}
		if (taxableIncome.compareTo(LITO_SECOND_THRESHOLD) <= 0) {
			return LITO_MAX.subtract(taxableIncome.subtract(LITO_FULL_THRESHOLD).multiply(LITO_FIRST_WITHDRAWAL));
		}
		BigDecimal atSecondThreshold = LITO_MAX.subtract(
				LITO_SECOND_THRESHOLD.subtract(LITO_FULL_THRESHOLD).multiply(LITO_FIRST_WITHDRAWAL));
		BigDecimal offset = atSecondThreshold.subtract(
				taxableIncome.subtract(LITO_SECOND_THRESHOLD).multiply(LITO_SECOND_WITHDRAWAL));
		return MoneyMath.max(BigDecimal.ZERO, offset);
	}

	private record Bracket(BigDecimal threshold, BigDecimal baseAmount, BigDecimal rate) {
	}
}
