package my.cashflowplanner.app.service;

import my.cashflowplanner.app.model.IncomeFrequency;
import my.cashflowplanner.app.model.IncomeStream;
import my.cashflowplanner.app.model.IncomeType;
import my.cashflowplanner.app.service.util.MoneyMath;
import my.cashflowplanner.app.tax.IncomeTaxCalculator;
import my.cashflowplanner.app.tax.PayFrequency;
import my.cashflowplanner.app.tax.TakeHomePay;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts salary streams to after-tax amounts so forecasts work with cash actually received.
 * Rent, investment and other income arrive gross and pass through unchanged.
 */
@Service
public class IncomeNormalizer {
	private final IncomeTaxCalculator taxCalculator;

	public IncomeNormalizer(IncomeTaxCalculator taxCalculator) {
		this.taxCalculator = taxCalculator;
	}

	public NormalisedIncome normalise(List<IncomeStream> streams) {
		List<NormalisedStream> normalised = new ArrayList<>();
		BigDecimal gross = BigDecimal.ZERO;
		BigDecimal net = BigDecimal.ZERO;
		BigDecimal withheld = BigDecimal.ZERO;
		for (IncomeStream stream : streams == null ? List.<IncomeStream>of() : streams) {
			NormalisedStream entry = normalise(stream);
			normalised.add(entry);
			gross = gross.add(entry.grossMonthlyAmount());
			net = net.add(entry.netMonthlyAmount());
			withheld = withheld.add(entry.monthlyPaygWithholding());
		}
		return new NormalisedIncome(List.copyOf(normalised), MoneyMath.money(gross), MoneyMath.money(net),
				MoneyMath.money(withheld));
	}

	/**
	 * Taxes one pay period at the stream's own frequency. The returned stream keeps per-period amounts, the
	 * reported figures are monthly equivalents.
	 */
	public NormalisedStream normalise(IncomeStream stream) {
		IncomeFrequency frequency = stream.frequency();
		BigDecimal grossPeriod = MoneyMath.money(stream.monthlyAmount());
		BigDecimal grossMonthly = MoneyMath.money(frequency.toMonthly(grossPeriod));
		if (stream.type() != IncomeType.SALARY) {
			return new NormalisedStream(stream, grossMonthly, grossMonthly, MoneyMath.ZERO, false);
		}
		TakeHomePay pay = taxCalculator.takeHomePay(grossPeriod, payFrequency(frequency));
		BigDecimal netMonthly = MoneyMath.money(frequency.toMonthly(pay.netAmount()));
		return new NormalisedStream(stream.withMonthlyAmount(pay.netAmount()), grossMonthly, netMonthly,
				MoneyMath.money(grossMonthly.subtract(netMonthly)), true);
	}

	static PayFrequency payFrequency(IncomeFrequency frequency) {
		return switch (frequency) {
			case WEEKLY -> PayFrequency.WEEKLY;
			case FORTNIGHTLY -> PayFrequency.FORTNIGHTLY;
			case MONTHLY -> PayFrequency.MONTHLY;
			case ANNUAL -> PayFrequency.ANNUAL;
		};
	}

	/**
	 * {@code stream} carries the amount the forecast should use: net for salary, gross otherwise.
	 */
	public record NormalisedStream(
			IncomeStream stream,
			BigDecimal grossMonthlyAmount,
			BigDecimal netMonthlyAmount,
			BigDecimal monthlyPaygWithholding,
			boolean afterTax
	) {
	}

	public record NormalisedIncome(
			List<NormalisedStream> incomeStreams,
			BigDecimal totalGrossMonthly,
			BigDecimal totalNetMonthly,
			BigDecimal totalMonthlyPayg
	) {
		public List<IncomeStream> forecastStreams() {
			return incomeStreams.stream().map(NormalisedStream::stream).toList();
		}
	}
}
