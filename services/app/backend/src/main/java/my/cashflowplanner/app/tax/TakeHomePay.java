package my.cashflowplanner.app.tax;

import java.math.BigDecimal;

/**
 * Amounts are per pay period; {@code effectiveTaxRate} is a percentage of gross.
 */
public record TakeHomePay(
		BigDecimal grossAmount,
		BigDecimal netAmount,
		BigDecimal paygWithholding,
		BigDecimal medicareLevy,
		BigDecimal effectiveTaxRate
) {
}
