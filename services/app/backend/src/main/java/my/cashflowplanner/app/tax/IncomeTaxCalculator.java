package my.cashflowplanner.app.tax;

import java.math.BigDecimal;

public interface IncomeTaxCalculator {
	TakeHomePay takeHomePay(BigDecimal grossAmount, PayFrequency frequency);
}
