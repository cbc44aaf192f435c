package my.cashflowplanner.app.model;

import java.math.BigDecimal;

public record OffsetAccount(String id, String name, BigDecimal balance, String linkedLoanId) {
}
