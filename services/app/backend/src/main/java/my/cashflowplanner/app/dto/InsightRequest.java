package my.cashflowplanner.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record InsightRequest(@NotNull @Valid CashflowRequest snapshot, Boolean includeStressTest) {
}
