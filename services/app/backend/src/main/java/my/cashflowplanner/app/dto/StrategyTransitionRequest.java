package my.cashflowplanner.app.dto;

import jakarta.validation.constraints.NotNull;
import my.cashflowplanner.app.model.CashflowStrategy;
import my.cashflowplanner.app.model.StrategyStatus;

public record StrategyTransitionRequest(@NotNull CashflowStrategy strategy, @NotNull StrategyStatus target) {
}
