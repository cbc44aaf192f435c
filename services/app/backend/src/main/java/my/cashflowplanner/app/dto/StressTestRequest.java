package my.cashflowplanner.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * An empty or missing {@code scenarioIds} runs the whole library.
 */
public record StressTestRequest(@NotNull @Valid CashflowRequest snapshot, List<String> scenarioIds) {
}
