package my.cashflowplanner.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import my.cashflowplanner.app.model.StressParameters;

public record CustomScenarioRequest(@NotNull @Valid CashflowRequest snapshot,
									@NotBlank String name,
									String description,
									@NotNull StressParameters parameters) {
}
