package my.cashflowplanner.app.dto;

import jakarta.validation.constraints.NotNull;
import my.cashflowplanner.app.model.IncomeStream;

import java.util.List;

public record IncomeNormalisationRequest(@NotNull List<IncomeStream> incomeStreams) {
}
