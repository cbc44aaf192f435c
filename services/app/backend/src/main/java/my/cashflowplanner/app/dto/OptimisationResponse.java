package my.cashflowplanner.app.dto;

import my.cashflowplanner.app.model.CashflowForecast;
import my.cashflowplanner.app.service.CashflowOptimisationEngine.OptimisationResult;

public record OptimisationResponse(CashflowForecast forecast, OptimisationResult optimisation) {
}
