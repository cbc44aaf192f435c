package my.cashflowplanner.app.model;

public record StrategyStep(int order, String action, String description, boolean optional) {
}
