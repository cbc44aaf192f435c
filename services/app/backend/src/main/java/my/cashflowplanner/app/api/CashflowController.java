package my.cashflowplanner.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.cashflowplanner.app.dto.CashflowRequest;
import my.cashflowplanner.app.dto.IncomeNormalisationRequest;
import my.cashflowplanner.app.dto.InsightRequest;
import my.cashflowplanner.app.dto.InsightResponse;
import my.cashflowplanner.app.dto.OptimisationResponse;
import my.cashflowplanner.app.dto.StrategyTransitionRequest;
import my.cashflowplanner.app.dto.TransactionImportResponse;
import my.cashflowplanner.app.model.CashflowForecast;
import my.cashflowplanner.app.model.CashflowStrategy;
import my.cashflowplanner.app.service.CashflowService;
import my.cashflowplanner.app.service.IncomeNormalizer.NormalisedIncome;
import my.cashflowplanner.app.service.ShortfallSummaryAnalyzer.QuickForecast;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.math.BigDecimal;

@RestController
@RequestMapping("/api/cashflow")
@Tag(name = "Cashflow")
public class CashflowController {
	private final CashflowService cashflowService;

	public CashflowController(CashflowService cashflowService) {
		this.cashflowService = cashflowService;
	}

	@PostMapping("/forecast")
	@Operation(summary = "Forecast daily balances for every account")
	public CashflowForecast forecast(@Valid @RequestBody CashflowRequest request) {
		return cashflowService.forecast(request);
	}

	@PostMapping("/optimisations")
	@Operation(summary = "Forecast and derive optimisation recommendations")
	public OptimisationResponse optimise(@Valid @RequestBody CashflowRequest request) {
		return cashflowService.optimise(request);
	}

	@PostMapping("/insights")
	@Operation(summary = "Generate prioritised insights")
	public InsightResponse insights(@Valid @RequestBody InsightRequest request) {
		return cashflowService.insights(request);
	}

	@GetMapping("/quick-forecast")
	@Operation(summary = "Linear end-balance projection")
	public QuickForecast quickForecast(@RequestParam BigDecimal currentBalance,
									   @RequestParam BigDecimal monthlyIncome,
									   @RequestParam BigDecimal monthlyExpenses,
									   @RequestParam(required = false) Integer days) {
		return cashflowService.quickForecast(currentBalance, monthlyIncome, monthlyExpenses, days);
	}

	@PostMapping(path = "/transactions/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	@Operation(summary = "Parse a transaction CSV and derive spending patterns")
	public TransactionImportResponse importTransactions(@RequestParam("file") MultipartFile file,
														@RequestParam(value = "accountId", required = false) String accountId)
			throws IOException {
		return cashflowService.importTransactions(file.getBytes(), accountId);
	}

	@PostMapping("/income/normalise")
	@Operation(summary = "Convert salary income to after-tax amounts")
	public NormalisedIncome normaliseIncome(@Valid @RequestBody IncomeNormalisationRequest request) {
		return cashflowService.normaliseIncome(request.incomeStreams());
	}

	@PostMapping("/strategies/transition")
	@Operation(summary = "Accept, dismiss or expire a strategy")
	public CashflowStrategy transitionStrategy(@Valid @RequestBody StrategyTransitionRequest request) {
		return cashflowService.transitionStrategy(request.strategy(), request.target());
	}
}
