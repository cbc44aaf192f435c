package my.cashflowplanner.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.cashflowplanner.app.dto.CustomScenarioRequest;
import my.cashflowplanner.app.dto.StressTestRequest;
import my.cashflowplanner.app.model.StressScenario;
import my.cashflowplanner.app.service.CashflowService;
import my.cashflowplanner.app.service.StressTestEngine.StressTestOutput;
import my.cashflowplanner.app.service.StressTestEngine.StressTestResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/cashflow/stress-test")
@Tag(name = "Stress Testing")
public class StressTestController {
	private final CashflowService cashflowService;

	public StressTestController(CashflowService cashflowService) {
		this.cashflowService = cashflowService;
	}

	@GetMapping("/scenarios")
	@Operation(summary = "List predefined stress scenarios")
	public List<StressScenario> scenarios() {
		return cashflowService.scenarios();
	}

	@PostMapping
	@Operation(summary = "Run selected scenarios, or all of them")
	public StressTestOutput run(@Valid @RequestBody StressTestRequest request) {
		return cashflowService.stressTest(request);
	}

	@PostMapping("/custom")
	@Operation(summary = "Run a custom stress scenario")
	public StressTestResult runCustom(@Valid @RequestBody CustomScenarioRequest request) {
		return cashflowService.customStressTest(request);
	}
}
