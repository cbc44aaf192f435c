package my.cashflowplanner.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CashflowPlannerApplication {
	public static void main(String[] args) {
		SpringApplication.run(CashflowPlannerApplication.class, args);
	}
}
