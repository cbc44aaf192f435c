package my.cashflowplanner.app.service;

import my.cashflowplanner.app.model.AccountBalance;
import my.cashflowplanner.app.model.AccountForecast;
import my.cashflowplanner.app.model.AccountType;
import my.cashflowplanner.app.model.CashflowForecast;
import my.cashflowplanner.app.model.CashflowInput;
import my.cashflowplanner.app.model.ExpenseAttribution;
import my.cashflowplanner.app.model.ForecastConfig;
import my.cashflowplanner.app.model.ForecastMetadata;
import my.cashflowplanner.app.model.ForecastPoint;
import my.cashflowplanner.app.model.ForecastSummary;
import my.cashflowplanner.app.model.LoanSchedule;
import my.cashflowplanner.app.model.PlannedExpense;
import my.cashflowplanner.app.model.RecurringTimelineEntry;
import my.cashflowplanner.app.model.ShortfallAnalysis;
import my.cashflowplanner.app.model.TransactionRecord;
import my.cashflowplanner.app.service.CashflowTimelineGenerator.IncomeEvent;
import my.cashflowplanner.app.service.CashflowTimelineGenerator.LoanEvent;
import my.cashflowplanner.app.service.ForecastSimulator.AccountDrivers;
import my.cashflowplanner.app.service.SpendingPatternAnalyzer.SpendingPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Produces a complete forecast from a validated snapshot whose config already carries today, the horizon and the
 * attribution mode.
 */
@Service
public class CashflowForecastEngine {
	private static final Logger logger = LoggerFactory.getLogger(CashflowForecastEngine.class);

	private final SpendingPatternAnalyzer patternAnalyzer;
	private final CashflowTimelineGenerator timelineGenerator;
	private final ForecastSimulator simulator;
	private final ShortfallSummaryAnalyzer summaryAnalyzer;

	public CashflowForecastEngine(SpendingPatternAnalyzer patternAnalyzer,
								  CashflowTimelineGenerator timelineGenerator,
								  ForecastSimulator simulator,
								  ShortfallSummaryAnalyzer summaryAnalyzer) {
		this.patternAnalyzer = patternAnalyzer;
		this.timelineGenerator = timelineGenerator;
		this.simulator = simulator;
		this.summaryAnalyzer = summaryAnalyzer;
	}

	public CashflowForecast generate(CashflowInput input) {
		long started = System.nanoTime();
		ForecastConfig config = Objects.requireNonNull(input.config(), "config");
		LocalDate today = Objects.requireNonNull(config.today(), "config.today");
		int days = config.forecastDays() == null ? 0 : config.forecastDays();
		ExpenseAttribution attribution = config.attribution() == null
				? ExpenseAttribution.OWNING_ACCOUNT
				: config.attribution();

		SpendingPatterns patterns = patternAnalyzer.analyze(input.transactions());
		List<RecurringTimelineEntry> recurring = timelineGenerator.recurringTimeline(input.recurringPayments(), today, days);
		List<IncomeEvent> income = timelineGenerator.incomeTimeline(input.incomeStreams(), today, days);
		List<LoanEvent> loans = timelineGenerator.loanTimeline(input.loanSchedules(), today, days);
		List<PlannedExpense> planned = timelineGenerator.plannedTimeline(input.plannedExpenses(), today, days);

		AccountResolver resolver = new AccountResolver(input.accounts(), input.loanSchedules());
		List<AccountForecast> accountForecasts = new ArrayList<>();
		for (AccountBalance account : input.accounts()) {
			AccountDrivers drivers = drivers(account.accountId(), attribution, resolver, patterns, input.transactions(),
					recurring, income, loans, planned);
			accountForecasts.add(simulator.simulateAccount(account, drivers, today, days, config.includeConfidenceBands()));
		}
		List<ForecastPoint> global = simulator.mergeGlobal(accountForecasts, config.includeConfidenceBands());
		ShortfallAnalysis shortfalls = summaryAnalyzer.analyseShortfalls(accountForecasts, global);
		ForecastSummary summary = summaryAnalyzer.summarise(global, patterns, input.accounts(), today);

		CashflowForecast forecast = new CashflowForecast(
				input.userId(),
				today,
				global,
				accountForecasts,
				shortfalls,
				recurring,
				summaryAnalyzer.volatilityIndex(patterns),
				summary,
				new ForecastMetadata(input.transactions().size(), input.recurringPayments().size(), days, attribution)
		);
		if (logger.isDebugEnabled()) {
			logger.debug("Forecast for {} accounts over {} days computed in {} ms (shortfall={}).",
					accountForecasts.size(), days, (System.nanoTime() - started) / 1_000_000, shortfalls.hasShortfall());
		}
		return forecast;
	}

	private AccountDrivers drivers(String accountId,
								   ExpenseAttribution attribution,
								   AccountResolver resolver,
								   SpendingPatterns householdPatterns,
								   List<TransactionRecord> transactions,
								   List<RecurringTimelineEntry> recurring,
								   List<IncomeEvent> income,
								   List<LoanEvent> loans,
								   List<PlannedExpense> planned) {
		boolean everyAccount = attribution == ExpenseAttribution.EVERY_ACCOUNT;
		Map<LocalDate, BigDecimal> incomeByDate = CashflowTimelineGenerator.indexByDate(income,
				IncomeEvent::date, IncomeEvent::amount,
				event -> everyAccount || accountId.equals(resolver.resolve(event.accountId())));

		Map<LocalDate, BigDecimal> scheduled = new HashMap<>();
		CashflowTimelineGenerator.indexByDate(recurring, RecurringTimelineEntry::date, RecurringTimelineEntry::expectedAmount,
						entry -> accountId.equals(resolver.resolve(entry.accountId())))
				.forEach((date, amount) -> scheduled.merge(date, amount, BigDecimal::add));
		CashflowTimelineGenerator.indexByDate(loans, LoanEvent::date, LoanEvent::amount,
						event -> everyAccount || accountId.equals(resolver.loanOwner(event.loanId())))
				.forEach((date, amount) -> scheduled.merge(date, amount, BigDecimal::add));
		CashflowTimelineGenerator.indexByDate(planned, PlannedExpense::date, PlannedExpense::amount,
						expense -> accountId.equals(resolver.resolve(expense.accountId())))
				.forEach((date, amount) -> scheduled.merge(date, amount, BigDecimal::add));

		SpendingPatterns patterns = everyAccount
				? householdPatterns
				: patternAnalyzer.analyze(transactions.stream()
						.filter(tx -> accountId.equals(resolver.resolve(tx.accountId())))
						.toList());
		return new AccountDrivers(incomeByDate, scheduled, patterns);
	}

	/**
	 * Maps optional account references onto known accounts. Unknown or missing references fall back to the primary
	 * account: the first transactional account, otherwise the first account.
	 */
	static final class AccountResolver {
		private final Set<String> accountIds = new LinkedHashSet<>();
		private final Map<String, String> loanOwners = new HashMap<>();
		private final String primaryAccountId;

		AccountResolver(List<AccountBalance> accounts, List<LoanSchedule> loanSchedules) {
			String transactional = null;
			for (AccountBalance account : accounts) {
				accountIds.add(account.accountId());
				if (transactional == null && account.accountType() == AccountType.TRANSACTIONAL) {
					transactional = account.accountId();
				}
				if (account.linkedLoanId() != null) {
					loanOwners.putIfAbsent(account.linkedLoanId(), account.accountId());
				}
			}
			primaryAccountId = transactional != null
					? transactional
					: accounts.isEmpty() ? null : accounts.get(0).accountId();
			for (LoanSchedule loan : loanSchedules) {
				if (loan.offsetAccountId() != null && accountIds.contains(loan.offsetAccountId())) {
					loanOwners.putIfAbsent(loan.loanId(), loan.offsetAccountId());
				}
			}
		}

		String resolve(String accountId) {
			return accountId != null && accountIds.contains(accountId) ? accountId : primaryAccountId;
		}

		String loanOwner(String loanId) {
			String owner = loanId == null ? null : loanOwners.get(loanId);
			return owner == null ? primaryAccountId : owner;
		}

		String primaryAccountId() {
			return primaryAccountId;
		}
	}
}
