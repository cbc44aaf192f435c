package my.cashflowplanner.app.service;

import my.cashflowplanner.app.model.IncomeFrequency;
import my.cashflowplanner.app.model.IncomeStream;
import my.cashflowplanner.app.model.LoanSchedule;
import my.cashflowplanner.app.model.PlannedExpense;
import my.cashflowplanner.app.model.RecurringPayment;
import my.cashflowplanner.app.model.RecurringTimelineEntry;
import my.cashflowplanner.app.service.util.MoneyMath;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Expands recurring payments, income streams, loan repayments and planned expenses into dated events inside
 * {@code [today, today + horizonDays]}. Every occurrence is computed from its anchor, so anchors before the window
 * still seed the sequence without accumulating drift.
 */
@Service
public class CashflowTimelineGenerator {
	private static final BigDecimal DAYS_PER_MONTH = BigDecimal.valueOf(30);

	public List<RecurringTimelineEntry> recurringTimeline(List<RecurringPayment> payments, LocalDate today, int horizonDays) {
		LocalDate end = today.plusDays(horizonDays);
		List<RecurringTimelineEntry> timeline = new ArrayList<>();
		for (RecurringPayment payment : payments) {
			if (payment == null || !payment.active() || payment.pattern() == null) {
				continue;
			}
			LocalDate anchor = payment.anchorDate();
			if (anchor == null) {
				continue;
			}
			BigDecimal amount = MoneyMath.money(payment.expectedAmount());
			for (long step = 0; ; step++) {
				LocalDate date = payment.pattern().advance(anchor, step);
				if (date.isAfter(end)) {
					break;
				}
				if (!date.isBefore(today)) {
					timeline.add(new RecurringTimelineEntry(date, payment.id(), payment.merchant(), amount, payment.accountId()));
				}
			}
		}
		timeline.sort(Comparator.comparing(RecurringTimelineEntry::date));
		return List.copyOf(timeline);
	}

	/**
	 * Income streams without a next expected date start one interval after today.
	 */
	public List<IncomeEvent> incomeTimeline(List<IncomeStream> streams, LocalDate today, int horizonDays) {
		LocalDate end = today.plusDays(horizonDays);
		List<IncomeEvent> timeline = new ArrayList<>();
		for (IncomeStream stream : streams) {
			if (stream == null || stream.frequency() == null) {
				continue;
			}
			IncomeFrequency frequency = stream.frequency();
			LocalDate anchor = stream.nextExpected() != null
					? stream.nextExpected()
					: frequency.advance(today, 1);
			BigDecimal perOccurrence = perOccurrenceAmount(stream);
			for (long step = 0; ; step++) {
				LocalDate date = frequency.advance(anchor, step);
				if (date.isAfter(end)) {
					break;
				}
				if (!date.isBefore(today)) {
					timeline.add(new IncomeEvent(date, perOccurrence, stream.id(), stream.name(), stream.accountId()));
				}
			}
		}
		timeline.sort(Comparator.comparing(IncomeEvent::date));
		return List.copyOf(timeline);
	}

	public List<LoanEvent> loanTimeline(List<LoanSchedule> loans, LocalDate today, int horizonDays) {
		LocalDate end = today.plusDays(horizonDays);
		List<LoanEvent> timeline = new ArrayList<>();
		for (LoanSchedule loan : loans) {
			if (loan == null) {
				continue;
			}
			BigDecimal amount = MoneyMath.money(loan.monthlyRepayment());
			YearMonth month = YearMonth.from(today);
			if (repaymentDate(month, loan.repaymentDay()).isBefore(today)) {
				month = month.plusMonths(1);
			}
			LocalDate date = repaymentDate(month, loan.repaymentDay());
			while (!date.isAfter(end)) {
				timeline.add(new LoanEvent(date, amount, loan.loanId(), loan.loanName()));
				month = month.plusMonths(1);
				date = repaymentDate(month, loan.repaymentDay());
			}
		}
		timeline.sort(Comparator.comparing(LoanEvent::date));
		return List.copyOf(timeline);
	}

	public List<PlannedExpense> plannedTimeline(List<PlannedExpense> expenses, LocalDate today, int horizonDays) {
		LocalDate end = today.plusDays(horizonDays);
		List<PlannedExpense> timeline = new ArrayList<>();
		for (PlannedExpense expense : expenses) {
			if (expense == null || expense.date() == null) {
				continue;
			}
			if (!expense.date().isBefore(today) && !expense.date().isAfter(end)) {
				timeline.add(expense);
			}
		}
		timeline.sort(Comparator.comparing(PlannedExpense::date));
		return List.copyOf(timeline);
	}

	/**
	 * Monthly-equivalent amount spread over the frequency's native interval: {@code monthly / (30 / intervalDays)}.
	 */
	static BigDecimal perOccurrenceAmount(IncomeStream stream) {
		IncomeFrequency frequency = stream.frequency();
		BigDecimal monthly = frequency.toMonthly(MoneyMath.safe(stream.monthlyAmount()));
		return MoneyMath.money(monthly.multiply(BigDecimal.valueOf(frequency.intervalDays()))
				.divide(DAYS_PER_MONTH, MathContext.DECIMAL64));
	}

	/**
	 * Sums event amounts per date, optionally keeping only the events {@code filter} accepts.
	 */
	public static <T> Map<LocalDate, BigDecimal> indexByDate(List<T> events,
										Function<T, LocalDate> date,
										Function<T, BigDecimal> amount,
										Predicate<T> filter) {
		Map<LocalDate, BigDecimal> index = new TreeMap<>();
		for (T event : events) {
			if (filter != null && !filter.test(event)) {
				continue;
			}
			index.merge(date.apply(event), MoneyMath.safe(amount.apply(event)), BigDecimal::add);
		}
		return index;
	}

	private static LocalDate repaymentDate(YearMonth month, int repaymentDay) {
		int day = Math.max(1, Math.min(repaymentDay, month.lengthOfMonth()));
		return month.atDay(day);
	}

	public record IncomeEvent(LocalDate date, BigDecimal amount, String streamId, String name, String accountId) {
	}

	public record LoanEvent(LocalDate date, BigDecimal amount, String loanId, String loanName) {
	}
}
