package my.cashflowplanner.app.importer;

import my.cashflowplanner.app.model.Direction;
import my.cashflowplanner.app.model.TransactionRecord;
import my.cashflowplanner.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Reads a transaction history export. Required columns: {@code date}, {@code amount}. Optional: {@code id},
 * {@code account}, {@code direction}, {@code merchant} (or {@code description}), {@code category},
 * {@code subcategory}, {@code recurring}. Header names are case-insensitive.
 * <p>
 * Without a direction column the sign of the amount decides: negative amounts are outflows.
 */
@Component
public class TransactionCsvParser {
	private static final Logger logger = LoggerFactory.getLogger(TransactionCsvParser.class);

	public ImportResult parse(byte[] payload, String defaultAccountId) {
		if (payload == null || payload.length == 0) {
			throw new IllegalArgumentException("CSV file is empty");
		}
		String content = CsvParsing.decodeUtf8(payload);
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setDelimiter(CsvParsing.sniffDelimiter(content))
				.setHeader()
				.setSkipHeaderRecord(true)
				.setIgnoreHeaderCase(true)
				.setIgnoreEmptyLines(true)
				.setTrim(true)
				.get();

		List<TransactionRecord> transactions = new ArrayList<>();
		List<String> skipped = new ArrayList<>();
		try (CSVParser parser = format.parse(new StringReader(content))) {
			if (!hasHeader(parser, "date")) {
				throw new IllegalArgumentException("CSV is missing the 'date' column");
			}
			if (!hasHeader(parser, "amount")) {
				throw new IllegalArgumentException("CSV is missing the 'amount' column");
			}
			for (CSVRecord record : parser) {
				long line = record.getRecordNumber() + 1;
				LocalDate date = CsvParsing.parseDate(value(record, "date"));
				BigDecimal amount = CsvParsing.parseAmount(value(record, "amount"));
				if (date == null || amount == null) {
					skipped.add("line " + line + ": unreadable date or amount");
					continue;
				}
				Direction direction = direction(value(record, "direction"), amount);
				String id = value(record, "id");
				String account = value(record, "account");
				String merchant = value(record, "merchant");
				if (merchant.isEmpty()) {
					merchant = value(record, "description");
				}
				transactions.add(new TransactionRecord(
						id.isEmpty() ? "csv-" + line : id,
						account.isEmpty() ? defaultAccountId : account,
						date,
						amount.abs(),
						direction,
						emptyToNull(value(record, "category")),
						emptyToNull(value(record, "subcategory")),
						emptyToNull(merchant),
						isTrue(value(record, "recurring"))
				));
			}
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read transaction CSV: " + exc.getMessage(), exc);
		} catch (UncheckedIOException exc) {
			// record iteration wraps malformed quoting
			throw new IllegalArgumentException("Failed to read transaction CSV: " + exc.getCause().getMessage(), exc);
		}
		if (!skipped.isEmpty()) {
			logger.debug("Skipped {} unreadable CSV rows", skipped.size());
		}
		transactions.sort(Comparator.comparing(TransactionRecord::date));
		return new ImportResult(List.copyOf(transactions), List.copyOf(skipped));
	}

	private boolean hasHeader(CSVParser parser, String name) {
		return parser.getHeaderNames().stream().anyMatch(header -> header.equalsIgnoreCase(name));
	}

	private String value(CSVRecord record, String column) {
		if (!record.isMapped(column) || !record.isSet(column)) {
			return "";
		}
		return CsvParsing.trim(record.get(column));
	}

	private Direction direction(String raw, BigDecimal amount) {
		String value = raw.toUpperCase(Locale.ROOT);
		switch (value) {
			case "IN", "CREDIT", "CR" -> {
				return Direction.IN;
			}
			case "OUT", "DEBIT", "DR" -> {
				return Direction.OUT;
			}
			default -> {
				return amount.signum() < 0 ? Direction.OUT : Direction.IN;
			}
		}
	}

	private boolean isTrue(String raw) {
		String value = raw.toLowerCase(Locale.ROOT);
		return value.equals("true") || value.equals("yes") || value.equals("1") || value.equals("y");
	}

	private String emptyToNull(String value) {
		return value.isEmpty() ? null : value;
	}

	public record ImportResult(List<TransactionRecord> transactions, List<String> skippedRows) {
	}
}
