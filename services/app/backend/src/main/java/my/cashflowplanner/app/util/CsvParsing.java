package my.cashflowplanner.app.util;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

public final class CsvParsing {
	private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
			DateTimeFormatter.ISO_LOCAL_DATE,
			DateTimeFormatter.ofPattern("d/M/uuuu"),
			DateTimeFormatter.ofPattern("d.M.uuuu")
	);

	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	/**
	 * Picks the delimiter from the header line: tab, then semicolon, then comma.
	 */
	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		int newline = sample.indexOf('\n');
		String header = newline >= 0 ? sample.substring(0, newline) : sample;
		if (header.indexOf('\t') >= 0) {
			return '\t';
		}
		if (header.indexOf(';') >= 0) {
			return ';';
		}
		return ',';
	}

	public static String decodeUtf8(byte[] payload) {
		String raw = new String(payload, StandardCharsets.UTF_8);
		return stripBom(raw);
	}

	/**
	 * Accepts ISO dates and the day-first formats banks export. Returns null when nothing matches.
	 */
	public static LocalDate parseDate(String raw) {
		String value = trim(raw);
		if (value.isEmpty()) {
			return null;
		}
		for (DateTimeFormatter format : DATE_FORMATS) {
			try {
				return LocalDate.parse(value, format);
			} catch (DateTimeParseException ignored) {
				// next format
			}
		}
		return null;
	}

	/**
	 * Parses "$1,234.56", "-12.00" and accounting negatives like "(12.00)". Returns null when unparseable.
	 */
	public static BigDecimal parseAmount(String raw) {
		String value = trim(raw).replace("$", "").replace("AUD", "").replace(",", "").replace(" ", "");
		if (value.isEmpty()) {
			return null;
		}
		boolean negative = value.startsWith("(") && value.endsWith(")");
		if (negative) {
			value = value.substring(1, value.length() - 1);
		}
		try {
			BigDecimal amount = new BigDecimal(value);
			return negative ? amount.negate() : amount;
		} catch (NumberFormatException exc) {
			return null;
		}
	}

	public static String trim(String value) {
		return value == null ? "" : value.trim();
	}
}
