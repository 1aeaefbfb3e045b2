package org.javai.nlq.data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scalar coercion helpers shared by the executor and the dataset model.
 *
 * <p>Cells are plain objects: {@code null} is missing, everything else is a {@link Number},
 * {@link String}, {@link Boolean} or a {@code java.time} value. Coercion never throws; a value
 * that cannot be represented in the requested form comes back empty.</p>
 */
public final class Values {

	private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
			DateTimeFormatter.ISO_LOCAL_DATE_TIME,
			DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
			DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
			DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"));

	// Month-first before day-first; day-first only reads dates whose first field exceeds 12.
	private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
			DateTimeFormatter.ISO_LOCAL_DATE,
			DateTimeFormatter.ofPattern("yyyy/M/d"),
			DateTimeFormatter.ofPattern("M/d/yyyy"),
			DateTimeFormatter.ofPattern("M-d-yyyy"),
			DateTimeFormatter.ofPattern("d/M/yyyy"),
			DateTimeFormatter.ofPattern("d-M-yyyy"));

	private static final DateTimeFormatter YEAR_MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

	private Values() {
		// Utility class
	}

	/**
	 * Returns true for {@code null}, blank strings and NaN doubles.
	 */
	public static boolean isMissing(Object value) {
		if (value == null) {
			return true;
		}
		if (value instanceof String s) {
			return s.isBlank();
		}
		if (value instanceof Double d) {
			return d.isNaN();
		}
		if (value instanceof Float f) {
			return f.isNaN();
		}
		return false;
	}

	/**
	 * Coerces a cell to a double, the way a lenient numeric conversion would.
	 *
	 * @param value the cell value
	 * @return the numeric value, or empty when missing or not numeric
	 */
	public static Optional<Double> toDouble(Object value) {
		if (isMissing(value)) {
			return Optional.empty();
		}
		if (value instanceof Number n) {
			return Optional.of(n.doubleValue());
		}
		if (value instanceof String s) {
			try {
				double parsed = Double.parseDouble(s.trim().replace(",", ""));
				return Double.isNaN(parsed) ? Optional.empty() : Optional.of(parsed);
			} catch (NumberFormatException e) {
				return Optional.empty();
			}
		}
		return Optional.empty();
	}

	/**
	 * Coerces a cell to a calendar date. Date-times are truncated to their date and a
	 * year-month is mapped to the first day of the month.
	 *
	 * @param value the cell value
	 * @return the date, or empty when the value does not look like a date
	 */
	public static Optional<LocalDate> toDate(Object value) {
		if (isMissing(value)) {
			return Optional.empty();
		}
		if (value instanceof LocalDate d) {
			return Optional.of(d);
		}
		if (value instanceof LocalDateTime dt) {
			return Optional.of(dt.toLocalDate());
		}
		if (value instanceof YearMonth ym) {
			return Optional.of(ym.atDay(1));
		}
		if (value instanceof java.sql.Date sqlDate) {
			return Optional.of(sqlDate.toLocalDate());
		}
		if (value instanceof Date date) {
			return Optional.of(date.toInstant().atZone(ZoneId.systemDefault()).toLocalDate());
		}
		if (value instanceof String s) {
			return parseDate(s.trim());
		}
		return Optional.empty();
	}

	private static Optional<LocalDate> parseDate(String text) {
		for (DateTimeFormatter format : DATE_TIME_FORMATS) {
			Optional<TemporalAccessor> parsed = tryParse(text, format);
			if (parsed.isPresent()) {
				return Optional.of(LocalDateTime.from(parsed.get()).toLocalDate());
			}
		}
		for (DateTimeFormatter format : DATE_FORMATS) {
			Optional<TemporalAccessor> parsed = tryParse(text, format);
			if (parsed.isPresent()) {
				return Optional.of(LocalDate.from(parsed.get()));
			}
		}
		return tryParse(text, YEAR_MONTH_FORMAT).map(t -> YearMonth.from(t).atDay(1));
	}

	private static Optional<TemporalAccessor> tryParse(String text, DateTimeFormatter format) {
		try {
			return Optional.of(format.parse(text));
		} catch (DateTimeParseException e) {
			return Optional.empty();
		}
	}

	/**
	 * Interprets the right-hand side of a filter expression. Surrounding quotes are stripped;
	 * text with a decimal point becomes a {@link Double}, other numeric text a {@link Long},
	 * anything else stays a string.
	 */
	public static Object coerceLiteral(String literal) {
		String v = stripQuotes(literal.trim());
		try {
			if (v.contains(".")) {
				return Double.parseDouble(v);
			}
			return Long.parseLong(v);
		} catch (NumberFormatException e) {
			return v;
		}
	}

	private static String stripQuotes(String value) {
		String v = value;
		if (v.length() >= 2 && (v.startsWith("'") && v.endsWith("'") || v.startsWith("\"") && v.endsWith("\""))) {
			v = v.substring(1, v.length() - 1);
		}
		return v;
	}

	/**
	 * Scalar equality between a cell and a coerced literal. Numeric literals compare
	 * numerically against any numerically coercible cell; everything else compares by text.
	 */
	public static boolean scalarEquals(Object cell, Object literal) {
		if (isMissing(cell)) {
			return literal == null;
		}
		if (literal instanceof Number n) {
			return toDouble(cell).map(d -> d == n.doubleValue()).orElse(false);
		}
		return Objects.equals(String.valueOf(cell), String.valueOf(literal));
	}

	/**
	 * Compares two nullable sort keys. Missing keys sort last in either direction.
	 */
	public static int compareNullable(Double left, Double right, boolean descending) {
		if (left == null && right == null) {
			return 0;
		}
		if (left == null) {
			return 1;
		}
		if (right == null) {
			return -1;
		}
		return descending ? Double.compare(right, left) : Double.compare(left, right);
	}
}
