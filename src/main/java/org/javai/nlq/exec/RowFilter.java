package org.javai.nlq.exec;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.javai.nlq.data.Dataset;
import org.javai.nlq.data.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies raw filter expressions to a dataset, in order.
 *
 * <p>A filter that cannot be applied is skipped with a warning and the remaining filters still
 * run: malformed expressions, unknown columns, and ordering comparisons against a non-numeric
 * literal. A filter on {@code year} against a table without a year column compares the calendar
 * year of the table's time column instead.</p>
 */
final class RowFilter {

	private static final Logger logger = LoggerFactory.getLogger(RowFilter.class);

	static final String YEAR = "year";

	private RowFilter() {
		// Utility class
	}

	/**
	 * @param timeColumn time column in {@code data}, or {@code null}
	 */
	static Dataset apply(Dataset data, List<String> filters, String timeColumn) {
		Dataset current = data;
		for (String raw : filters) {
			Optional<Predicate<Integer>> predicate = compile(current, raw, timeColumn);
			if (predicate.isEmpty()) {
				continue;
			}
			List<Integer> kept = new ArrayList<>();
			for (int row = 0; row < current.rowCount(); row++) {
				if (predicate.get().test(row)) {
					kept.add(row);
				}
			}
			logger.debug("Filter '{}' kept {} of {} rows", raw, kept.size(), current.rowCount());
			current = current.selectRows(kept);
		}
		return current;
	}

	private static Optional<Predicate<Integer>> compile(Dataset data, String raw, String timeColumn) {
		Optional<FilterExpression> parsed = FilterExpression.parse(raw);
		if (parsed.isEmpty()) {
			logger.warn("Skipping malformed filter '{}'", raw);
			return Optional.empty();
		}
		FilterExpression filter = parsed.get();
		Object literal = filter.value();
		if (filter.operator().isNumeric() && !(literal instanceof Number)) {
			logger.warn("Skipping filter '{}': '{}' is not numeric", raw, filter.literal());
			return Optional.empty();
		}

		Optional<String> column = data.findColumnIgnoreCase(filter.column());
		if (column.isPresent()) {
			List<Object> cells = data.column(column.get());
			return Optional.of(row -> filter.operator().test(cells.get(row), literal));
		}
		if (YEAR.equalsIgnoreCase(filter.column()) && timeColumn != null && data.hasColumn(timeColumn)) {
			List<Object> cells = data.column(timeColumn);
			logger.debug("Applying filter '{}' to the calendar year of '{}'", raw, timeColumn);
			return Optional.of(row -> filter.operator().test(yearOf(cells.get(row)), literal));
		}
		logger.warn("Skipping filter '{}': no column '{}'", raw, filter.column());
		return Optional.empty();
	}

	private static Integer yearOf(Object cell) {
		return Values.toDate(cell).map(LocalDate::getYear).orElse(null);
	}
}
