package org.javai.nlq.resolve;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Name-only heuristics about columns.
 *
 * <p>These deliberately look at the column name and never at the data. A name such as
 * {@code rate_limit_id} reads as numeric because it contains {@code rate}; callers that need
 * the real kind should ask {@link org.javai.nlq.data.Dataset#kindOf(String)}.</p>
 */
public final class ColumnHeuristics {

	/** Substrings that mark a column as a likely measure. */
	public static final List<String> METRIC_INDICATORS = List.of(
			"amount", "count", "rate", "revenue", "cost", "price", "sales", "quantity", "value",
			"total", "avg", "sum", "gmv", "margin", "premium", "claim", "units", "qty");

	/** Substrings that mark a column as a likely grouping attribute. */
	public static final List<String> CATEGORY_INDICATORS = List.of(
			"name", "id", "type", "category", "status", "department", "region", "segment",
			"channel", "brand", "city", "country", "state", "specialization", "qualification");

	/** Substrings that mark a column as a time axis. */
	public static final List<String> TIME_INDICATORS = List.of(
			"date", "month", "year", "time", "day", "quarter", "period");

	private ColumnHeuristics() {
		// Utility class
	}

	public static boolean looksNumeric(String columnName) {
		return containsAny(columnName, METRIC_INDICATORS);
	}

	public static boolean looksCategorical(String columnName) {
		return containsAny(columnName, CATEGORY_INDICATORS);
	}

	public static boolean looksTemporal(String columnName) {
		return containsAny(columnName, TIME_INDICATORS);
	}

	/**
	 * @return the first column whose name contains a time keyword
	 */
	public static Optional<String> detectTimeColumn(List<String> columns) {
		if (columns == null) {
			return Optional.empty();
		}
		return columns.stream()
				.filter(ColumnHeuristics::looksTemporal)
				.findFirst();
	}

	static boolean containsAny(String columnName, List<String> keywords) {
		if (columnName == null) {
			return false;
		}
		String lower = columnName.toLowerCase(Locale.ROOT);
		for (String keyword : keywords) {
			if (lower.contains(keyword)) {
				return true;
			}
		}
		return false;
	}
}
