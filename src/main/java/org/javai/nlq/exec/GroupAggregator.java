package org.javai.nlq.exec;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.javai.nlq.data.Dataset;
import org.javai.nlq.data.Values;
import org.javai.nlq.spec.Aggregation;

/**
 * Grouping, aggregation and ordering over a {@link Dataset}.
 *
 * <p>Groups appear in first-seen order and missing key values form a group of their own.
 * Sorting is stable and puts rows with a missing sort key last.</p>
 */
final class GroupAggregator {

	static final String COUNT_COLUMN = "count";

	private GroupAggregator() {
		// Utility class
	}

	/**
	 * Counts rows per group, or non-missing values of {@code metric} when one is given, largest
	 * group first.
	 *
	 * @param metric column whose values are counted, or {@code null} to count rows
	 */
	static Dataset countByGroup(Dataset data, List<String> dimensions, String metric) {
		String countColumn = metric == null ? COUNT_COLUMN : "count_of_" + metric;
		Map<List<Object>, List<Integer>> groups = group(data, dimensions);
		List<List<Object>> rows = new ArrayList<>();
		for (Map.Entry<List<Object>, List<Integer>> group : groups.entrySet()) {
			long count = metric == null
					? group.getValue().size()
					: group.getValue().stream().filter(i -> !Values.isMissing(data.value(i, metric))).count();
			List<Object> row = new ArrayList<>(group.getKey());
			row.add(count);
			rows.add(row);
		}
		List<String> columns = new ArrayList<>(dimensions);
		columns.add(countColumn);
		return sortBy(Dataset.ofRows(columns, rows), countColumn, true);
	}

	/**
	 * Aggregates each metric per group. Metric columns keep their names.
	 */
	static Dataset aggregateByGroup(Dataset data, List<String> dimensions, List<String> metrics, Aggregation agg) {
		Map<List<Object>, List<Integer>> groups = group(data, dimensions);
		List<List<Object>> rows = new ArrayList<>();
		for (Map.Entry<List<Object>, List<Integer>> group : groups.entrySet()) {
			List<Object> row = new ArrayList<>(group.getKey());
			for (String metric : metrics) {
				row.add(agg.apply(numbers(data, metric, group.getValue())));
			}
			rows.add(row);
		}
		List<String> columns = new ArrayList<>(dimensions);
		columns.addAll(metrics);
		return Dataset.ofRows(columns, rows);
	}

	/**
	 * @return the distinct combinations of the given columns, in first-seen order
	 */
	static Dataset distinct(Dataset data, List<String> dimensions) {
		return Dataset.ofRows(dimensions, new ArrayList<>(group(data, dimensions).keySet()));
	}

	/**
	 * Aggregates each metric over all rows into a single row of {@code <agg>_<metric>} columns.
	 */
	static Dataset aggregateAll(Dataset data, List<String> metrics, Aggregation agg) {
		List<Integer> all = allRows(data);
		Dataset.Builder builder = Dataset.builder();
		for (String metric : metrics) {
			builder.column(agg.wireName() + "_" + metric, agg.apply(numbers(data, metric, all)));
		}
		return builder.build();
	}

	/**
	 * Buckets rows by the calendar month of {@code timeColumn} and aggregates each metric per
	 * month. Months between the first and last with no rows are filled with zero. Rows whose
	 * time value is missing or unreadable are ignored. With no metrics, rows are counted.
	 */
	static Dataset monthlyTrend(Dataset data, String timeColumn, List<String> metrics, Aggregation agg) {
		TreeMap<YearMonth, List<Integer>> buckets = new TreeMap<>();
		List<Object> times = data.column(timeColumn);
		for (int row = 0; row < data.rowCount(); row++) {
			Optional<YearMonth> month = Values.toDate(times.get(row)).map(YearMonth::from);
			if (month.isPresent()) {
				buckets.computeIfAbsent(month.get(), m -> new ArrayList<>()).add(row);
			}
		}
		List<String> valueColumns = metrics.isEmpty() ? List.of(COUNT_COLUMN) : metrics;
		List<String> columns = new ArrayList<>();
		columns.add(timeColumn);
		columns.addAll(valueColumns);
		if (buckets.isEmpty()) {
			return Dataset.ofRows(columns, List.of());
		}

		List<List<Object>> rows = new ArrayList<>();
		for (YearMonth month = buckets.firstKey(); !month.isAfter(buckets.lastKey()); month = month.plusMonths(1)) {
			List<Integer> members = buckets.getOrDefault(month, List.of());
			List<Object> row = new ArrayList<>();
			row.add(month);
			if (metrics.isEmpty()) {
				row.add((long) members.size());
			} else {
				for (String metric : metrics) {
					row.add(members.isEmpty() ? Double.valueOf(0.0) : agg.apply(numbers(data, metric, members)));
				}
			}
			rows.add(row);
		}
		return Dataset.ofRows(columns, rows);
	}

	/**
	 * Stable sort on a column's numeric value, missing or non-numeric keys last.
	 */
	static Dataset sortBy(Dataset data, String column, boolean descending) {
		List<Object> keys = data.column(column);
		List<Integer> order = allRows(data);
		order.sort(Comparator.comparing(
				(Integer row) -> Values.toDouble(keys.get(row)).orElse(null),
				(l, r) -> Values.compareNullable(l, r, descending)));
		return data.selectRows(order);
	}

	private static Map<List<Object>, List<Integer>> group(Dataset data, List<String> dimensions) {
		Map<List<Object>, List<Integer>> groups = new LinkedHashMap<>();
		for (int row = 0; row < data.rowCount(); row++) {
			Object[] key = new Object[dimensions.size()];
			for (int d = 0; d < key.length; d++) {
				Object value = data.value(row, dimensions.get(d));
				key[d] = Values.isMissing(value) ? null : value;
			}
			groups.computeIfAbsent(Arrays.asList(key), k -> new ArrayList<>()).add(row);
		}
		return groups;
	}

	private static List<Double> numbers(Dataset data, String metric, List<Integer> rows) {
		List<Object> cells = data.column(metric);
		List<Double> values = new ArrayList<>(rows.size());
		for (int row : rows) {
			Values.toDouble(cells.get(row)).ifPresent(values::add);
		}
		return values;
	}

	private static List<Integer> allRows(Dataset data) {
		List<Integer> rows = new ArrayList<>(data.rowCount());
		for (int row = 0; row < data.rowCount(); row++) {
			rows.add(row);
		}
		return rows;
	}
}
