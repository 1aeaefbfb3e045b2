package org.javai.nlq.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, column-oriented table of scalar values.
 *
 * <p>A dataset is an ordered collection of uniquely named columns of equal length. The same
 * type carries both the caller's input data and the bounded result of a query; every
 * transformation returns a new instance and never touches the receiver.</p>
 *
 * <pre>{@code
 * Dataset sales = Dataset.builder()
 *     .column("dealer_name", "Acme", "Bolt", "Acme")
 *     .column("sales", 100, 250, 75)
 *     .build();
 * }</pre>
 */
public final class Dataset {

	private static final Dataset EMPTY = new Dataset(new LinkedHashMap<>(), 0);

	private final Map<String, List<Object>> columns;
	private final int rowCount;

	private Dataset(LinkedHashMap<String, List<Object>> columns, int rowCount) {
		this.columns = Collections.unmodifiableMap(columns);
		this.rowCount = rowCount;
	}

	public static Dataset empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Creates a dataset from row-major data.
	 *
	 * @param columnNames the column names, in order
	 * @param rows rows whose length must match the number of columns
	 * @return the dataset
	 */
	public static Dataset ofRows(List<String> columnNames, List<? extends List<?>> rows) {
		Objects.requireNonNull(columnNames, "columnNames must not be null");
		Objects.requireNonNull(rows, "rows must not be null");
		Builder builder = builder();
		for (int c = 0; c < columnNames.size(); c++) {
			List<Object> values = new ArrayList<>(rows.size());
			for (List<?> row : rows) {
				if (row.size() != columnNames.size()) {
					throw new IllegalArgumentException("Row width " + row.size()
							+ " does not match column count " + columnNames.size());
				}
				values.add(row.get(c));
			}
			builder.column(columnNames.get(c), values);
		}
		return builder.build();
	}

	/**
	 * @return column names in their original order
	 */
	public List<String> columnNames() {
		return List.copyOf(columns.keySet());
	}

	public int rowCount() {
		return rowCount;
	}

	public int columnCount() {
		return columns.size();
	}

	public boolean isEmpty() {
		return rowCount == 0;
	}

	public boolean hasColumn(String name) {
		return name != null && columns.containsKey(name);
	}

	/**
	 * Finds a column by name ignoring case. Exact matches take precedence.
	 */
	public Optional<String> findColumnIgnoreCase(String name) {
		if (name == null) {
			return Optional.empty();
		}
		if (columns.containsKey(name)) {
			return Optional.of(name);
		}
		return columns.keySet().stream()
				.filter(c -> c.equalsIgnoreCase(name))
				.findFirst();
	}

	/**
	 * @return the values of the named column
	 * @throws IllegalArgumentException if the column does not exist
	 */
	public List<Object> column(String name) {
		List<Object> values = columns.get(name);
		if (values == null) {
			throw new IllegalArgumentException("Unknown column: " + name);
		}
		return values;
	}

	public Object value(int row, String column) {
		return column(column).get(row);
	}

	/**
	 * @return the values of one row keyed by column name, in column order
	 */
	public Map<String, Object> row(int row) {
		Objects.checkIndex(row, rowCount);
		Map<String, Object> result = new LinkedHashMap<>();
		columns.forEach((name, values) -> result.put(name, values.get(row)));
		return result;
	}

	/**
	 * Infers the kind of a column from its current contents. The result is never cached.
	 */
	public ColumnKind kindOf(String name) {
		for (Object value : column(name)) {
			if (!Values.isMissing(value) && Values.toDouble(value).isEmpty()) {
				return ColumnKind.CATEGORICAL;
			}
		}
		return ColumnKind.NUMERIC;
	}

	/**
	 * Returns a dataset holding the given rows, in the given order.
	 */
	public Dataset selectRows(List<Integer> rowIndexes) {
		LinkedHashMap<String, List<Object>> selected = new LinkedHashMap<>();
		columns.forEach((name, values) -> {
			List<Object> copy = new ArrayList<>(rowIndexes.size());
			for (int index : rowIndexes) {
				copy.add(values.get(index));
			}
			selected.put(name, Collections.unmodifiableList(copy));
		});
		return new Dataset(selected, rowIndexes.size());
	}

	/**
	 * Returns the first {@code n} rows, or the whole dataset when it is shorter.
	 */
	public Dataset head(int n) {
		if (n >= rowCount) {
			return this;
		}
		int limit = Math.max(0, n);
		LinkedHashMap<String, List<Object>> truncated = new LinkedHashMap<>();
		columns.forEach((name, values) -> truncated.put(name, values.subList(0, limit)));
		return new Dataset(truncated, limit);
	}

	/**
	 * Returns a dataset restricted to the named columns, in the given order.
	 */
	public Dataset selectColumns(List<String> names) {
		LinkedHashMap<String, List<Object>> selected = new LinkedHashMap<>();
		for (String name : names) {
			selected.put(name, column(name));
		}
		return new Dataset(selected, rowCount);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Dataset other)) {
			return false;
		}
		return rowCount == other.rowCount && columns.equals(other.columns);
	}

	@Override
	public int hashCode() {
		return Objects.hash(columns, rowCount);
	}

	@Override
	public String toString() {
		return "Dataset[columns=" + columns.keySet() + ", rows=" + rowCount + "]";
	}

	/**
	 * Builder assembling a dataset column by column.
	 */
	public static final class Builder {
		private final LinkedHashMap<String, List<Object>> columns = new LinkedHashMap<>();
		private Integer rowCount;

		private Builder() {
		}

		public Builder column(String name, Object... values) {
			return column(name, Arrays.asList(values));
		}

		public Builder column(String name, List<?> values) {
			Objects.requireNonNull(name, "column name must not be null");
			Objects.requireNonNull(values, "values must not be null");
			if (columns.containsKey(name)) {
				throw new IllegalArgumentException("Duplicate column: " + name);
			}
			if (rowCount != null && rowCount != values.size()) {
				throw new IllegalArgumentException("Column '" + name + "' has " + values.size()
						+ " values but previous columns have " + rowCount);
			}
			rowCount = values.size();
			columns.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
			return this;
		}

		public Dataset build() {
			return new Dataset(new LinkedHashMap<>(columns), rowCount != null ? rowCount : 0);
		}
	}
}
