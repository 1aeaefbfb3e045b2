package org.javai.nlq.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.nlq.QueryEngineConfig;
import org.javai.nlq.data.Dataset;
import org.javai.nlq.data.Values;
import org.javai.nlq.resolve.ColumnHeuristics;
import org.javai.nlq.spec.QuerySpecification;
import org.javai.nlq.spec.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link QuerySpecification} against a {@link Dataset}.
 *
 * <p>Execution first reconciles the specification with the data: metrics and dimensions
 * beyond the configured limits, and references to columns the dataset does not have, are
 * dropped. If no usable column remains the task falls back to {@link TaskType#EXPLORE}. The
 * reconciled specification is returned with the result.</p>
 *
 * <p>Filters run before any grouping. The result never exceeds the specification's
 * {@code topN} (or the task default) nor the configured safety cap.</p>
 *
 * <p>Execution does not throw for bad data: a failure while computing the result is logged and
 * answered with a preview of the filtered rows and an annotated specification.</p>
 */
public final class QueryExecutor {

	private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

	private final QueryEngineConfig config;

	public QueryExecutor() {
		this(QueryEngineConfig.defaults());
	}

	public QueryExecutor(QueryEngineConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	public QueryResult execute(QuerySpecification spec, Dataset dataset) {
		Objects.requireNonNull(spec, "spec must not be null");
		Objects.requireNonNull(dataset, "dataset must not be null");

		QuerySpecification effective = reconcile(spec, dataset);
		String timeColumn = timeColumn(effective, dataset).orElse(null);
		Dataset filtered = dataset;
		try {
			filtered = RowFilter.apply(dataset, effective.filters(), timeColumn);
			Dataset table = run(effective, filtered, timeColumn).head(rowLimit(effective));
			logger.info("Executed {} task: {} of {} rows matched filters, {} result rows",
					effective.task(), filtered.rowCount(), dataset.rowCount(), table.rowCount());
			return new QueryResult(table, effective);
		} catch (RuntimeException e) {
			logger.error("Execution of {} task failed", effective.task(), e);
			return new QueryResult(filtered.head(config.errorPreviewRows()),
					effective.withError("Aggregation failed: " + e.getMessage()));
		}
	}

	private Dataset run(QuerySpecification spec, Dataset data, String timeColumn) {
		List<String> metrics = spec.columnMetrics();
		List<String> dimensions = spec.dimensions();
		return switch (spec.task()) {
			case GROUP_COUNT -> countRows(spec, data);
			case AGGREGATE, AGGREGATE_BY, GROUP_BY, RANK -> {
				if (metrics.isEmpty()) {
					yield spec.metrics().isEmpty()
							? GroupAggregator.distinct(data, dimensions)
							: countRows(spec, data);
				}
				if (dimensions.isEmpty()) {
					yield spec.task() == TaskType.RANK
							? GroupAggregator.sortBy(data, metrics.get(0), !spec.ascending())
							: GroupAggregator.aggregateAll(data, metrics, spec.agg());
				}
				Dataset grouped = GroupAggregator.aggregateByGroup(data, dimensions, metrics, spec.agg());
				yield GroupAggregator.sortBy(grouped, metrics.get(0), !spec.ascending());
			}
			case TREND -> timeColumn != null
					? GroupAggregator.monthlyTrend(data, timeColumn, metrics, spec.agg())
					: data;
			case EXPLORE, ERROR -> data;
		};
	}

	private static Dataset countRows(QuerySpecification spec, Dataset data) {
		String metric = spec.countsRows() ? null : spec.columnMetrics().get(0);
		if (spec.dimensions().isEmpty()) {
			long count = metric == null ? data.rowCount() : data.column(metric).stream()
					.filter(v -> !Values.isMissing(v)).count();
			return Dataset.builder()
					.column(metric == null ? GroupAggregator.COUNT_COLUMN : "count_of_" + metric, count)
					.build();
		}
		return GroupAggregator.countByGroup(data, spec.dimensions(), metric);
	}

	private int rowLimit(QuerySpecification spec) {
		int limit;
		if (spec.topN() != null) {
			limit = spec.topN();
		} else if (spec.task() == TaskType.RANK) {
			limit = config.defaultTopN();
		} else {
			limit = config.previewRows();
		}
		return Math.min(limit, config.maxRows());
	}

	/**
	 * Aligns the specification with the columns the dataset actually has.
	 */
	QuerySpecification reconcile(QuerySpecification spec, Dataset dataset) {
		if (spec.isError()) {
			return spec;
		}
		List<String> metrics = new ArrayList<>();
		for (String metric : spec.metrics()) {
			if (metrics.size() >= config.maxMetrics()) {
				logger.debug("Dropping metric '{}': at most {} metrics are supported", metric, config.maxMetrics());
				continue;
			}
			if (QuerySpecification.COUNT_ROWS.equals(metric)) {
				metrics.add(metric);
				continue;
			}
			Optional<String> column = dataset.findColumnIgnoreCase(metric);
			if (column.isEmpty()) {
				logger.debug("Dropping metric '{}': not a column of the dataset", metric);
			} else if (!metrics.contains(column.get())) {
				metrics.add(column.get());
			}
		}
		List<String> dimensions = new ArrayList<>();
		for (String dimension : spec.dimensions()) {
			if (dimensions.size() >= config.maxDimensions()) {
				logger.debug("Dropping dimension '{}': at most {} dimensions are supported", dimension,
						config.maxDimensions());
				continue;
			}
			Optional<String> column = dataset.findColumnIgnoreCase(dimension);
			if (column.isEmpty()) {
				logger.debug("Dropping dimension '{}': not a column of the dataset", dimension);
			} else if (!dimensions.contains(column.get())) {
				dimensions.add(column.get());
			}
		}

		QuerySpecification reconciled = metrics.equals(spec.metrics()) && dimensions.equals(spec.dimensions())
				? spec
				: spec.withColumns(metrics, dimensions);
		if (!hasUsableColumns(reconciled, dataset)) {
			if (reconciled.task() != TaskType.EXPLORE) {
				logger.info("No usable columns left for {} task; exploring instead", reconciled.task());
			}
			return reconciled.task() == TaskType.EXPLORE ? reconciled : reconciled.withTask(TaskType.EXPLORE);
		}
		return reconciled;
	}

	private static boolean hasUsableColumns(QuerySpecification spec, Dataset dataset) {
		if (!spec.columnMetrics().isEmpty() || !spec.dimensions().isEmpty()) {
			return true;
		}
		return spec.task() == TaskType.TREND && timeColumn(spec, dataset).isPresent();
	}

	private static Optional<String> timeColumn(QuerySpecification spec, Dataset dataset) {
		if (spec.timeColumn() != null) {
			Optional<String> declared = dataset.findColumnIgnoreCase(spec.timeColumn());
			if (declared.isPresent()) {
				return declared;
			}
		}
		return ColumnHeuristics.detectTimeColumn(dataset.columnNames());
	}
}
