package org.javai.nlq.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;
import org.javai.nlq.QueryEngineConfig;
import org.javai.nlq.exec.FilterExpression;
import org.javai.nlq.exec.FilterOperator;
import org.javai.nlq.spec.Aggregation;
import org.javai.nlq.spec.QuerySpecification;
import org.javai.nlq.spec.TaskType;

/**
 * Renders a query specification as the equivalent SQL {@code SELECT}, for display.
 *
 * <p>The statement is assembled as text and then round-tripped through JSqlParser, so what is
 * returned is the parser's normalized rendering of a statement known to parse:</p>
 *
 * <pre>{@code
 * SELECT dealer_name, SUM(sales) AS sales FROM data GROUP BY dealer_name ORDER BY sales DESC LIMIT 5
 * }</pre>
 *
 * <p>Filters that cannot be parsed are left out, as the executor skips them too. A {@code year}
 * filter on a specification with a time column other than {@code year} is rendered as
 * {@code EXTRACT(YEAR FROM <time column>)}.</p>
 */
public final class SqlPreviewRenderer {

	private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	// Aliases and columns that collide with keywords JSqlParser reserves or treats specially.
	private static final Set<String> RESERVED = Set.of(
			"all", "and", "as", "by", "case", "count", "date", "desc", "distinct", "from", "group",
			"having", "in", "is", "join", "limit", "month", "not", "null", "on", "or", "order",
			"select", "table", "time", "to", "union", "where", "with", "year");

	private final QueryEngineConfig config;

	public SqlPreviewRenderer() {
		this(QueryEngineConfig.defaults());
	}

	public SqlPreviewRenderer(QueryEngineConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	/**
	 * @param spec the specification to render
	 * @param tableName table name used in the {@code FROM} clause
	 * @return the normalized SQL text
	 * @throws SqlRenderException for error specifications or when the statement does not parse
	 */
	public String render(QuerySpecification spec, String tableName) {
		Objects.requireNonNull(spec, "spec must not be null");
		if (tableName == null || tableName.isBlank()) {
			throw new SqlRenderException("Table name must not be blank");
		}
		if (spec.isError()) {
			throw new SqlRenderException("Cannot render a failed parse: " + spec.error());
		}
		String sql = buildSql(spec, tableName.trim());
		Statement statement;
		try {
			statement = CCJSqlParserUtil.parse(sql);
		} catch (JSQLParserException e) {
			throw new SqlRenderException("Generated SQL does not parse: " + sql, e);
		}
		if (!(statement instanceof Select select)) {
			throw new SqlRenderException("Generated statement is not a SELECT: " + sql);
		}
		return select.toString();
	}

	String buildSql(QuerySpecification spec, String tableName) {
		List<String> metrics = spec.columnMetrics();
		List<String> dimensions = spec.dimensions();
		String dims = dimensions.stream().map(SqlPreviewRenderer::identifier).collect(Collectors.joining(", "));

		StringBuilder sql = new StringBuilder("SELECT ");
		String groupBy = null;
		String orderBy = null;
		TaskType task = spec.task();

		if (task == TaskType.TREND && spec.timeColumn() != null) {
			String bucket = "DATE_TRUNC('month', " + identifier(spec.timeColumn()) + ")";
			sql.append(bucket).append(" AS ").append(identifier(spec.timeColumn()));
			if (metrics.isEmpty()) {
				sql.append(", COUNT(*) AS ").append(identifier("count"));
			}
			for (String metric : metrics) {
				sql.append(", ").append(aggregate(spec.agg(), metric)).append(" AS ").append(identifier(metric));
			}
			groupBy = bucket;
			orderBy = bucket + " ASC";
		} else if (task == TaskType.GROUP_COUNT || isCountOnly(spec) && !dimensions.isEmpty() && isGrouping(task)) {
			String countColumn = spec.countsRows() ? "count" : "count_of_" + metrics.get(0);
			String countExpr = spec.countsRows() ? "COUNT(*)" : "COUNT(" + identifier(metrics.get(0)) + ")";
			if (!dims.isEmpty()) {
				sql.append(dims).append(", ");
				groupBy = dims;
			}
			sql.append(countExpr).append(" AS ").append(identifier(countColumn));
			orderBy = identifier(countColumn) + " DESC";
		} else if (isGrouping(task) && !metrics.isEmpty() && !dimensions.isEmpty()) {
			sql.append(dims);
			for (String metric : metrics) {
				sql.append(", ").append(aggregate(spec.agg(), metric)).append(" AS ").append(identifier(metric));
			}
			groupBy = dims;
			orderBy = identifier(metrics.get(0)) + direction(spec);
		} else if (task == TaskType.RANK && !metrics.isEmpty()) {
			sql.append("*");
			orderBy = identifier(metrics.get(0)) + direction(spec);
		} else if (isGrouping(task) && !metrics.isEmpty()) {
			sql.append(metrics.stream()
					.map(m -> aggregate(spec.agg(), m) + " AS " + identifier(spec.agg().wireName() + "_" + m))
					.collect(Collectors.joining(", ")));
		} else if (isGrouping(task) && !dimensions.isEmpty()) {
			sql.append("DISTINCT ").append(dims);
		} else {
			sql.append("*");
		}

		sql.append(" FROM ").append(identifier(tableName));
		List<String> conditions = conditions(spec);
		if (!conditions.isEmpty()) {
			sql.append(" WHERE ").append(String.join(" AND ", conditions));
		}
		if (groupBy != null) {
			sql.append(" GROUP BY ").append(groupBy);
		}
		if (orderBy != null) {
			sql.append(" ORDER BY ").append(orderBy);
		}
		sql.append(" LIMIT ").append(limit(spec));
		return sql.toString();
	}

	private List<String> conditions(QuerySpecification spec) {
		List<String> conditions = new ArrayList<>();
		for (String raw : spec.filters()) {
			Optional<FilterExpression> parsed = FilterExpression.parse(raw);
			if (parsed.isEmpty()) {
				continue;
			}
			FilterExpression filter = parsed.get();
			Object literal = filter.value();
			if (filter.operator().isNumeric() && !(literal instanceof Number)) {
				continue;
			}
			String column = identifier(filter.column());
			if ("year".equalsIgnoreCase(filter.column()) && spec.timeColumn() != null
					&& !"year".equalsIgnoreCase(spec.timeColumn())) {
				column = "EXTRACT(YEAR FROM " + identifier(spec.timeColumn()) + ")";
			}
			conditions.add(column + " " + sqlOperator(filter.operator()) + " " + sqlLiteral(literal));
		}
		return conditions;
	}

	private int limit(QuerySpecification spec) {
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

	private static boolean isGrouping(TaskType task) {
		return switch (task) {
			case AGGREGATE, AGGREGATE_BY, GROUP_BY, RANK -> true;
			default -> false;
		};
	}

	private static boolean isCountOnly(QuerySpecification spec) {
		return spec.columnMetrics().isEmpty() && !spec.metrics().isEmpty();
	}

	private static String direction(QuerySpecification spec) {
		return spec.ascending() ? " ASC" : " DESC";
	}

	private static String aggregate(Aggregation agg, String metric) {
		return agg.sqlFunction() + "(" + identifier(metric) + ")";
	}

	private static String sqlOperator(FilterOperator operator) {
		return switch (operator) {
			case EQUALS, ASSIGN_EQUALS -> "=";
			case NOT_EQUALS -> "<>";
			default -> operator.symbol();
		};
	}

	private static String sqlLiteral(Object literal) {
		if (literal instanceof Number) {
			return literal.toString();
		}
		return "'" + String.valueOf(literal).replace("'", "''") + "'";
	}

	static String identifier(String name) {
		if (PLAIN_IDENTIFIER.matcher(name).matches() && !RESERVED.contains(name.toLowerCase(Locale.ROOT))) {
			return name;
		}
		return "\"" + name.replace("\"", "\"\"") + "\"";
	}
}
