package org.javai.nlq.parse;

import org.javai.nlq.spec.Aggregation;
import org.javai.nlq.spec.QuerySpecification;
import org.javai.nlq.spec.TaskType;

/**
 * Mutable specification under construction by one rule.
 *
 * <p>Confidence starts at zero and grows with every successful binding. The final value is
 * capped at the rule's ceiling when the draft is built.</p>
 */
public final class SpecDraft {

	static final int MAX_METRICS = 3;
	static final int MAX_DIMENSIONS = 2;

	/** Bonus for a binding the domain vocabulary recognizes. */
	static final double DOMAIN_BONUS = 0.05;

	private final ParseContext context;
	private final double ceiling;
	private final QuerySpecification.Builder builder;
	private double confidence;
	private int bindings;

	SpecDraft(ParseContext context, String ruleName, double ceiling) {
		this.context = context;
		this.ceiling = ceiling;
		this.builder = QuerySpecification.builder(TaskType.EXPLORE)
				.raw(context.prompt())
				.addMatchedPattern("rule:" + ruleName);
	}

	/**
	 * Binds a column as a metric unless it is already bound as one or the metric slots are full.
	 *
	 * @return true if the binding was added
	 */
	public boolean bindMetric(String column, double weight) {
		if (column == null || builder.metrics().contains(column) || builder.metrics().size() >= MAX_METRICS) {
			return false;
		}
		builder.addMetric(column);
		credit("metric", column, weight);
		return true;
	}

	/**
	 * Binds a column as a dimension unless it is already bound as one or the slots are full.
	 *
	 * @return true if the binding was added
	 */
	public boolean bindDimension(String column, double weight) {
		if (column == null || builder.dimensions().contains(column)
				|| builder.dimensions().size() >= MAX_DIMENSIONS) {
			return false;
		}
		builder.addDimension(column);
		credit("dimension", column, weight);
		return true;
	}

	/**
	 * Binds a column under the role the context assigns to it.
	 */
	public boolean bindClassified(String column, double weight) {
		return context.classify(column) == ParseContext.Role.METRIC
				? bindMetric(column, weight)
				: bindDimension(column, weight);
	}

	/**
	 * Records a binding that is not a metric or dimension, such as the time axis of a trend.
	 */
	public void bindOther(String label, String column, double weight) {
		credit(label, column, weight);
	}

	private void credit(String label, String column, double weight) {
		bindings++;
		confidence += weight;
		if (context.domain().map(v -> v.recognizes(column)).orElse(false)) {
			confidence += DOMAIN_BONUS;
		}
		builder.addMatchedPattern(label + ":" + column);
	}

	public boolean hasBindings() {
		return bindings > 0;
	}

	public boolean isDimension(String column) {
		return builder.dimensions().contains(column);
	}

	public boolean hasMetrics() {
		return !builder.metrics().isEmpty();
	}

	public boolean hasDimensions() {
		return !builder.dimensions().isEmpty();
	}

	public SpecDraft task(TaskType task) {
		builder.task(task);
		return this;
	}

	public SpecDraft agg(Aggregation agg) {
		builder.agg(agg);
		return this;
	}

	public SpecDraft topN(Integer topN) {
		builder.topN(topN);
		return this;
	}

	public SpecDraft ascending(boolean ascending) {
		builder.ascending(ascending);
		return this;
	}

	public SpecDraft countRowsIfNoMetric() {
		if (builder.metrics().isEmpty()) {
			builder.addMetric(QuerySpecification.COUNT_ROWS);
		}
		return this;
	}

	public SpecDraft timeColumn(String timeColumn) {
		builder.timeColumn(timeColumn);
		return this;
	}

	public SpecDraft addFilter(String filter) {
		builder.addFilter(filter);
		return this;
	}

	/**
	 * Sets the task from what was bound: dimensions only counts rows per group, metrics and
	 * dimensions show metrics per group, anything else explores.
	 */
	public SpecDraft inferTaskFromBindings() {
		if (hasDimensions() && !hasMetrics()) {
			task(TaskType.GROUP_COUNT).agg(Aggregation.COUNT).countRowsIfNoMetric();
		} else if (hasMetrics() && hasDimensions()) {
			task(TaskType.GROUP_BY);
		} else {
			task(TaskType.EXPLORE);
		}
		return this;
	}

	public TaskType task() {
		return builder.task();
	}

	public double confidence() {
		return Math.min(confidence, ceiling);
	}

	public QuerySpecification build() {
		return builder.confidence(confidence()).build();
	}
}
