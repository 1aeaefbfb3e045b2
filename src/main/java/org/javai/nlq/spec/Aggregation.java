package org.javai.nlq.spec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregation verbs. Missing values are excluded by the caller before {@link #apply(List)}.
 */
public enum Aggregation {
	SUM("sum", "SUM"),
	MEAN("mean", "AVG"),
	COUNT("count", "COUNT"),
	MIN("min", "MIN"),
	MAX("max", "MAX"),
	MEDIAN("median", "MEDIAN");

	private static final Map<String, Aggregation> VERBS = Map.ofEntries(
			Map.entry("sum", SUM),
			Map.entry("total", SUM),
			Map.entry("average", MEAN),
			Map.entry("avg", MEAN),
			Map.entry("mean", MEAN),
			Map.entry("count", COUNT),
			Map.entry("number", COUNT),
			Map.entry("min", MIN),
			Map.entry("minimum", MIN),
			Map.entry("max", MAX),
			Map.entry("maximum", MAX),
			Map.entry("median", MEDIAN));

	private final String wireName;
	private final String sqlFunction;

	Aggregation(String wireName, String sqlFunction) {
		this.wireName = wireName;
		this.sqlFunction = sqlFunction;
	}

	public String wireName() {
		return wireName;
	}

	public String sqlFunction() {
		return sqlFunction;
	}

	/**
	 * Maps an English verb ({@code total}, {@code average}, ...) to an aggregation.
	 */
	public static Optional<Aggregation> fromVerb(String verb) {
		if (verb == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(VERBS.get(verb.trim().toLowerCase(Locale.ROOT)));
	}

	public static Optional<Aggregation> fromWireName(String name) {
		if (name == null) {
			return Optional.empty();
		}
		String lower = name.trim().toLowerCase(Locale.ROOT);
		for (Aggregation aggregation : values()) {
			if (aggregation.wireName.equals(lower)) {
				return Optional.of(aggregation);
			}
		}
		return Optional.empty();
	}

	/**
	 * Applies the aggregation to non-missing values.
	 *
	 * @param values the present values of one group
	 * @return the aggregate; {@code null} for mean/min/max/median of nothing, 0 for sum and count
	 */
	public Double apply(List<Double> values) {
		return switch (this) {
			case SUM -> values.stream().mapToDouble(Double::doubleValue).sum();
			case COUNT -> (double) values.size();
			case MEAN -> values.isEmpty() ? null : values.stream().mapToDouble(Double::doubleValue).average().getAsDouble();
			case MIN -> values.isEmpty() ? null : Collections.min(values);
			case MAX -> values.isEmpty() ? null : Collections.max(values);
			case MEDIAN -> values.isEmpty() ? null : median(values);
		};
	}

	private static double median(List<Double> values) {
		List<Double> sorted = new ArrayList<>(values);
		Collections.sort(sorted);
		int middle = sorted.size() / 2;
		if (sorted.size() % 2 == 1) {
			return sorted.get(middle);
		}
		return (sorted.get(middle - 1) + sorted.get(middle)) / 2.0;
	}

	@Override
	public String toString() {
		return wireName;
	}
}
