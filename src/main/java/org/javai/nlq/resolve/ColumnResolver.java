package org.javai.nlq.resolve;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves a natural-language token to one column of the live schema.
 *
 * <p>The resolver applies a cascade of increasingly fuzzy rules and returns on the first hit:</p>
 * <ol>
 *   <li>case-insensitive exact match (a multi-word token also matches its underscored form)</li>
 *   <li>exact match of the singular form when the token ends in {@code s}</li>
 *   <li>substring containment in either direction</li>
 *   <li>underscore word boundary: {@code _token} or {@code token_} inside the column name</li>
 *   <li>normalized edit-distance similarity above the configured threshold</li>
 * </ol>
 *
 * <p>Within a rule, ties go to the column that appears first. The resolver holds no mutable
 * state and may be shared freely.</p>
 */
public final class ColumnResolver {

	/** Default minimum similarity accepted by the last, fuzzy rule. */
	public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.6;

	private final double similarityThreshold;

	public ColumnResolver() {
		this(DEFAULT_SIMILARITY_THRESHOLD);
	}

	public ColumnResolver(double similarityThreshold) {
		if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
			throw new IllegalArgumentException("similarityThreshold must be within [0,1]");
		}
		this.similarityThreshold = similarityThreshold;
	}

	public double similarityThreshold() {
		return similarityThreshold;
	}

	/**
	 * @param token the free-text token, possibly multi-word or plural
	 * @param columns available column names
	 * @return the best matching column, or empty when nothing is close enough
	 */
	public Optional<String> resolve(String token, List<String> columns) {
		if (token == null || columns == null || columns.isEmpty()) {
			return Optional.empty();
		}
		String normalized = normalize(token);
		if (normalized.isEmpty()) {
			return Optional.empty();
		}
		String underscored = normalized.replace(' ', '_');
		String singular = normalized.endsWith("s") && normalized.length() > 1
				? normalized.substring(0, normalized.length() - 1)
				: null;

		for (String column : columns) {
			String c = lower(column);
			if (c.equals(normalized) || c.equals(underscored)) {
				return Optional.of(column);
			}
		}

		if (singular != null) {
			for (String column : columns) {
				if (lower(column).equals(singular)) {
					return Optional.of(column);
				}
			}
		}

		for (String column : columns) {
			String c = lower(column);
			if (c.isEmpty()) {
				continue;
			}
			if (c.contains(normalized) || c.contains(underscored) || normalized.contains(c)
					|| (singular != null && c.contains(singular))) {
				return Optional.of(column);
			}
		}

		for (String column : columns) {
			String c = lower(column);
			if (c.contains("_" + underscored) || c.contains(underscored + "_")) {
				return Optional.of(column);
			}
		}

		String best = null;
		double bestScore = similarityThreshold;
		for (String column : columns) {
			double score = EditDistance.similarity(normalized, lower(column));
			if (score > bestScore) {
				bestScore = score;
				best = column;
			}
		}
		return Optional.ofNullable(best);
	}

	private static String normalize(String token) {
		return token.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
	}

	private static String lower(String column) {
		return column == null ? "" : column.toLowerCase(Locale.ROOT);
	}
}
