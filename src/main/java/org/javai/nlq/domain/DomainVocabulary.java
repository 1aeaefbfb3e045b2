package org.javai.nlq.domain;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Keywords typical for one business domain, used to classify resolved columns.
 *
 * <p>A vocabulary is produced by a domain-detection collaborator and passed to the parser
 * explicitly. Matching is a case-insensitive substring test against the column name.</p>
 *
 * @param name domain name, e.g. {@code ecommerce}
 * @param metrics keywords of columns that are usually measures ({@code gmv}, {@code revenue})
 * @param dimensions keywords of columns that are usually attributes ({@code brand}, {@code region})
 */
public record DomainVocabulary(String name, List<String> metrics, List<String> dimensions) {

	public DomainVocabulary {
		Objects.requireNonNull(name, "name must not be null");
		metrics = metrics != null ? lowerCased(metrics) : List.of();
		dimensions = dimensions != null ? lowerCased(dimensions) : List.of();
	}

	public boolean isMetric(String columnName) {
		return matchesAny(columnName, metrics);
	}

	public boolean isDimension(String columnName) {
		return matchesAny(columnName, dimensions);
	}

	/**
	 * @return true if the column matches either keyword list
	 */
	public boolean recognizes(String columnName) {
		return isMetric(columnName) || isDimension(columnName);
	}

	private static boolean matchesAny(String columnName, List<String> keywords) {
		if (columnName == null) {
			return false;
		}
		String lower = columnName.toLowerCase(Locale.ROOT);
		return keywords.stream().anyMatch(lower::contains);
	}

	private static List<String> lowerCased(List<String> keywords) {
		return keywords.stream()
				.filter(Objects::nonNull)
				.map(k -> k.toLowerCase(Locale.ROOT))
				.toList();
	}
}
