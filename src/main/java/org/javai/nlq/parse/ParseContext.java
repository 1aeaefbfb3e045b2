package org.javai.nlq.parse;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.nlq.domain.DomainVocabulary;
import org.javai.nlq.resolve.ColumnHeuristics;
import org.javai.nlq.resolve.ColumnResolver;

/**
 * Everything a {@link PromptRule} needs to turn one prompt into a specification draft.
 *
 * @param prompt the trimmed prompt text
 * @param columns the available column names
 * @param resolver fuzzy column resolver
 * @param vocabulary optional domain vocabulary, may be {@code null}
 */
public record ParseContext(String prompt, List<String> columns, ColumnResolver resolver, DomainVocabulary vocabulary) {

	/** How a resolved column is used. */
	public enum Role {
		METRIC,
		DIMENSION
	}

	public ParseContext {
		Objects.requireNonNull(prompt, "prompt must not be null");
		Objects.requireNonNull(resolver, "resolver must not be null");
		columns = columns != null ? List.copyOf(columns) : List.of();
	}

	/**
	 * Resolves a captured phrase, ignoring trailing qualifiers such as {@code "in 2023"}.
	 */
	public Optional<String> resolve(String token) {
		if (token == null) {
			return Optional.empty();
		}
		return resolver.resolve(PromptTokens.stripQualifiers(token), columns);
	}

	public Optional<DomainVocabulary> domain() {
		return Optional.ofNullable(vocabulary);
	}

	/**
	 * Decides whether a resolved column acts as a metric or a dimension. A domain vocabulary,
	 * when present, is consulted first; otherwise the column name heuristic decides.
	 */
	public Role classify(String column) {
		if (vocabulary != null) {
			if (vocabulary.isMetric(column)) {
				return Role.METRIC;
			}
			if (vocabulary.isDimension(column)) {
				return Role.DIMENSION;
			}
		}
		return ColumnHeuristics.looksNumeric(column) ? Role.METRIC : Role.DIMENSION;
	}

	public Optional<String> timeColumn() {
		return ColumnHeuristics.detectTimeColumn(columns);
	}

	/**
	 * Starts a draft for the given rule with its confidence ceiling.
	 */
	public SpecDraft draft(String ruleName, double ceiling) {
		return new SpecDraft(this, ruleName, ceiling);
	}
}
