package org.javai.nlq.parse;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.nlq.domain.DomainVocabulary;
import org.javai.nlq.resolve.ColumnHeuristics;
import org.javai.nlq.resolve.ColumnResolver;
import org.javai.nlq.spec.QuerySpecification;
import org.javai.nlq.spec.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a free-text prompt and a list of column names into a {@link QuerySpecification}.
 *
 * <p>Rules are tried in order and the first one that matches and binds at least one column wins.
 * If none does, every content word of the prompt is resolved on its own. A prompt that still
 * yields nothing becomes an {@link TaskType#ERROR} specification with suggestions.</p>
 *
 * <p>Comparison phrases such as {@code "revenue above 1000"} and a year such as {@code "in 2023"}
 * become filters on the resulting specification.</p>
 *
 * <p>Parsing never throws. The parser holds no per-call state and may be shared.</p>
 */
public final class PromptParser {

	private static final Logger logger = LoggerFactory.getLogger(PromptParser.class);

	private final ColumnResolver resolver;
	private final List<PromptRule> rules;

	public PromptParser() {
		this(new ColumnResolver());
	}

	public PromptParser(ColumnResolver resolver) {
		this(resolver, PromptRules.defaults());
	}

	public PromptParser(ColumnResolver resolver, List<PromptRule> rules) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
		this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
	}

	public QuerySpecification parse(String prompt, List<String> columns) {
		return parse(prompt, columns, null);
	}

	/**
	 * Parses a prompt, consulting a domain vocabulary for metric and dimension hints.
	 *
	 * @param vocabulary may be {@code null}
	 */
	public QuerySpecification parse(String prompt, List<String> columns, DomainVocabulary vocabulary) {
		if (prompt == null || prompt.isBlank()) {
			return QuerySpecification.error(prompt, "Empty query", List.of());
		}
		if (columns == null || columns.isEmpty()) {
			return QuerySpecification.error(prompt, "No columns available", List.of());
		}
		try {
			return doParse(prompt.trim(), columns, vocabulary);
		} catch (RuntimeException e) {
			logger.error("Failed to parse prompt '{}'", prompt, e);
			return QuerySpecification.error(prompt, "Parse failed: " + e.getMessage(), List.of());
		}
	}

	private QuerySpecification doParse(String prompt, List<String> columns, DomainVocabulary vocabulary) {
		ParseContext context = new ParseContext(prompt, columns, resolver, vocabulary);

		Optional<SpecDraft> draft = Optional.empty();
		for (PromptRule rule : rules) {
			draft = rule.apply(context);
			if (draft.isPresent()) {
				logger.info("Prompt '{}' matched rule '{}'", prompt, rule.name());
				break;
			}
		}
		if (draft.isEmpty()) {
			draft = PromptRules.tokenScan(context);
			draft.ifPresent(d -> logger.info("Prompt '{}' resolved by token scan", prompt));
		}
		if (draft.isEmpty()) {
			List<String> suggestions = SuggestionGenerator.suggest(context.columns());
			logger.info("Prompt '{}' could not be understood", prompt);
			return QuerySpecification.error(prompt, SuggestionGenerator.failureMessage(suggestions), suggestions);
		}

		SpecDraft spec = draft.get();
		ComparisonPhrases.extract(context).forEach(spec::addFilter);
		PromptTokens.firstYear(ComparisonPhrases.strip(prompt)).ifPresent(year -> spec.addFilter("year==" + year));
		ColumnHeuristics.detectTimeColumn(context.columns()).ifPresent(spec::timeColumn);
		QuerySpecification result = spec.build();
		logger.debug("Parsed specification: {}", result);
		return result;
	}
}
