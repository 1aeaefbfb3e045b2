package org.javai.nlq.parse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenization helpers for prompts.
 */
final class PromptTokens {

	private static final Pattern NON_WORD = Pattern.compile("[^\\w]+");
	private static final Pattern LIST_SEPARATOR = Pattern.compile("\\s*,\\s*|\\s+and\\s+", Pattern.CASE_INSENSITIVE);
	private static final Pattern BY_SEPARATOR = Pattern.compile("\\s+by\\s+", Pattern.CASE_INSENSITIVE);
	private static final Pattern YEAR = Pattern.compile("\\b(20\\d{2})\\b");
	private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
	private static final Pattern QUALIFIER_TAIL = Pattern.compile(
			"\\s+(?:in|for|during|from|since|where|with|over|last|this|between|is|not|above|below|under|exceeds"
					+ "|equals?|greater|more|less|fewer|at\\s+least|at\\s+most)\\b.*$|\\s+\\d+$",
			Pattern.CASE_INSENSITIVE);

	// Words that never name a column on their own.
	private static final Set<String> STOP_WORDS = Set.of(
			"a", "an", "the", "of", "by", "per", "for", "in", "on", "to", "and", "or", "with", "me",
			"show", "display", "list", "give", "get", "find", "what", "which", "who", "how", "many",
			"much", "is", "are", "was", "were", "all", "each", "every", "top", "bottom", "best",
			"worst", "highest", "lowest", "rank", "order", "sort", "sum", "total", "average", "avg",
			"mean", "count", "number", "min", "max", "median", "group", "grouped", "distribution",
			"breakdown", "trend", "trends", "over", "time", "series", "monthly", "please", "can",
			"you", "i", "we", "from", "at", "as");

	private PromptTokens() {
		// Utility class
	}

	/**
	 * Splits a prompt into lower-case candidate column words, dropping stop words and numbers.
	 */
	static List<String> contentWords(String prompt) {
		List<String> words = new ArrayList<>();
		for (String raw : NON_WORD.split(prompt.toLowerCase(Locale.ROOT))) {
			if (raw.length() < 2 || STOP_WORDS.contains(raw) || NUMBER.matcher(raw).matches()) {
				continue;
			}
			words.add(raw);
		}
		return words;
	}

	/**
	 * Splits a list phrase such as {@code "region, month"} or {@code "region and month"}.
	 */
	static List<String> listItems(String phrase) {
		if (phrase == null || phrase.isBlank()) {
			return List.of();
		}
		return Arrays.stream(LIST_SEPARATOR.split(phrase.trim()))
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.toList();
	}

	/**
	 * Splits {@code "dealer by sales"} at the first standalone {@code by}.
	 *
	 * @return the part before and, if present, the part after the separator
	 */
	static String[] splitOnBy(String phrase) {
		String[] parts = BY_SEPARATOR.split(phrase.trim(), 2);
		return parts.length == 2 ? new String[] { parts[0].trim(), parts[1].trim() } : new String[] { parts[0].trim(), null };
	}

	/**
	 * Drops a trailing qualifier such as {@code "in 2023"} or {@code "for last quarter"} from a
	 * captured phrase, so {@code "dealer in 2023"} reads as {@code "dealer"}.
	 *
	 * @return the shortened phrase, or the phrase itself when nothing would remain
	 */
	static String stripQualifiers(String phrase) {
		String stripped = QUALIFIER_TAIL.matcher(phrase.trim()).replaceFirst("").trim();
		return stripped.isEmpty() ? phrase.trim() : stripped;
	}

	/**
	 * @return the first four-digit year of this century mentioned in the prompt
	 */
	static Optional<String> firstYear(String prompt) {
		Matcher matcher = YEAR.matcher(prompt);
		return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
	}
}
