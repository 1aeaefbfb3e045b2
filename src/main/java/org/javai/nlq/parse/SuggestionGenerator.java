package org.javai.nlq.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.nlq.resolve.ColumnHeuristics;

/**
 * Builds example prompts from the available columns for a prompt that could not be parsed.
 */
final class SuggestionGenerator {

	static final int MAX_SUGGESTIONS = 3;

	private SuggestionGenerator() {
		// Utility class
	}

	static List<String> suggest(List<String> columns) {
		if (columns.isEmpty()) {
			return List.of();
		}
		List<String> categorical = columns.stream().filter(ColumnHeuristics::looksCategorical).toList();
		Optional<String> numeric = columns.stream().filter(ColumnHeuristics::looksNumeric).findFirst();

		List<String> suggestions = new ArrayList<>();
		if (!categorical.isEmpty()) {
			suggestions.add("count by " + categorical.get(0));
			if (categorical.size() > 1) {
				suggestions.add("count by " + categorical.get(0) + " and " + categorical.get(1));
			}
		}
		if (numeric.isPresent() && !categorical.isEmpty()) {
			suggestions.add("total " + numeric.get() + " by " + categorical.get(0));
			suggestions.add("average of " + numeric.get() + " by " + categorical.get(0));
		} else if (numeric.isPresent()) {
			suggestions.add("average of " + numeric.get());
			suggestions.add("sum of " + numeric.get());
		}
		if (suggestions.isEmpty()) {
			suggestions.add("show top 10 " + columns.get(0));
		}
		return suggestions.subList(0, Math.min(MAX_SUGGESTIONS, suggestions.size()));
	}

	/**
	 * @return the failure message shown for a prompt no rule understood
	 */
	static String failureMessage(List<String> suggestions) {
		if (suggestions.isEmpty()) {
			return "Could not understand query";
		}
		return "Could not understand query. Try something like: \"" + suggestions.get(0) + "\"";
	}
}
