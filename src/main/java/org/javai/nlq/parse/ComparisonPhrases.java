package org.javai.nlq.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts comparison phrases such as {@code "revenue greater than 1000"} or
 * {@code "region is 'North'"} from a prompt and turns each into one filter expression.
 *
 * <p>The word before the operator must resolve to a column. Values are numbers or quoted text;
 * ordering operators only accept numbers.</p>
 */
final class ComparisonPhrases {

	private static final Logger logger = LoggerFactory.getLogger(ComparisonPhrases.class);

	// Longest phrasings first, so "less than or equal to" is not read as "less than".
	private static final Map<Pattern, String> OPERATORS = operators();

	private static final Pattern COMPARISON = Pattern.compile(
			"\\b(\\w+)\\s+(?:is\\s+)?(" + String.join("|", OPERATORS.keySet().stream().map(Pattern::pattern).toList())
					+ ")\\s+('[^']*'|\"[^\"]*\"|-?\\d+(?:\\.\\d+)?)",
			Pattern.CASE_INSENSITIVE);

	private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

	private ComparisonPhrases() {
		// Utility class
	}

	private static Map<Pattern, String> operators() {
		Map<Pattern, String> operators = new LinkedHashMap<>();
		operators.put(phrase("is\\s+not"), "!=");
		operators.put(phrase("not\\s+equal(?:\\s+to)?"), "!=");
		operators.put(phrase("(?:greater|more)\\s+than\\s+or\\s+equal(?:\\s+to)?"), ">=");
		operators.put(phrase("at\\s+least"), ">=");
		operators.put(phrase("(?:less|fewer)\\s+than\\s+or\\s+equal(?:\\s+to)?"), "<=");
		operators.put(phrase("at\\s+most"), "<=");
		operators.put(phrase("greater\\s+than"), ">");
		operators.put(phrase("more\\s+than"), ">");
		operators.put(phrase("above"), ">");
		operators.put(phrase("exceeds"), ">");
		operators.put(phrase("less\\s+than"), "<");
		operators.put(phrase("fewer\\s+than"), "<");
		operators.put(phrase("below"), "<");
		operators.put(phrase("under"), "<");
		operators.put(phrase("equals"), "==");
		operators.put(phrase("equal\\s+to"), "==");
		operators.put(phrase("is"), "==");
		return operators;
	}

	private static Pattern phrase(String regex) {
		return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
	}

	/**
	 * @return one filter expression per comparison phrase whose column resolves, in prompt order
	 */
	static List<String> extract(ParseContext context) {
		List<String> filters = new ArrayList<>();
		Matcher matcher = COMPARISON.matcher(context.prompt());
		while (matcher.find()) {
			Optional<String> column = context.resolve(matcher.group(1));
			if (column.isEmpty()) {
				logger.debug("Ignoring comparison '{}': '{}' names no column", matcher.group(), matcher.group(1));
				continue;
			}
			String symbol = symbolOf(matcher.group(2));
			String value = unquote(matcher.group(3));
			if (isOrdering(symbol) && !NUMBER.matcher(value).matches()) {
				logger.debug("Ignoring comparison '{}': '{}' is not numeric", matcher.group(), value);
				continue;
			}
			String filter = column.get() + symbol + value;
			if (!filters.contains(filter)) {
				filters.add(filter);
			}
		}
		return filters;
	}

	/**
	 * Removes comparison phrases, so their numbers are not read again as years.
	 */
	static String strip(String prompt) {
		return COMPARISON.matcher(prompt).replaceAll(" ");
	}

	private static String symbolOf(String operator) {
		String normalized = operator.trim();
		for (Map.Entry<Pattern, String> entry : OPERATORS.entrySet()) {
			if (entry.getKey().matcher(normalized).matches()) {
				return entry.getValue();
			}
		}
		throw new IllegalStateException("Unmapped comparison operator: " + operator);
	}

	private static boolean isOrdering(String symbol) {
		return !symbol.equals("==") && !symbol.equals("!=");
	}

	private static String unquote(String value) {
		if (value.length() >= 2 && (value.startsWith("'") || value.startsWith("\""))) {
			return value.substring(1, value.length() - 1);
		}
		return value;
	}
}
