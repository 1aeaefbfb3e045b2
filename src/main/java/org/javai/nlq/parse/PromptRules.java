package org.javai.nlq.parse;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import org.javai.nlq.spec.Aggregation;
import org.javai.nlq.spec.TaskType;

/**
 * The built-in rule list, most specific first.
 *
 * <p>Order is a precedence policy: {@code "count orders by region"} would also satisfy the
 * aggregate-by and simple-aggregate rules, and must be read as a grouped count.</p>
 */
public final class PromptRules {

	/** Default row limit for ranking prompts. */
	public static final int DEFAULT_TOP_N = 10;

	private static final String BY = "(?:grouped\\s+by|group\\s+by|by|per)";
	private static final String AGG_VERB = "(sum|total|average|avg|mean|count|minimum|maximum|min|max|median)";

	private PromptRules() {
		// Utility class
	}

	/**
	 * @return the ordered rules evaluated before the token-scan fallback
	 */
	public static List<PromptRule> defaults() {
		return List.of(
				PromptRule.of("count_by",
						"\\b(?:count(?:\\s+of)?|number\\s+of|total\\s+of)\\s+(?:(\\w+)\\s+)?" + BY + "\\s+([\\w\\s,]+)",
						PromptRules::countBy),
				PromptRule.of("aggregate_by",
						"\\b" + AGG_VERB + "\\s+(?:of\\s+)?([\\w\\s]+?)\\s+" + BY + "\\s+([\\w\\s,]+)",
						PromptRules::aggregateBy),
				PromptRule.of("top_n",
						"\\b(top|bottom|best|worst|highest|lowest)\\s+(\\d+)\\s+(?:of\\s+)?([\\w\\s-]+)",
						PromptRules::topN),
				PromptRule.of("rank",
						"\\b(?:rank|order|sort)\\s+(?:of\\s+)?([\\w\\s]+?)\\s+(?:by|per|according\\s+to|on)\\s+([\\w\\s]+)",
						PromptRules::rank),
				PromptRule.of("simple_aggregate",
						"\\b" + AGG_VERB + "\\s+(?:of\\s+)?([\\w\\s]+)",
						PromptRules::simpleAggregate),
				PromptRule.of("show_by",
						"\\b(?:show|display|list)\\s+(?:me\\s+)?(?:the\\s+)?([\\w\\s]+?)\\s+" + BY + "\\s+([\\w\\s,]+)",
						PromptRules::showBy),
				PromptRule.of("distribution",
						"\\b(?:distribution|breakdown)\\s+(?:of\\s+)?([\\w\\s]+)",
						PromptRules::distribution),
				PromptRule.of("trend",
						"\\b(?:trends?|over\\s+time|time\\s+series|monthly|by\\s+month|per\\s+month|month\\s+over\\s+month)\\b",
						PromptRules::trend));
	}

	static Optional<SpecDraft> countBy(Matcher m, ParseContext context) {
		SpecDraft draft = context.draft("count_by", 0.95);
		bindDimensions(draft, context, m.group(2), 0.4);
		String entity = m.group(1);
		if (entity != null) {
			context.resolve(entity).ifPresent(col -> draft.bindMetric(col, 0.3));
		}
		return accept(draft.task(TaskType.GROUP_COUNT).agg(Aggregation.COUNT).countRowsIfNoMetric());
	}

	static Optional<SpecDraft> aggregateBy(Matcher m, ParseContext context) {
		SpecDraft draft = context.draft("aggregate_by", 0.95);
		context.resolve(m.group(2)).ifPresent(col -> draft.bindMetric(col, 0.4));
		bindDimensions(draft, context, m.group(3), 0.4);
		Aggregation agg = Aggregation.fromVerb(m.group(1)).orElse(Aggregation.SUM);
		return accept(draft.task(TaskType.AGGREGATE_BY).agg(agg));
	}

	static Optional<SpecDraft> topN(Matcher m, ParseContext context) {
		SpecDraft draft = context.draft("top_n", 0.9);
		String direction = m.group(1).toLowerCase();
		draft.ascending(direction.equals("bottom") || direction.equals("worst") || direction.equals("lowest"));
		draft.topN(parseCount(m.group(2)));

		String[] entityAndMetric = PromptTokens.splitOnBy(m.group(3));
		if (entityAndMetric[1] != null) {
			context.resolve(entityAndMetric[0]).ifPresent(col -> draft.bindDimension(col, 0.4));
			context.resolve(entityAndMetric[1]).ifPresent(col -> draft.bindMetric(col, 0.4));
		} else {
			// "top 5 dealer sales": only the first word names the entity
			String entity = entityAndMetric[0].split("\\s+")[0];
			context.resolve(entity).ifPresent(col -> draft.bindDimension(col, 0.4));
			inferMetric(draft, context);
		}
		return accept(draft.task(TaskType.RANK));
	}

	static Optional<SpecDraft> rank(Matcher m, ParseContext context) {
		SpecDraft draft = context.draft("rank", 0.95);
		context.resolve(m.group(1)).ifPresent(col -> draft.bindDimension(col, 0.4));
		context.resolve(m.group(2)).ifPresent(col -> draft.bindMetric(col, 0.4));
		return accept(draft.task(TaskType.RANK).agg(Aggregation.SUM).topN(DEFAULT_TOP_N));
	}

	static Optional<SpecDraft> simpleAggregate(Matcher m, ParseContext context) {
		SpecDraft draft = context.draft("simple_aggregate", 0.95);
		context.resolve(m.group(2)).ifPresent(col -> draft.bindMetric(col, 0.5));
		Aggregation agg = Aggregation.fromVerb(m.group(1)).orElse(Aggregation.SUM);
		return accept(draft.task(TaskType.AGGREGATE).agg(agg));
	}

	static Optional<SpecDraft> showBy(Matcher m, ParseContext context) {
		SpecDraft draft = context.draft("show_by", 0.9);
		context.resolve(m.group(1)).ifPresent(col -> draft.bindMetric(col, 0.3));
		bindDimensions(draft, context, m.group(2), 0.3);
		return accept(draft.task(TaskType.GROUP_BY));
	}

	static Optional<SpecDraft> distribution(Matcher m, ParseContext context) {
		SpecDraft draft = context.draft("distribution", 0.6);
		String[] subjectAndGroup = PromptTokens.splitOnBy(m.group(1));
		context.resolve(subjectAndGroup[0]).ifPresent(col -> draft.bindClassified(col, 0.4));
		if (subjectAndGroup[1] != null) {
			context.resolve(subjectAndGroup[1]).ifPresent(col -> draft.bindDimension(col, 0.3));
		}
		return accept(draft.inferTaskFromBindings());
	}

	static Optional<SpecDraft> trend(Matcher m, ParseContext context) {
		Optional<String> timeColumn = context.timeColumn();
		if (timeColumn.isEmpty()) {
			return Optional.empty();
		}
		SpecDraft draft = context.draft("trend", 0.85);
		draft.bindOther("time", timeColumn.get(), 0.3);
		for (String word : PromptTokens.contentWords(context.prompt())) {
			context.resolve(word)
					.filter(col -> !col.equals(timeColumn.get()))
					.filter(col -> context.classify(col) == ParseContext.Role.METRIC)
					.ifPresent(col -> draft.bindMetric(col, 0.3));
		}
		return accept(draft.task(TaskType.TREND).agg(Aggregation.SUM));
	}

	/**
	 * Fallback used when no rule accepted the prompt: every content word is resolved
	 * independently and classified by name.
	 */
	static Optional<SpecDraft> tokenScan(ParseContext context) {
		SpecDraft draft = context.draft("token_scan", 0.6);
		for (String word : PromptTokens.contentWords(context.prompt())) {
			context.resolve(word).ifPresent(col -> draft.bindClassified(col, 0.3));
		}
		return accept(draft.inferTaskFromBindings());
	}

	private static void bindDimensions(SpecDraft draft, ParseContext context, String phrase, double weight) {
		List<String> items = PromptTokens.listItems(phrase);
		for (String item : items.subList(0, Math.min(2, items.size()))) {
			context.resolve(item).ifPresent(col -> draft.bindDimension(col, weight));
		}
	}

	private static void inferMetric(SpecDraft draft, ParseContext context) {
		for (String word : PromptTokens.contentWords(context.prompt())) {
			Optional<String> column = context.resolve(word).filter(col -> !draft.isDimension(col));
			if (column.isPresent()) {
				draft.bindMetric(column.get(), 0.2);
				return;
			}
		}
	}

	private static Integer parseCount(String digits) {
		try {
			int n = Integer.parseInt(digits);
			return n > 0 ? n : DEFAULT_TOP_N;
		} catch (NumberFormatException e) {
			return DEFAULT_TOP_N;
		}
	}

	private static Optional<SpecDraft> accept(SpecDraft draft) {
		return draft.hasBindings() ? Optional.of(draft) : Optional.empty();
	}
}
