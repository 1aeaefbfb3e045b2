package org.javai.nlq.parse;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One entry of the parser's ordered rule list: a syntactic pattern and the handler that turns
 * its match into a specification draft.
 *
 * <p>A handler may decline a match by returning an empty draft, typically because none of the
 * phrases it captured resolved to a column. The parser then moves on to the next rule.</p>
 *
 * @param name short rule name recorded in the specification's audit trail
 * @param pattern the pattern searched for anywhere in the prompt
 * @param handler builds the draft from the match
 */
public record PromptRule(String name, Pattern pattern, Handler handler) {

	@FunctionalInterface
	public interface Handler {
		Optional<SpecDraft> handle(Matcher match, ParseContext context);
	}

	public PromptRule {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(pattern, "pattern must not be null");
		Objects.requireNonNull(handler, "handler must not be null");
	}

	/**
	 * Convenience factory compiling a case-insensitive pattern.
	 */
	public static PromptRule of(String name, String regex, Handler handler) {
		return new PromptRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), handler);
	}

	/**
	 * @return a draft when the pattern occurs in the prompt and the handler accepts it
	 */
	public Optional<SpecDraft> apply(ParseContext context) {
		Matcher matcher = pattern.matcher(context.prompt());
		if (!matcher.find()) {
			return Optional.empty();
		}
		return handler.handle(matcher, context);
	}
}
