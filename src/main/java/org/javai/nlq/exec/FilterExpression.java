package org.javai.nlq.exec;

import java.util.Objects;
import java.util.Optional;
import org.javai.nlq.data.Values;

/**
 * A parsed {@code column OP value} filter.
 *
 * @param column left-hand column reference, trimmed
 * @param operator the comparison
 * @param literal right-hand side as written, trimmed
 */
public record FilterExpression(String column, FilterOperator operator, String literal) {

	public FilterExpression {
		Objects.requireNonNull(column, "column must not be null");
		Objects.requireNonNull(operator, "operator must not be null");
		Objects.requireNonNull(literal, "literal must not be null");
	}

	/**
	 * Splits a raw expression at the first operator found, scanning operators in declaration
	 * order.
	 *
	 * @return the expression, or empty when no operator is present or either side is blank
	 */
	public static Optional<FilterExpression> parse(String raw) {
		if (raw == null || raw.isBlank()) {
			return Optional.empty();
		}
		for (FilterOperator operator : FilterOperator.values()) {
			int at = raw.indexOf(operator.symbol());
			if (at < 0) {
				continue;
			}
			String column = raw.substring(0, at).trim();
			String literal = raw.substring(at + operator.symbol().length()).trim();
			if (column.isEmpty() || literal.isEmpty()) {
				return Optional.empty();
			}
			return Optional.of(new FilterExpression(column, operator, literal));
		}
		return Optional.empty();
	}

	/**
	 * @return the literal coerced to a number where it reads as one
	 */
	public Object value() {
		return Values.coerceLiteral(literal);
	}

	@Override
	public String toString() {
		return column + operator.symbol() + literal;
	}
}
