package org.javai.nlq.exec;

import java.util.Optional;
import org.javai.nlq.data.Values;

/**
 * Comparison operators accepted in {@code column OP value} filters, declared in the order a
 * raw expression is scanned for them: two-character operators come before the single
 * characters they contain.
 */
public enum FilterOperator {

	EQUALS("=="),
	NOT_EQUALS("!="),
	GREATER_OR_EQUAL(">="),
	LESS_OR_EQUAL("<="),
	ASSIGN_EQUALS("="),
	GREATER_THAN(">"),
	LESS_THAN("<");

	private final String symbol;

	FilterOperator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	/**
	 * @return true for ordering comparisons, which need a numeric literal
	 */
	public boolean isNumeric() {
		return switch (this) {
			case GREATER_OR_EQUAL, LESS_OR_EQUAL, GREATER_THAN, LESS_THAN -> true;
			case EQUALS, NOT_EQUALS, ASSIGN_EQUALS -> false;
		};
	}

	/**
	 * Tests one cell against a literal already coerced with {@link Values#coerceLiteral(String)}.
	 * A cell that is missing or not numeric fails an ordering comparison; a missing cell
	 * satisfies {@link #NOT_EQUALS}.
	 */
	public boolean test(Object cell, Object literal) {
		if (!isNumeric()) {
			boolean equal = Values.scalarEquals(cell, literal);
			return this == NOT_EQUALS ? !equal : equal;
		}
		Optional<Double> left = Values.toDouble(cell);
		Optional<Double> right = Values.toDouble(literal);
		if (left.isEmpty() || right.isEmpty()) {
			return false;
		}
		int cmp = Double.compare(left.get(), right.get());
		return switch (this) {
			case GREATER_OR_EQUAL -> cmp >= 0;
			case LESS_OR_EQUAL -> cmp <= 0;
			case GREATER_THAN -> cmp > 0;
			case LESS_THAN -> cmp < 0;
			default -> throw new IllegalStateException("Not an ordering operator: " + this);
		};
	}

	@Override
	public String toString() {
		return symbol;
	}
}
