package org.javai.nlq.data;

/**
 * The two value kinds the query core distinguishes.
 */
public enum ColumnKind {
	/** Non-missing values all coerce to a double. */
	NUMERIC,
	/** Anything else: free text, codes, dates. */
	CATEGORICAL
}
