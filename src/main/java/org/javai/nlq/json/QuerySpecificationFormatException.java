package org.javai.nlq.json;

/**
 * Exception thrown when JSON cannot be read as a query specification.
 *
 * <p>This exception is thrown when:</p>
 * <ul>
 *   <li>the text is not well-formed JSON</li>
 *   <li>the document is not an object or lacks a {@code task}</li>
 *   <li>a task or aggregation name is unknown</li>
 *   <li>the values violate the specification's own invariants</li>
 * </ul>
 */
public class QuerySpecificationFormatException extends RuntimeException {

	public QuerySpecificationFormatException(String message) {
		super(message);
	}

	public QuerySpecificationFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
