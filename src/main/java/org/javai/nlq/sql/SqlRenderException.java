package org.javai.nlq.sql;

/**
 * Exception thrown when a query specification cannot be shown as SQL, either because it
 * describes a parse failure or because the generated statement does not parse.
 */
public class SqlRenderException extends RuntimeException {

	public SqlRenderException(String message) {
		super(message);
	}

	public SqlRenderException(String message, Throwable cause) {
		super(message, cause);
	}
}
