package org.javai.nlq.domain;

/**
 * Thrown when a domain vocabulary document cannot be read or has the wrong shape.
 */
public class DomainVocabularyException extends RuntimeException {

	public DomainVocabularyException(String message) {
		super(message);
	}

	public DomainVocabularyException(String message, Throwable cause) {
		super(message, cause);
	}
}
