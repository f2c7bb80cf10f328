package org.javai.sexpr.config;

/**
 * Exception thrown when a reader options document cannot be loaded or is invalid.
 */
public class ReaderOptionsParseException extends RuntimeException {

	public ReaderOptionsParseException(String message) {
		super(message);
	}

	public ReaderOptionsParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
