package org.javai.scheme;

/**
 * Thrown when a special form does not have the shape its keyword requires,
 * e.g. {@code (if 1 2)} or {@code (define 3 4)}.
 */
public class MalformedFormException extends SchemeException {

	public MalformedFormException(String form, String message) {
		super("Malformed " + form + ": " + message);
	}
}
