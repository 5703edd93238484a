package org.javai.scheme;

/**
 * Base of all failures raised while evaluating an expression. Unchecked: a
 * failure terminates the current evaluation and unwinds to the caller.
 *
 * @see Interpreter#evaluate(org.javai.scheme.expr.Expression)
 */
public class SchemeException extends RuntimeException {

	public SchemeException(String message) {
		super(message);
	}

	public SchemeException(String message, Throwable cause) {
		super(message, cause);
	}
}
