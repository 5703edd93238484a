package org.javai.scheme;

import org.javai.scheme.expr.Expression;

/**
 * Thrown when a pair accessor or list-consuming operation meets a non-pair.
 */
public class NotAPairException extends SchemeException {

	public NotAPairException(String operation, Expression actual) {
		super(operation + " expects a pair, got " + Expression.typeName(actual));
	}
}
