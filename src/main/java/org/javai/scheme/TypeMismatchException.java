package org.javai.scheme;

import org.javai.scheme.expr.Expression;

/**
 * Thrown when an operand has the wrong variant, e.g. a symbol passed to {@code +}.
 */
public class TypeMismatchException extends SchemeException {

	public TypeMismatchException(String operation, String expected, Expression actual) {
		super(operation + " expects " + expected + ", got " + Expression.typeName(actual));
	}
}
