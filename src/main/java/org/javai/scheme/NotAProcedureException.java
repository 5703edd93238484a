package org.javai.scheme;

import org.javai.scheme.expr.Expression;
import org.javai.scheme.expr.ExpressionPrinter;

/**
 * Thrown when the value in operator position is neither a closure nor a builtin.
 */
public class NotAProcedureException extends SchemeException {

	public NotAProcedureException(Expression actual) {
		super("Not a procedure: " + ExpressionPrinter.printCompact(actual));
	}

	public NotAProcedureException(String operator, Expression actual) {
		super("'" + operator + "' is not a special form and its value is not a procedure: "
				+ ExpressionPrinter.printCompact(actual));
	}
}
