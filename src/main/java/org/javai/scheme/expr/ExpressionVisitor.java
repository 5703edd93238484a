package org.javai.scheme.expr;

/**
 * Visitor over the closed set of {@link Expression} variants.
 *
 * <p>Leaf variants hand over their payload directly; closures hand over the
 * whole node since parameters, body and environment are rarely all needed.</p>
 *
 * @param <R> the return type of the visitor operations
 */
public interface ExpressionVisitor<R> {

	R visitNumber(int value);

	R visitSymbol(String name);

	/**
	 * Visits a cons cell.
	 *
	 * @param car the head
	 * @param cdr the tail, {@link Expression.Nil} for the last cell of a proper list
	 * @return the result of visiting this node
	 */
	R visitPair(Expression car, Expression cdr);

	R visitNil();

	R visitClosure(Expression.Closure closure);

	R visitBuiltin(String name);

	R visitUnspecified();
}
