package org.javai.scheme.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders an expression in parenthesised dotted-pair notation for debugging
 * and tests. Not a stable serialization format.
 *
 * <p>In pretty mode, a list that contains a nested list is broken over several
 * lines with its elements indented; flat lists stay on one line.</p>
 */
public class ExpressionPrinter implements ExpressionVisitor<Void> {

	private final StringBuilder output = new StringBuilder();
	private int indentLevel = 0;
	private final boolean pretty;
	private final int indentSize;

	public ExpressionPrinter() {
		this(true, 2);
	}

	public ExpressionPrinter(boolean pretty, int indentSize) {
		this.pretty = pretty;
		this.indentSize = indentSize;
	}

	@Override
	public Void visitNumber(int value) {
		output.append(value);
		return null;
	}

	@Override
	public Void visitSymbol(String name) {
		output.append(name);
		return null;
	}

	@Override
	public Void visitPair(Expression car, Expression cdr) {
		List<Expression> elements = new ArrayList<>();
		elements.add(car);
		Expression tail = cdr;
		while (tail instanceof Expression.Pair pair) {
			elements.add(pair.car());
			tail = pair.cdr();
		}

		output.append('(');
		elements.get(0).accept(this);
		boolean multiline = pretty && elements.stream().anyMatch(e -> e instanceof Expression.Pair);
		if (multiline) {
			indentLevel++;
			for (Expression element : elements.subList(1, elements.size())) {
				output.append('\n');
				indent();
				element.accept(this);
			}
			indentLevel--;
		} else {
			for (Expression element : elements.subList(1, elements.size())) {
				output.append(' ');
				element.accept(this);
			}
		}
		if (!(tail instanceof Expression.Nil)) {
			output.append(" . ");
			tail.accept(this);
		}
		output.append(')');
		return null;
	}

	@Override
	public Void visitNil() {
		output.append("()");
		return null;
	}

	@Override
	public Void visitClosure(Expression.Closure closure) {
		output.append("<closure>");
		return null;
	}

	@Override
	public Void visitBuiltin(String name) {
		output.append("<builtin ").append(name).append('>');
		return null;
	}

	@Override
	public Void visitUnspecified() {
		output.append("<unspecified>");
		return null;
	}

	private void indent() {
		output.append(" ".repeat(indentLevel * indentSize));
	}

	/**
	 * Returns the rendered output as a string.
	 */
	public String toString() {
		return output.toString();
	}

	/**
	 * Renders {@code expr} in indented form.
	 */
	public static String print(Expression expr) {
		ExpressionPrinter printer = new ExpressionPrinter();
		expr.accept(printer);
		return printer.toString();
	}

	/**
	 * Renders {@code expr} on a single line.
	 */
	public static String printCompact(Expression expr) {
		ExpressionPrinter printer = new ExpressionPrinter(false, 0);
		expr.accept(printer);
		return printer.toString();
	}
}
