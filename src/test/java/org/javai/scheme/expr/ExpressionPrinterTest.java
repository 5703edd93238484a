package org.javai.scheme.expr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.scheme.expr.Expression.cons;
import static org.javai.scheme.expr.Expression.list;
import static org.javai.scheme.expr.Expression.nil;
import static org.javai.scheme.expr.Expression.number;
import static org.javai.scheme.expr.Expression.symbol;
import java.util.List;
import org.javai.scheme.builtin.BuiltinRegistry;
import org.javai.scheme.env.Environment;
import org.junit.jupiter.api.Test;

class ExpressionPrinterTest {

	@Test
	void printsAtoms() {
		assertThat(ExpressionPrinter.printCompact(number(-17))).isEqualTo("-17");
		assertThat(ExpressionPrinter.printCompact(symbol("set!"))).isEqualTo("set!");
		assertThat(ExpressionPrinter.printCompact(nil())).isEqualTo("()");
		assertThat(ExpressionPrinter.printCompact(Expression.unspecified())).isEqualTo("<unspecified>");
	}

	@Test
	void printsProperList() {
		Expression expr = list(symbol("+"), number(1), list(symbol("*"), number(2), number(3)));

		assertThat(ExpressionPrinter.printCompact(expr)).isEqualTo("(+ 1 (* 2 3))");
	}

	@Test
	void printsDottedPair() {
		assertThat(ExpressionPrinter.printCompact(cons(number(1), number(2)))).isEqualTo("(1 . 2)");
		assertThat(ExpressionPrinter.printCompact(cons(number(1), cons(number(2), number(3)))))
				.isEqualTo("(1 2 . 3)");
	}

	@Test
	void printsProceduresAsPlaceholders() {
		Expression.Closure closure = new Expression.Closure(List.of(), number(1), Environment.empty());
		Expression.Builtin plus = BuiltinRegistry.minimal().lookup("+").orElseThrow();

		assertThat(ExpressionPrinter.printCompact(closure)).isEqualTo("<closure>");
		assertThat(ExpressionPrinter.printCompact(plus)).isEqualTo("<builtin +>");
		assertThat(ExpressionPrinter.printCompact(list(plus, closure))).isEqualTo("(<builtin +> <closure>)");
	}

	@Test
	void prettyModeBreaksNestedLists() {
		Expression expr = list(symbol("begin"),
				list(symbol("define"), symbol("x"), number(1)),
				symbol("x"));

		assertThat(ExpressionPrinter.print(expr)).isEqualTo("""
				(begin
				  (define x 1)
				  x)""");
	}

	@Test
	void prettyModeKeepsFlatListsOnOneLine() {
		assertThat(ExpressionPrinter.print(list(number(1), number(2)))).isEqualTo("(1 2)");
	}

	@Test
	void toStringOfPairUsesCompactForm() {
		assertThat(list(symbol("quote"), symbol("a")).toString()).isEqualTo("(quote a)");
	}
}
