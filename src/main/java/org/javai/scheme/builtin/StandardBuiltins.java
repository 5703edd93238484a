package org.javai.scheme.builtin;

import java.util.List;
import java.util.function.IntBinaryOperator;
import org.javai.scheme.ArityMismatchException;
import org.javai.scheme.DivisionByZeroException;
import org.javai.scheme.TypeMismatchException;
import org.javai.scheme.env.Environment;
import org.javai.scheme.expr.Expression;

/**
 * Implementations of the procedures in {@link BuiltinRegistry#standard()}.
 *
 * <p>Truth values are numbers: comparisons and predicates return
 * {@code 1} or {@code 0}. Integer arithmetic wraps on overflow.</p>
 */
public final class StandardBuiltins {

	private static final Expression.Number TRUE = Expression.number(1);
	private static final Expression.Number FALSE = Expression.number(0);

	private StandardBuiltins() {
		// Utility class - no instantiation
	}

	static Expression add(List<Expression> args, Environment env) {
		return Expression.number(fold("+", args, 0, Integer::sum));
	}

	static Expression multiply(List<Expression> args, Environment env) {
		return Expression.number(fold("*", args, 1, (a, b) -> a * b));
	}

	static Expression subtract(List<Expression> args, Environment env) {
		requireAtLeast("-", args, 1);
		int first = intArg("-", args, 0);
		if (args.size() == 1) {
			return Expression.number(-first);
		}
		return Expression.number(fold("-", args.subList(1, args.size()), first, (a, b) -> a - b));
	}

	static Expression divide(List<Expression> args, Environment env) {
		requireAtLeast("/", args, 2);
		int result = intArg("/", args, 0);
		for (int i = 1; i < args.size(); i++) {
			int divisor = intArg("/", args, i);
			if (divisor == 0) {
				throw new DivisionByZeroException();
			}
			result /= divisor;
		}
		return Expression.number(result);
	}

	static Expression numericEqual(List<Expression> args, Environment env) {
		return compare("=", args, (a, b) -> a == b);
	}

	static Expression lessThan(List<Expression> args, Environment env) {
		return compare("<", args, (a, b) -> a < b);
	}

	static Expression greaterThan(List<Expression> args, Environment env) {
		return compare(">", args, (a, b) -> a > b);
	}

	static Expression lessOrEqual(List<Expression> args, Environment env) {
		return compare("<=", args, (a, b) -> a <= b);
	}

	static Expression greaterOrEqual(List<Expression> args, Environment env) {
		return compare(">=", args, (a, b) -> a >= b);
	}

	static Expression not(List<Expression> args, Environment env) {
		requireExactly("not", args, 1);
		return truth(intArg("not", args, 0) == 0);
	}

	// Both operands are already evaluated: there is no short circuit.
	static Expression and(List<Expression> args, Environment env) {
		boolean result = true;
		for (int i = 0; i < args.size(); i++) {
			result &= intArg("and", args, i) != 0;
		}
		return truth(result);
	}

	static Expression or(List<Expression> args, Environment env) {
		boolean result = false;
		for (int i = 0; i < args.size(); i++) {
			result |= intArg("or", args, i) != 0;
		}
		return truth(result);
	}

	static Expression cons(List<Expression> args, Environment env) {
		requireExactly("cons", args, 2);
		return Expression.cons(args.get(0), args.get(1));
	}

	static Expression car(List<Expression> args, Environment env) {
		requireExactly("car", args, 1);
		return Expression.car(args.get(0));
	}

	static Expression cdr(List<Expression> args, Environment env) {
		requireExactly("cdr", args, 1);
		return Expression.cdr(args.get(0));
	}

	static Expression list(List<Expression> args, Environment env) {
		return Expression.list(args);
	}

	static Expression isNull(List<Expression> args, Environment env) {
		requireExactly("null?", args, 1);
		return truth(args.get(0) instanceof Expression.Nil);
	}

	static Expression isPair(List<Expression> args, Environment env) {
		requireExactly("pair?", args, 1);
		return truth(args.get(0) instanceof Expression.Pair);
	}

	static Expression isNumber(List<Expression> args, Environment env) {
		requireExactly("number?", args, 1);
		return truth(args.get(0) instanceof Expression.Number);
	}

	static Expression isSymbol(List<Expression> args, Environment env) {
		requireExactly("symbol?", args, 1);
		return truth(args.get(0) instanceof Expression.Symbol);
	}

	static Expression isProcedure(List<Expression> args, Environment env) {
		requireExactly("procedure?", args, 1);
		Expression arg = args.get(0);
		return truth(arg instanceof Expression.Closure || arg instanceof Expression.Builtin);
	}

	/**
	 * Identity, except that numbers, symbols and the empty list compare by value.
	 */
	static Expression eq(List<Expression> args, Environment env) {
		requireExactly("eq?", args, 2);
		Expression a = args.get(0);
		Expression b = args.get(1);
		if (a instanceof Expression.Number || a instanceof Expression.Symbol || a instanceof Expression.Nil) {
			return truth(a.equals(b));
		}
		return truth(a == b);
	}

	static Expression equal(List<Expression> args, Environment env) {
		requireExactly("equal?", args, 2);
		return truth(args.get(0).equals(args.get(1)));
	}

	/**
	 * Reads argument {@code index} as an integer.
	 *
	 * @throws TypeMismatchException if the argument is not a number
	 */
	public static int intArg(String procedure, List<Expression> args, int index) {
		Expression arg = args.get(index);
		if (arg instanceof Expression.Number number) {
			return number.value();
		}
		throw new TypeMismatchException(procedure, "a number", arg);
	}

	public static void requireExactly(String procedure, List<Expression> args, int count) {
		if (args.size() != count) {
			throw new ArityMismatchException(procedure, count, args.size());
		}
	}

	public static void requireAtLeast(String procedure, List<Expression> args, int count) {
		if (args.size() < count) {
			throw new ArityMismatchException(procedure, "at least " + count + " argument(s)", args.size());
		}
	}

	private static int fold(String procedure, List<Expression> args, int identity, IntBinaryOperator op) {
		int result = identity;
		for (int i = 0; i < args.size(); i++) {
			result = op.applyAsInt(result, intArg(procedure, args, i));
		}
		return result;
	}

	private static Expression compare(String procedure, List<Expression> args, IntComparison comparison) {
		requireExactly(procedure, args, 2);
		return truth(comparison.test(intArg(procedure, args, 0), intArg(procedure, args, 1)));
	}

	private static Expression truth(boolean value) {
		return value ? TRUE : FALSE;
	}

	@FunctionalInterface
	private interface IntComparison {
		boolean test(int a, int b);
	}
}
