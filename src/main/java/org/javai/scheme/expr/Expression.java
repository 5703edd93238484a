package org.javai.scheme.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.scheme.NotAPairException;
import org.javai.scheme.env.Environment;

/**
 * A node of the uniform tree used for both code and data. Sealed so that the
 * set of runtime shapes is closed:
 * <ul>
 *   <li>{@link Number} - an integer value</li>
 *   <li>{@link Symbol} - an identifier</li>
 *   <li>{@link Pair} - a cons cell; proper lists end in {@link Nil}</li>
 *   <li>{@link Nil} - the empty list</li>
 *   <li>{@link Closure} - a procedure produced by {@code lambda}</li>
 *   <li>{@link Builtin} - a native procedure</li>
 *   <li>{@link Unspecified} - the result of forms that yield no usable value</li>
 * </ul>
 *
 * <p>Constructors never validate list shape; only list-consuming operations do.</p>
 */
public sealed interface Expression {

	<R> R accept(ExpressionVisitor<R> visitor);

	record Number(int value) implements Expression {
		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitNumber(value);
		}

		@Override
		public String toString() {
			return Integer.toString(value);
		}
	}

	record Symbol(String name) implements Expression {
		public Symbol {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitSymbol(name);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	record Pair(Expression car, Expression cdr) implements Expression {
		public Pair {
			Objects.requireNonNull(car, "car must not be null");
			Objects.requireNonNull(cdr, "cdr must not be null");
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitPair(car, cdr);
		}

		/**
		 * Structural equality. The cdr chain is walked iteratively so that long
		 * lists compare in constant stack; only cars are compared recursively.
		 */
		@Override
		public boolean equals(Object o) {
			Expression left = this;
			Object right = o;
			while (left instanceof Pair l && right instanceof Pair r) {
				if (l == r) {
					return true;
				}
				if (!l.car.equals(r.car)) {
					return false;
				}
				left = l.cdr;
				right = r.cdr;
			}
			if (left instanceof Pair || right instanceof Pair) {
				return false;
			}
			return left.equals(right);
		}

		@Override
		public int hashCode() {
			int hash = 1;
			Expression current = this;
			while (current instanceof Pair pair) {
				hash = 31 * hash + pair.car.hashCode();
				current = pair.cdr;
			}
			return 31 * hash + current.hashCode();
		}

		@Override
		public String toString() {
			return ExpressionPrinter.printCompact(this);
		}
	}

	/**
	 * The empty list. Use {@link Expression#nil()} rather than constructing it.
	 */
	record Nil() implements Expression {
		static final Nil INSTANCE = new Nil();

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitNil();
		}

		@Override
		public String toString() {
			return "()";
		}
	}

	/**
	 * A procedure value. The defining environment is held by reference so that
	 * later {@code define}/{@code set!} in that frame are visible to the body.
	 *
	 * @param params the parameter symbols, in binding order
	 * @param body a single body expression
	 * @param env the environment in effect where the {@code lambda} was evaluated
	 */
	record Closure(List<Symbol> params, Expression body, Environment env) implements Expression {
		public Closure {
			params = List.copyOf(params);
			Objects.requireNonNull(body, "body must not be null");
			Objects.requireNonNull(env, "env must not be null");
		}

		public int arity() {
			return params.size();
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitClosure(this);
		}

		@Override
		public boolean equals(Object o) {
			return this == o;
		}

		@Override
		public int hashCode() {
			return System.identityHashCode(this);
		}

		@Override
		public String toString() {
			return ExpressionPrinter.printCompact(this);
		}
	}

	/**
	 * A native procedure exposed under {@code name}.
	 */
	record Builtin(String name, BuiltinProcedure procedure) implements Expression {
		public Builtin {
			Objects.requireNonNull(name, "name must not be null");
			Objects.requireNonNull(procedure, "procedure must not be null");
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitBuiltin(name);
		}

		@Override
		public String toString() {
			return ExpressionPrinter.printCompact(this);
		}
	}

	record Unspecified() implements Expression {
		static final Unspecified INSTANCE = new Unspecified();

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitUnspecified();
		}

		@Override
		public String toString() {
			return ExpressionPrinter.printCompact(this);
		}
	}

	static Number number(int value) {
		return new Number(value);
	}

	static Symbol symbol(String name) {
		return new Symbol(name);
	}

	static Pair cons(Expression car, Expression cdr) {
		return new Pair(car, cdr);
	}

	static Nil nil() {
		return Nil.INSTANCE;
	}

	static Unspecified unspecified() {
		return Unspecified.INSTANCE;
	}

	/**
	 * Builds a proper list by folding {@link #cons} from the right.
	 */
	static Expression list(Expression... items) {
		return list(List.of(items));
	}

	static Expression list(List<? extends Expression> items) {
		Expression result = nil();
		for (int i = items.size() - 1; i >= 0; i--) {
			result = cons(items.get(i), result);
		}
		return result;
	}

	/**
	 * @throws NotAPairException if {@code expr} is not a {@link Pair}
	 */
	static Expression car(Expression expr) {
		if (expr instanceof Pair pair) {
			return pair.car();
		}
		throw new NotAPairException("car", expr);
	}

	/**
	 * @throws NotAPairException if {@code expr} is not a {@link Pair}
	 */
	static Expression cdr(Expression expr) {
		if (expr instanceof Pair pair) {
			return pair.cdr();
		}
		throw new NotAPairException("cdr", expr);
	}

	/**
	 * Checks whether {@code expr} is a chain of pairs terminated by {@link Nil}.
	 */
	static boolean isList(Expression expr) {
		Expression current = expr;
		while (current instanceof Pair pair) {
			current = pair.cdr();
		}
		return current instanceof Nil;
	}

	/**
	 * Flattens a proper list into a Java list.
	 *
	 * @throws NotAPairException if the chain ends in anything other than {@link Nil}
	 */
	static List<Expression> toList(Expression expr) {
		List<Expression> items = new ArrayList<>();
		Expression current = expr;
		while (current instanceof Pair pair) {
			items.add(pair.car());
			current = pair.cdr();
		}
		if (!(current instanceof Nil)) {
			throw new NotAPairException("list tail", current);
		}
		return items;
	}

	/**
	 * Short name of the variant, used in diagnostics.
	 */
	static String typeName(Expression expr) {
		return expr == null ? "null" : expr.getClass().getSimpleName().toLowerCase();
	}
}
