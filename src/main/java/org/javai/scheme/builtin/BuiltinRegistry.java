package org.javai.scheme.builtin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.scheme.env.Environment;
import org.javai.scheme.expr.BuiltinProcedure;
import org.javai.scheme.expr.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable set of native procedures, installed into root environments
 * under their names.
 *
 * <pre>{@code
 * Environment env = Environment.global(BuiltinRegistry.standard());
 *
 * BuiltinRegistry custom = BuiltinRegistry.builder()
 *         .includeAll(BuiltinRegistry.minimal())
 *         .register("double", (args, env) -> Expression.number(2 * StandardBuiltins.intArg("double", args, 0)))
 *         .build();
 * }</pre>
 */
public final class BuiltinRegistry {

	private static final Logger logger = LoggerFactory.getLogger(BuiltinRegistry.class);

	private static final BuiltinRegistry MINIMAL = builder()
			.register("+", StandardBuiltins::add)
			.build();

	private static final BuiltinRegistry STANDARD = builder()
			.register("+", StandardBuiltins::add)
			.register("-", StandardBuiltins::subtract)
			.register("*", StandardBuiltins::multiply)
			.register("/", StandardBuiltins::divide)
			.register("=", StandardBuiltins::numericEqual)
			.register("<", StandardBuiltins::lessThan)
			.register(">", StandardBuiltins::greaterThan)
			.register("<=", StandardBuiltins::lessOrEqual)
			.register(">=", StandardBuiltins::greaterOrEqual)
			.register("not", StandardBuiltins::not)
			.register("and", StandardBuiltins::and)
			.register("or", StandardBuiltins::or)
			.register("cons", StandardBuiltins::cons)
			.register("car", StandardBuiltins::car)
			.register("cdr", StandardBuiltins::cdr)
			.register("list", StandardBuiltins::list)
			.register("null?", StandardBuiltins::isNull)
			.register("pair?", StandardBuiltins::isPair)
			.register("number?", StandardBuiltins::isNumber)
			.register("symbol?", StandardBuiltins::isSymbol)
			.register("procedure?", StandardBuiltins::isProcedure)
			.register("eq?", StandardBuiltins::eq)
			.register("equal?", StandardBuiltins::equal)
			.build();

	private final Map<String, Expression.Builtin> builtins;

	private BuiltinRegistry(Map<String, Expression.Builtin> builtins) {
		this.builtins = Collections.unmodifiableMap(new LinkedHashMap<>(builtins));
	}

	/**
	 * Only {@code +}.
	 */
	public static BuiltinRegistry minimal() {
		return MINIMAL;
	}

	/**
	 * Arithmetic, comparison, logic, pair and predicate procedures.
	 */
	public static BuiltinRegistry standard() {
		return STANDARD;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Binds every procedure of this registry in {@code env}'s own frame,
	 * overwriting existing bindings of the same name.
	 */
	public void installInto(Environment env) {
		Objects.requireNonNull(env, "env must not be null");
		builtins.forEach(env::set);
		logger.debug("Installed {} builtin(s) into {}", builtins.size(), env);
	}

	public Optional<Expression.Builtin> lookup(String name) {
		return Optional.ofNullable(builtins.get(name));
	}

	public Set<String> names() {
		return builtins.keySet();
	}

	public int size() {
		return builtins.size();
	}

	/**
	 * Builder for {@link BuiltinRegistry}. A later registration of a name
	 * replaces the earlier one.
	 */
	public static class Builder {
		private final Map<String, Expression.Builtin> builtins = new LinkedHashMap<>();

		private Builder() {}

		public Builder register(String name, BuiltinProcedure procedure) {
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("Builtin name must not be blank");
			}
			builtins.put(name, new Expression.Builtin(name, procedure));
			return this;
		}

		public Builder includeAll(BuiltinRegistry other) {
			Objects.requireNonNull(other, "other must not be null");
			builtins.putAll(other.builtins);
			return this;
		}

		public BuiltinRegistry build() {
			return new BuiltinRegistry(builtins);
		}
	}
}
