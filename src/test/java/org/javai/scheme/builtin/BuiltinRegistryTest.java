package org.javai.scheme.builtin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.scheme.expr.Expression.number;
import java.util.List;
import org.javai.scheme.env.Environment;
import org.javai.scheme.expr.Expression;
import org.junit.jupiter.api.Test;

class BuiltinRegistryTest {

	@Test
	void minimalRegistryHasOnlyAddition() {
		assertThat(BuiltinRegistry.minimal().names()).containsExactly("+");
	}

	@Test
	void standardRegistryCoversArithmeticPairsAndPredicates() {
		assertThat(BuiltinRegistry.standard().names()).contains(
				"+", "-", "*", "/", "=", "<", ">", "<=", ">=",
				"not", "and", "or",
				"cons", "car", "cdr", "list",
				"null?", "pair?", "number?", "symbol?", "procedure?", "eq?", "equal?");
	}

	@Test
	void lookupReturnsNamedBuiltin() {
		Expression.Builtin plus = BuiltinRegistry.standard().lookup("+").orElseThrow();

		assertThat(plus.name()).isEqualTo("+");
		assertThat(plus.procedure().apply(List.of(number(2), number(3)), Environment.empty())).isEqualTo(number(5));
		assertThat(BuiltinRegistry.standard().lookup("nope")).isEmpty();
	}

	@Test
	void installIntoBindsEveryBuiltinLocally() {
		Environment env = Environment.empty();

		BuiltinRegistry.standard().installInto(env);

		assertThat(env.localNames()).hasSize(BuiltinRegistry.standard().size());
		assertThat(env.get("car")).isSameAs(BuiltinRegistry.standard().lookup("car").orElseThrow());
	}

	@Test
	void builderRegistersCustomProcedures() {
		BuiltinRegistry registry = BuiltinRegistry.builder()
				.includeAll(BuiltinRegistry.minimal())
				.register("double", (args, env) -> number(2 * StandardBuiltins.intArg("double", args, 0)))
				.build();

		Expression.Builtin twice = registry.lookup("double").orElseThrow();

		assertThat(registry.names()).containsExactly("+", "double");
		assertThat(twice.procedure().apply(List.of(number(21)), Environment.empty())).isEqualTo(number(42));
	}

	@Test
	void laterRegistrationReplacesEarlier() {
		BuiltinRegistry registry = BuiltinRegistry.builder()
				.includeAll(BuiltinRegistry.standard())
				.register("+", (args, env) -> number(-1))
				.build();

		assertThat(registry.lookup("+").orElseThrow().procedure().apply(List.of(), Environment.empty()))
				.isEqualTo(number(-1));
		assertThat(BuiltinRegistry.standard().lookup("+").orElseThrow().procedure().apply(List.of(), Environment.empty()))
				.isEqualTo(number(0));
	}

	@Test
	void blankNameIsRejected() {
		assertThatThrownBy(() -> BuiltinRegistry.builder().register(" ", (args, env) -> number(0)))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void registryIsImmutable() {
		assertThatThrownBy(() -> BuiltinRegistry.minimal().names().add("x"))
				.isInstanceOf(UnsupportedOperationException.class);
	}
}
