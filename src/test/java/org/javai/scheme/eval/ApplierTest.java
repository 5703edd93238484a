package org.javai.scheme.eval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.scheme.expr.Expression.list;
import static org.javai.scheme.expr.Expression.number;
import static org.javai.scheme.expr.Expression.symbol;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.util.List;
import org.javai.scheme.ArityMismatchException;
import org.javai.scheme.NotAProcedureException;
import org.javai.scheme.UnboundVariableException;
import org.javai.scheme.builtin.BuiltinRegistry;
import org.javai.scheme.env.Environment;
import org.javai.scheme.expr.BuiltinProcedure;
import org.javai.scheme.expr.Expression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ApplierTest {

	@Mock
	private BuiltinProcedure procedure;

	private Evaluator evaluator;
	private Applier applier;
	private Environment env;

	@BeforeEach
	void setUp() {
		evaluator = new Evaluator();
		applier = evaluator.applier();
		env = Environment.create(null);
	}

	@Test
	void builtinReceivesArgumentsAndCallerEnvironment() {
		when(procedure.apply(anyList(), any(Environment.class))).thenReturn(number(99));
		Expression.Builtin builtin = new Expression.Builtin("probe", procedure);

		Expression result = applier.apply(builtin, List.of(number(1), symbol("a")), env);

		assertThat(result).isEqualTo(number(99));
		verify(procedure).apply(List.of(number(1), symbol("a")), env);
	}

	@Test
	void builtinCallArgumentsArriveInSourceOrder() {
		when(procedure.apply(anyList(), any(Environment.class))).thenReturn(number(0));
		env.set("probe", new Expression.Builtin("probe", procedure));
		env.set("x", number(7));

		evaluator.eval(list(symbol("probe"), symbol("x"), list(symbol("+"), number(1), number(2)), number(3)), env);

		verify(procedure).apply(List.of(number(7), number(3), number(3)), env);
	}

	@Test
	void argumentsAreEvaluatedBeforeBuiltinRuns() {
		env.set("probe", new Expression.Builtin("probe", procedure));

		assertThatThrownBy(() -> evaluator.eval(list(symbol("probe"), symbol("missing")), env))
				.isInstanceOf(UnboundVariableException.class);
		verify(procedure, never()).apply(anyList(), any(Environment.class));
	}

	@Test
	void closureRunsInChildOfDefiningEnvironment() {
		Environment defining = Environment.empty();
		defining.set("base", number(100));
		Expression.Closure closure = new Expression.Closure(
				List.of(symbol("x")),
				list(symbol("+"), symbol("x"), symbol("base")),
				Environment.childOf(Environment.global(BuiltinRegistry.minimal())));
		Expression.Closure readsBase = new Expression.Closure(List.of(), symbol("base"), defining);

		Environment caller = Environment.create(null);
		caller.set("base", number(-1));

		assertThat(applier.apply(readsBase, List.of(), caller)).isEqualTo(number(100));
		assertThatThrownBy(() -> applier.apply(closure, List.of(number(1)), caller))
				.isInstanceOf(UnboundVariableException.class)
				.hasMessageContaining("base");
	}

	@Test
	void closureBindsParametersInOrder() {
		Expression.Closure closure = new Expression.Closure(
				List.of(symbol("a"), symbol("b")),
				list(symbol("-"), symbol("a"), symbol("b")),
				env);

		assertThat(applier.apply(closure, List.of(number(10), number(3)), env)).isEqualTo(number(7));
	}

	@Test
	void closureApplicationDoesNotLeakParameters() {
		Expression.Closure closure = new Expression.Closure(List.of(symbol("p")), symbol("p"), env);

		applier.apply(closure, List.of(number(1)), env);

		assertThat(env.isBound("p")).isFalse();
	}

	@Test
	void closureArityIsChecked() {
		Expression.Closure closure = new Expression.Closure(List.of(symbol("x")), symbol("x"), env);

		assertThatThrownBy(() -> applier.apply(closure, List.of(), env))
				.isInstanceOf(ArityMismatchException.class)
				.hasMessageContaining("expects 1 argument(s), got 0");
		assertThatThrownBy(() -> applier.apply(closure, List.of(number(1), number(2)), env))
				.isInstanceOf(ArityMismatchException.class);
	}

	@Test
	void nonProcedureIsRejected() {
		assertThatThrownBy(() -> applier.apply(number(3), List.of(), env))
				.isInstanceOf(NotAProcedureException.class)
				.hasMessageContaining("3");
		assertThatThrownBy(() -> applier.apply(list(symbol("lambda")), List.of(), env))
				.isInstanceOf(NotAProcedureException.class);
	}
}
