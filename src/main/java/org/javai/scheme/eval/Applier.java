package org.javai.scheme.eval;

import java.util.List;
import java.util.Objects;
import org.javai.scheme.ArityMismatchException;
import org.javai.scheme.NotAProcedureException;
import org.javai.scheme.env.Environment;
import org.javai.scheme.expr.Expression;

/**
 * Applies a procedure value to already evaluated arguments.
 *
 * <p>A closure runs in a fresh child of its <em>defining</em> environment,
 * never of the caller's, which is what makes scoping lexical. A builtin
 * receives the arguments and the caller's environment directly.</p>
 */
public class Applier {

	private final Evaluator evaluator;

	Applier(Evaluator evaluator) {
		this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
	}

	/**
	 * @param proc a {@link Expression.Closure} or {@link Expression.Builtin}
	 * @param args the evaluated arguments, in call order
	 * @param env the caller's environment, passed on to builtins
	 * @throws NotAProcedureException if {@code proc} is not callable
	 * @throws ArityMismatchException if a closure gets the wrong number of arguments
	 */
	public Expression apply(Expression proc, List<Expression> args, Environment env) {
		Objects.requireNonNull(args, "args must not be null");
		if (proc instanceof Expression.Builtin builtin) {
			return builtin.procedure().apply(List.copyOf(args), env);
		}
		if (proc instanceof Expression.Closure closure) {
			return applyClosure(closure, args);
		}
		throw new NotAProcedureException(proc);
	}

	private Expression applyClosure(Expression.Closure closure, List<Expression> args) {
		if (args.size() != closure.arity()) {
			throw new ArityMismatchException("closure", closure.arity(), args.size());
		}
		Environment local = Environment.childOf(closure.env());
		for (int i = 0; i < args.size(); i++) {
			local.set(closure.params().get(i).name(), args.get(i));
		}
		return evaluator.eval(closure.body(), local);
	}
}
