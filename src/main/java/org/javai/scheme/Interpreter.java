package org.javai.scheme;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.scheme.config.InterpreterConfig;
import org.javai.scheme.config.InterpreterConfigLoader;
import org.javai.scheme.env.Environment;
import org.javai.scheme.eval.Evaluator;
import org.javai.scheme.expr.Expression;
import org.javai.scheme.expr.ExpressionPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point that owns a global environment and an evaluator.
 *
 * <p>{@link #eval} propagates failures as {@link SchemeException}s.
 * {@link #evaluate} instead logs a diagnostic and returns an
 * {@link EvaluationResult.Failure}, leaving the global environment with
 * whatever definitions completed before the failure.</p>
 *
 * <pre>{@code
 * Interpreter interpreter = Interpreter.create();
 * interpreter.eval(list(symbol("define"), symbol("x"), number(41)));
 * Expression result = interpreter.eval(list(symbol("+"), symbol("x"), number(1)));   // 42
 * }</pre>
 */
public class Interpreter {

	private static final Logger logger = LoggerFactory.getLogger(Interpreter.class);

	private final InterpreterConfig config;
	private final Environment global;
	private final Evaluator evaluator;

	public Interpreter(InterpreterConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.global = Environment.global(config.builtins().registry());
		this.evaluator = new Evaluator(config);
		logger.debug("Created interpreter with max depth {} and {} builtins",
				config.maxDepth(), config.builtins());
	}

	public static Interpreter create() {
		return new Interpreter(InterpreterConfig.defaults());
	}

	/**
	 * Creates an interpreter configured from {@value InterpreterConfigLoader#DEFAULT_RESOURCE}
	 * when present on the classpath.
	 */
	public static Interpreter fromClasspath() {
		return new Interpreter(new InterpreterConfigLoader().loadDefault());
	}

	/**
	 * Evaluates {@code expr} in the global environment.
	 *
	 * @throws SchemeException if evaluation fails
	 */
	public Expression eval(Expression expr) {
		return evaluator.eval(expr, global);
	}

	/**
	 * Evaluates {@code expr} in the global environment, reporting failure as a value.
	 */
	public EvaluationResult evaluate(Expression expr) {
		try {
			return new EvaluationResult.Success(evaluator.eval(expr, global));
		} catch (SchemeException e) {
			logger.warn("Evaluation of {} failed: {}", ExpressionPrinter.printCompact(expr), e.getMessage());
			return new EvaluationResult.Failure(e);
		}
	}

	/**
	 * Evaluates each expression in order. A failure does not stop the batch;
	 * later expressions still run against the same global environment.
	 */
	public List<EvaluationResult> evaluateAll(List<Expression> exprs) {
		List<EvaluationResult> results = new ArrayList<>();
		for (Expression expr : exprs) {
			results.add(evaluate(expr));
		}
		long failures = results.stream().filter(r -> !r.succeeded()).count();
		if (failures > 0) {
			logger.info("{} of {} expression(s) failed", failures, results.size());
		}
		return results;
	}

	public void define(String name, Expression value) {
		global.set(name, value);
	}

	/**
	 * @throws UnboundVariableException if {@code name} is not bound
	 */
	public Expression lookup(String name) {
		return global.get(name);
	}

	public Environment globalEnvironment() {
		return global;
	}

	public Evaluator evaluator() {
		return evaluator;
	}

	public InterpreterConfig config() {
		return config;
	}
}
