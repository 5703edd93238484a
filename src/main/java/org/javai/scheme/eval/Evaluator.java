package org.javai.scheme.eval;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.scheme.MalformedFormException;
import org.javai.scheme.NotAProcedureException;
import org.javai.scheme.RecursionLimitException;
import org.javai.scheme.TypeMismatchException;
import org.javai.scheme.config.InterpreterConfig;
import org.javai.scheme.env.Environment;
import org.javai.scheme.expr.Expression;
import org.javai.scheme.expr.ExpressionPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive tree-walking evaluator.
 *
 * <p>Numbers, closures, builtins, the empty list and the unspecified value
 * evaluate to themselves; symbols are looked up in the environment chain;
 * a pair is either a special form (see {@link SpecialForm}) or a procedure
 * call whose operator and arguments are evaluated strictly, left to right,
 * and handed to the {@link Applier}.</p>
 *
 * <p>There are no tail calls. Nesting depth is counted and evaluation fails
 * with {@link RecursionLimitException} beyond {@link InterpreterConfig#maxDepth()};
 * iteration should go through {@code while}.</p>
 *
 * <p>An evaluator instance is not thread-safe.</p>
 */
public class Evaluator {

	private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

	private final Applier applier;
	private final int maxDepth;
	private int depth = 0;

	public Evaluator() {
		this(InterpreterConfig.defaults());
	}

	public Evaluator(InterpreterConfig config) {
		Objects.requireNonNull(config, "config must not be null");
		this.maxDepth = config.maxDepth();
		this.applier = new Applier(this);
	}

	public Applier applier() {
		return applier;
	}

	/**
	 * Evaluates {@code expr} in {@code env}.
	 *
	 * @throws org.javai.scheme.SchemeException if evaluation fails
	 */
	public Expression eval(Expression expr, Environment env) {
		Objects.requireNonNull(expr, "expr must not be null");
		Objects.requireNonNull(env, "env must not be null");
		if (depth >= maxDepth) {
			throw new RecursionLimitException(maxDepth);
		}
		boolean outermost = depth == 0;
		depth++;
		try {
			if (expr instanceof Expression.Symbol symbol) {
				return env.get(symbol.name());
			}
			if (expr instanceof Expression.Pair form) {
				return evalForm(form, env);
			}
			return expr;
		} catch (StackOverflowError e) {
			// Only the outermost call has stack left to build the exception.
			if (!outermost) {
				throw e;
			}
			logger.debug("Thread stack exhausted before maximum depth {} was reached", maxDepth);
			throw new RecursionLimitException(maxDepth, e);
		} finally {
			depth--;
		}
	}

	/**
	 * Evaluates the expressions in order and returns the last value,
	 * or the unspecified value when there are none.
	 */
	public Expression evalSequence(List<Expression> body, Environment env) {
		Expression result = Expression.unspecified();
		for (Expression expr : body) {
			result = eval(expr, env);
		}
		return result;
	}

	private Expression evalForm(Expression.Pair form, Environment env) {
		if (logger.isTraceEnabled()) {
			logger.trace("eval[{}] {}", depth, ExpressionPrinter.printCompact(form));
		}
		if (form.car() instanceof Expression.Symbol head) {
			Optional<SpecialForm> special = SpecialForm.forKeyword(head.name());
			if (special.isPresent()) {
				return evalSpecialForm(special.get(), operands(special.get(), form), env);
			}
		}
		return evalApplication(form, env);
	}

	private Expression evalApplication(Expression.Pair form, Environment env) {
		Expression operator = eval(form.car(), env);
		if (!(operator instanceof Expression.Closure) && !(operator instanceof Expression.Builtin)) {
			if (form.car() instanceof Expression.Symbol head) {
				throw new NotAProcedureException(head.name(), operator);
			}
			throw new NotAProcedureException(operator);
		}
		if (!Expression.isList(form.cdr())) {
			throw new MalformedFormException("application", "argument list is not a proper list");
		}
		List<Expression> args = new ArrayList<>();
		for (Expression operand : Expression.toList(form.cdr())) {
			args.add(eval(operand, env));
		}
		return applier.apply(operator, args, env);
	}

	private Expression evalSpecialForm(SpecialForm form, List<Expression> operands, Environment env) {
		return switch (form) {
			case QUOTE -> {
				requireOperands(form, operands, 1);
				yield operands.get(0);
			}
			case EVAL -> {
				requireOperands(form, operands, 1);
				yield eval(eval(operands.get(0), env), env);
			}
			case IF -> evalIf(operands, env);
			case DEFINE -> {
				requireOperands(form, operands, 2);
				String name = nameOperand(form, operands.get(0));
				env.set(name, eval(operands.get(1), env));
				yield Expression.unspecified();
			}
			case SET -> {
				requireOperands(form, operands, 2);
				String name = nameOperand(form, operands.get(0));
				env.mutate(name, eval(operands.get(1), env));
				yield Expression.unspecified();
			}
			case LAMBDA -> evalLambda(operands, env);
			case LET -> evalLet(operands, env);
			case BEGIN -> evalSequence(operands, env);
			case WHILE -> evalWhile(operands, env);
		};
	}

	private Expression evalIf(List<Expression> operands, Environment env) {
		requireOperands(SpecialForm.IF, operands, 3);
		Expression condition = eval(operands.get(0), env);
		if (!(condition instanceof Expression.Number number)) {
			throw new TypeMismatchException("if condition", "a number", condition);
		}
		return eval(number.value() != 0 ? operands.get(1) : operands.get(2), env);
	}

	private Expression evalLambda(List<Expression> operands, Environment env) {
		requireOperands(SpecialForm.LAMBDA, operands, 2);
		Expression paramList = operands.get(0);
		if (!Expression.isList(paramList)) {
			throw new MalformedFormException("lambda", "parameters must be a list, expected " + SpecialForm.LAMBDA.shape());
		}
		List<Expression.Symbol> params = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		for (Expression param : Expression.toList(paramList)) {
			if (!(param instanceof Expression.Symbol symbol)) {
				throw new MalformedFormException("lambda", "parameter is not a symbol: " + ExpressionPrinter.printCompact(param));
			}
			if (!seen.add(symbol.name())) {
				throw new MalformedFormException("lambda", "duplicate parameter '" + symbol.name() + "'");
			}
			params.add(symbol);
		}
		return new Expression.Closure(params, operands.get(1), env);
	}

	private Expression evalLet(List<Expression> operands, Environment env) {
		if (operands.isEmpty()) {
			throw new MalformedFormException("let", "missing bindings, expected " + SpecialForm.LET.shape());
		}
		Expression bindings = operands.get(0);
		if (!Expression.isList(bindings)) {
			throw new MalformedFormException("let", "bindings must be a list");
		}

		// Values see the outer environment only, so evaluate all before binding any.
		List<String> names = new ArrayList<>();
		List<Expression> values = new ArrayList<>();
		for (Expression binding : Expression.toList(bindings)) {
			if (!Expression.isList(binding) || Expression.toList(binding).size() != 2) {
				throw new MalformedFormException("let", "binding must be (NAME VALUE): " + ExpressionPrinter.printCompact(binding));
			}
			List<Expression> parts = Expression.toList(binding);
			String name = nameOperand(SpecialForm.LET, parts.get(0));
			if (names.contains(name)) {
				throw new MalformedFormException("let", "duplicate binding '" + name + "'");
			}
			names.add(name);
			values.add(eval(parts.get(1), env));
		}

		Environment local = Environment.childOf(env);
		for (int i = 0; i < names.size(); i++) {
			local.set(names.get(i), values.get(i));
		}
		return evalSequence(operands.subList(1, operands.size()), local);
	}

	private Expression evalWhile(List<Expression> operands, Environment env) {
		requireOperands(SpecialForm.WHILE, operands, 2);
		Expression condition = operands.get(0);
		Expression body = operands.get(1);
		while (true) {
			Expression result = eval(condition, env);
			if (result instanceof Expression.Unspecified) {
				break;
			}
			if (!(result instanceof Expression.Number number)) {
				throw new TypeMismatchException("while condition", "a number", result);
			}
			if (number.value() == 0) {
				break;
			}
			eval(body, env);
		}
		return Expression.unspecified();
	}

	private static List<Expression> operands(SpecialForm form, Expression.Pair expr) {
		if (!Expression.isList(expr.cdr())) {
			throw new MalformedFormException(form.keyword(), "operands are not a proper list");
		}
		return Expression.toList(expr.cdr());
	}

	private static void requireOperands(SpecialForm form, List<Expression> operands, int count) {
		if (operands.size() != count) {
			throw new MalformedFormException(form.keyword(),
					"expected " + form.shape() + " but got " + operands.size() + " operand(s)");
		}
	}

	private static String nameOperand(SpecialForm form, Expression operand) {
		if (operand instanceof Expression.Symbol symbol) {
			return symbol.name();
		}
		throw new MalformedFormException(form.keyword(),
				"expected a symbol but got " + ExpressionPrinter.printCompact(operand));
	}
}
