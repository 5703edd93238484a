package org.javai.scheme.expr;

import java.util.List;
import org.javai.scheme.env.Environment;

/**
 * Host-level implementation behind a {@link Expression.Builtin}.
 * Arguments arrive already evaluated, left to right.
 */
@FunctionalInterface
public interface BuiltinProcedure {

	Expression apply(List<Expression> args, Environment env);
}
