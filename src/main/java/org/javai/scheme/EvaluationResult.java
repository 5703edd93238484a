package org.javai.scheme;

import java.util.Objects;
import org.javai.scheme.expr.Expression;

/**
 * Outcome of evaluating one top-level expression through {@link Interpreter#evaluate}.
 */
public sealed interface EvaluationResult {

	boolean succeeded();

	/**
	 * @param value the value of the expression
	 */
	record Success(Expression value) implements EvaluationResult {
		public Success {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public boolean succeeded() {
			return true;
		}
	}

	/**
	 * @param error the failure that terminated evaluation
	 */
	record Failure(SchemeException error) implements EvaluationResult {
		public Failure {
			Objects.requireNonNull(error, "error must not be null");
		}

		@Override
		public boolean succeeded() {
			return false;
		}

		public String message() {
			return error.getMessage();
		}
	}
}
