package org.javai.scheme.config;

import java.util.Objects;
import org.javai.scheme.builtin.BuiltinRegistry;

/**
 * Configuration for an {@link org.javai.scheme.Interpreter}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * InterpreterConfig config = InterpreterConfig.defaults();
 *
 * // Custom configuration
 * InterpreterConfig config = InterpreterConfig.builder()
 *         .maxDepth(200)
 *         .builtins(BuiltinSet.MINIMAL)
 *         .build();
 * }</pre>
 *
 * @param maxDepth maximum nesting depth of evaluation before it fails
 * @param builtins which procedures the global environment starts with
 */
public record InterpreterConfig(
		int maxDepth,
		BuiltinSet builtins
) {

	/**
	 * Default maximum evaluation depth. Comfortably inside a default-sized
	 * thread stack.
	 */
	public static final int DEFAULT_MAX_DEPTH = 1000;

	public InterpreterConfig {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive");
		}
		Objects.requireNonNull(builtins, "builtins must not be null");
	}

	public static InterpreterConfig defaults() {
		return new InterpreterConfig(DEFAULT_MAX_DEPTH, BuiltinSet.STANDARD);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Named builtin registries selectable from configuration.
	 */
	public enum BuiltinSet {
		/** Only {@code +}. */
		MINIMAL,
		/** Arithmetic, comparison, logic, pair and predicate procedures. */
		STANDARD;

		public BuiltinRegistry registry() {
			return this == MINIMAL ? BuiltinRegistry.minimal() : BuiltinRegistry.standard();
		}
	}

	/**
	 * Builder for {@link InterpreterConfig}.
	 */
	public static class Builder {
		private int maxDepth = DEFAULT_MAX_DEPTH;
		private BuiltinSet builtins = BuiltinSet.STANDARD;

		private Builder() {}

		/**
		 * Sets the maximum nesting depth of evaluation.
		 *
		 * @param maxDepth the limit (must be positive)
		 * @return this builder
		 */
		public Builder maxDepth(int maxDepth) {
			this.maxDepth = maxDepth;
			return this;
		}

		public Builder builtins(BuiltinSet builtins) {
			this.builtins = builtins;
			return this;
		}

		public InterpreterConfig build() {
			return new InterpreterConfig(maxDepth, builtins);
		}
	}
}
