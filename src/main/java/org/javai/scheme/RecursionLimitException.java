package org.javai.scheme;

/**
 * Thrown when evaluation nests deeper than the configured maximum depth, or
 * when the thread stack runs out first. Evaluation is recursive without tail
 * calls, so unbounded self-recursion would otherwise surface as a
 * {@link StackOverflowError}.
 */
public class RecursionLimitException extends SchemeException {

	private final int maxDepth;

	public RecursionLimitException(int maxDepth) {
		super("Evaluation exceeded maximum depth of " + maxDepth);
		this.maxDepth = maxDepth;
	}

	/**
	 * The thread stack ran out before {@code maxDepth} was reached.
	 */
	public RecursionLimitException(int maxDepth, StackOverflowError cause) {
		super("Evaluation exhausted the thread stack before reaching maximum depth of " + maxDepth, cause);
		this.maxDepth = maxDepth;
	}

	public int maxDepth() {
		return maxDepth;
	}
}
