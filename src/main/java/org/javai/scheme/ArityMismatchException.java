package org.javai.scheme;

/**
 * Thrown when a procedure receives a number of arguments it cannot accept.
 */
public class ArityMismatchException extends SchemeException {

	private final int expected;
	private final int actual;

	public ArityMismatchException(String procedure, int expected, int actual) {
		super(procedure + " expects " + expected + " argument(s), got " + actual);
		this.expected = expected;
		this.actual = actual;
	}

	public ArityMismatchException(String procedure, String expectation, int actual) {
		super(procedure + " expects " + expectation + ", got " + actual);
		this.expected = -1;
		this.actual = actual;
	}

	/**
	 * The exact count expected, or -1 when the procedure accepts a range.
	 */
	public int expected() {
		return expected;
	}

	public int actual() {
		return actual;
	}
}
