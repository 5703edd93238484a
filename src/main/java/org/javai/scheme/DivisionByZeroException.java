package org.javai.scheme;

public class DivisionByZeroException extends SchemeException {

	public DivisionByZeroException() {
		super("Division by zero");
	}
}
