package org.javai.scheme.config;

/**
 * Exception thrown when interpreter configuration cannot be read or is invalid.
 */
public class InterpreterConfigException extends RuntimeException {

	public InterpreterConfigException(String message) {
		super(message);
	}

	public InterpreterConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
