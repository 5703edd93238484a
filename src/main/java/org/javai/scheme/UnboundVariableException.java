package org.javai.scheme;

/**
 * Thrown when no frame in an environment chain binds a name.
 */
public class UnboundVariableException extends SchemeException {

	private final String name;

	public UnboundVariableException(String name) {
		super("Unbound variable '" + name + "'");
		this.name = name;
	}

	public String name() {
		return name;
	}
}
