package org.javai.scheme.env;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.scheme.UnboundVariableException;
import org.javai.scheme.builtin.BuiltinRegistry;
import org.javai.scheme.expr.Expression;
import org.javai.scheme.expr.ExpressionPrinter;

/**
 * One frame of bindings linked to an optional parent frame.
 *
 * <p>Lookups and {@code set!} walk the chain outwards; {@code define} always
 * binds in this frame, so an inner definition shadows an outer one.</p>
 *
 * <h2>Creating frames</h2>
 * <ul>
 *   <li>{@link #global(BuiltinRegistry)} - a root frame with builtins installed</li>
 *   <li>{@link #empty()} - a root frame with nothing bound</li>
 *   <li>{@link #childOf(Environment)} - an empty frame for a {@code let} or a closure call</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. Frames are shared by reference between closures, so a
 * concurrent caller must synchronise around {@link #mutate} and {@link #set}.</p>
 */
public final class Environment {

	private final Environment parent;
	private final Map<String, Expression> bindings = new HashMap<>();

	private Environment(Environment parent) {
		this.parent = parent;
	}

	/**
	 * Creates a frame. A {@code null} parent yields a root frame with the
	 * standard builtins installed; otherwise the frame starts empty.
	 */
	public static Environment create(Environment parent) {
		return parent == null ? global(BuiltinRegistry.standard()) : childOf(parent);
	}

	public static Environment global(BuiltinRegistry registry) {
		Objects.requireNonNull(registry, "registry must not be null");
		Environment env = new Environment(null);
		registry.installInto(env);
		return env;
	}

	public static Environment empty() {
		return new Environment(null);
	}

	public static Environment childOf(Environment parent) {
		Objects.requireNonNull(parent, "parent must not be null");
		return new Environment(parent);
	}

	/**
	 * Binds {@code name} in this frame, replacing any existing local binding.
	 * Parent frames are never consulted.
	 */
	public void set(String name, Expression value) {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(value, "value must not be null");
		bindings.put(name, value);
	}

	/**
	 * @throws UnboundVariableException if no frame in the chain binds {@code name}
	 */
	public Expression get(String name) {
		for (Environment env = this; env != null; env = env.parent) {
			Expression value = env.bindings.get(name);
			if (value != null) {
				return value;
			}
		}
		throw new UnboundVariableException(name);
	}

	/**
	 * Overwrites the binding of {@code name} in the nearest frame that has one.
	 * Never creates a binding.
	 *
	 * @throws UnboundVariableException if no frame in the chain binds {@code name}
	 */
	public void mutate(String name, Expression value) {
		Objects.requireNonNull(value, "value must not be null");
		for (Environment env = this; env != null; env = env.parent) {
			if (env.bindings.containsKey(name)) {
				env.bindings.put(name, value);
				return;
			}
		}
		throw new UnboundVariableException(name);
	}

	public boolean isBound(String name) {
		for (Environment env = this; env != null; env = env.parent) {
			if (env.bindings.containsKey(name)) {
				return true;
			}
		}
		return false;
	}

	public boolean isBoundLocally(String name) {
		return bindings.containsKey(name);
	}

	/**
	 * @return the enclosing frame, or {@code null} for a root frame
	 */
	public Environment parent() {
		return parent;
	}

	public Set<String> localNames() {
		return Set.copyOf(bindings.keySet());
	}

	/**
	 * Dumps the chain, innermost frame first, one {@code name = value} per line.
	 */
	public String describe() {
		StringBuilder sb = new StringBuilder();
		int depth = 0;
		for (Environment env = this; env != null; env = env.parent) {
			sb.append("frame ").append(depth++).append('\n');
			Map<String, Expression> frame = env.bindings;
			frame.keySet().stream().sorted().forEach(name -> sb.append("  ")
					.append(name)
					.append(" = ")
					.append(ExpressionPrinter.printCompact(frame.get(name)))
					.append('\n'));
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return "Environment[" + bindings.size() + " binding(s)" + (parent == null ? ", root]" : "]");
	}
}
