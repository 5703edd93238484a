package org.javai.scheme.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link InterpreterConfig} from YAML.
 *
 * <pre>
 * interpreter:
 *   max_depth: 500
 *   builtins: standard   # or minimal
 * </pre>
 *
 * Missing keys fall back to {@link InterpreterConfig#defaults()}.
 */
public class InterpreterConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(InterpreterConfigLoader.class);

	public static final String DEFAULT_RESOURCE = "META-INF/scheme-interpreter.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults if
	 * the resource is absent.
	 */
	public InterpreterConfig loadDefault() {
		return loadResource(DEFAULT_RESOURCE, InterpreterConfigLoader.class.getClassLoader());
	}

	public InterpreterConfig loadResource(String resourcePath, ClassLoader loader) {
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				logger.debug("No {} on classpath; using default interpreter configuration", resourcePath);
				return InterpreterConfig.defaults();
			}
			logger.debug("Loading interpreter configuration from {}", resourcePath);
			return parse(is);
		} catch (InterpreterConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new InterpreterConfigException("Failed to read interpreter configuration resource: " + resourcePath, e);
		}
	}

	public InterpreterConfig parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (InterpreterConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new InterpreterConfigException("Failed to read interpreter configuration from path: " + path, e);
		}
	}

	public InterpreterConfig parse(InputStream inputStream) {
		try {
			return buildConfig(yaml.load(inputStream));
		} catch (InterpreterConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new InterpreterConfigException("Failed to parse interpreter configuration from input stream", e);
		}
	}

	public InterpreterConfig parse(Reader reader) {
		try {
			return buildConfig(yaml.load(reader));
		} catch (InterpreterConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new InterpreterConfigException("Failed to parse interpreter configuration from reader", e);
		}
	}

	public InterpreterConfig parseString(String yamlContent) {
		try {
			return buildConfig(yaml.load(yamlContent));
		} catch (InterpreterConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new InterpreterConfigException("Failed to parse interpreter configuration from string", e);
		}
	}

	private InterpreterConfig buildConfig(Object data) {
		InterpreterConfig.Builder builder = InterpreterConfig.builder();
		if (data == null) {
			return builder.build();
		}
		if (!(data instanceof Map<?, ?> root)) {
			throw new InterpreterConfigException("Configuration root must be a mapping");
		}
		Object section = root.get("interpreter");
		if (section == null) {
			return builder.build();
		}
		if (!(section instanceof Map<?, ?> interpreter)) {
			throw new InterpreterConfigException("'interpreter' must be a mapping");
		}

		Object maxDepth = interpreter.get("max_depth");
		if (maxDepth != null) {
			if (!(maxDepth instanceof Integer depth)) {
				throw new InterpreterConfigException("'max_depth' must be an integer, got: " + maxDepth);
			}
			builder.maxDepth(depth);
		}

		Object builtins = interpreter.get("builtins");
		if (builtins != null) {
			try {
				builder.builtins(InterpreterConfig.BuiltinSet.valueOf(builtins.toString().toUpperCase(Locale.ROOT)));
			} catch (IllegalArgumentException e) {
				throw new InterpreterConfigException("Unknown builtin set: " + builtins, e);
			}
		}

		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new InterpreterConfigException("Invalid interpreter configuration: " + e.getMessage(), e);
		}
	}
}
