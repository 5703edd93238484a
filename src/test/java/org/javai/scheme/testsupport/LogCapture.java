package org.javai.scheme.testsupport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;

/**
 * Log4j2 appender that records events of one logger so tests can assert on
 * diagnostics.
 * <pre>
 * try (LogCapture capture = LogCapture.of(Interpreter.class, Level.DEBUG)) {
 *     interpreter.evaluate(expr);
 *     assertThat(capture.messagesAt(Level.WARN)).anyMatch(msg -> msg.contains("Unbound"));
 * }
 * </pre>
 */
public final class LogCapture extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig loggerConfig;
	private final Level previousLevel;
	private final boolean addedLoggerConfig;
	private final List<LogEvent> events = new CopyOnWriteArrayList<>();

	private LogCapture(LoggerContext context, LoggerConfig loggerConfig, Level previousLevel, boolean addedLoggerConfig) {
		super("LogCapture-" + System.nanoTime(), null, null, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.loggerConfig = loggerConfig;
		this.previousLevel = previousLevel;
		this.addedLoggerConfig = addedLoggerConfig;
	}

	public static LogCapture of(Class<?> loggerClass, Level level) {
		String loggerName = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig loggerConfig = configuration.getLoggerConfig(loggerName);

		boolean added = false;
		if (!loggerConfig.getName().equals(loggerName)) {
			loggerConfig = new LoggerConfig(loggerName, level, true);
			configuration.addLogger(loggerName, loggerConfig);
			added = true;
		}

		LogCapture capture = new LogCapture(context, loggerConfig, loggerConfig.getLevel(), added);
		capture.start();
		loggerConfig.setLevel(level);
		loggerConfig.addAppender(capture, level, null);
		context.updateLoggers();
		return capture;
	}

	@Override
	public void append(LogEvent event) {
		events.add(event.toImmutable());
	}

	public List<String> messages() {
		return events.stream()
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	public List<String> messagesAt(Level level) {
		return events.stream()
				.filter(e -> e.getLevel() == level)
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	@Override
	public void close() {
		stop();
		loggerConfig.removeAppender(getName());
		if (addedLoggerConfig) {
			context.getConfiguration().removeLogger(loggerConfig.getName());
		} else {
			loggerConfig.setLevel(previousLevel);
		}
		context.updateLoggers();
		events.clear();
	}
}
