package io.symdiff.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import io.symdiff.cli.config.CliConfig;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging} section of a {@link CliConfig} to Logback.
 *
 * <p>{@code logging.level} is the one level of the invocation: it is set on the root logger and
 * every other logger inherits it, whatever {@code logback.xml} declared. Output goes to a single
 * console appender on {@code System.err}, so standard output carries nothing but results.
 * {@code logging.format: json} uses Logback's built-in {@link JsonEncoder}.
 */
public final class LogbackConfigurator {

    /** Human-readable pattern for text mode. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    static final String APPENDER_NAME = "STDERR";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Reconfigures the logger context for one invocation.
     *
     * @param config resolved configuration; its level and format are already validated
     * @throws IllegalArgumentException if the level is not a Logback level name
     */
    public static void configure(CliConfig config) {
        Level level = Level.toLevel(config.loggingLevel(), null);
        if (level == null) {
            throw new IllegalArgumentException("Unknown logging level: '" + config.loggingLevel() + "'");
        }

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        for (Logger logger : context.getLoggerList()) {
            if (logger != rootLogger) {
                logger.setLevel(null);
            }
        }
        rootLogger.setLevel(level);
        rootLogger.detachAndStopAllAppenders();
        rootLogger.addAppender(stderrAppender(context, "json".equals(config.loggingFormat())));
    }

    private static ConsoleAppender<ILoggingEvent> stderrAppender(LoggerContext context, boolean json) {
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");

        if (json) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            appender.setEncoder(encoder);
        } else {
            PatternLayoutEncoder encoder = new PatternLayoutEncoder();
            encoder.setContext(context);
            encoder.setPattern(TEXT_PATTERN);
            encoder.start();
            appender.setEncoder(encoder);
        }

        appender.start();
        return appender;
    }
}
