package io.cifxform.cli.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging.format} and {@code logging.level} settings once the command line has
 * read its configuration.
 *
 * <p>Diagnostics always go to standard error: standard output is reserved for the document or the
 * report a command produces. The {@code json} format emits one object per event for log
 * collectors; {@code text} keeps a compact line without timestamps, as a terminal user sees it.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDERR";

    /** Line layout for the {@code text} format. */
    static final String TEXT_PATTERN = "%-5level %logger{20} - %msg%n";

    private LogbackConfigurator() {}

    /**
     * Replaces the root logger's appenders with a single standard-error appender.
     *
     * @param format {@code json}, case-insensitive, or anything else for text
     * @param level level name; unrecognised names mean {@code INFO}
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.setLevel(Level.toLevel(level, Level.INFO));

        ConsoleAppender<ILoggingEvent> stderr = new ConsoleAppender<>();
        stderr.setContext(context);
        stderr.setName(APPENDER_NAME);
        stderr.setTarget("System.err");
        stderr.setEncoder(encoderFor(format, context));
        stderr.start();
        root.addAppender(stderr);
    }

    private static Encoder<ILoggingEvent> encoderFor(String format, LoggerContext context) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
