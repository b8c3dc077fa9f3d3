package io.admissionpolicy.cli.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.admissionpolicy.cli.config.ValidatorConfig;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging.*} settings of a {@link ValidatorConfig} to Logback.
 *
 * <p>
 * {@code logging.level} governs the validator's own loggers ({@value #APP_LOGGER}); every other
 * logger stays at WARN or quieter so a DEBUG run shows per-rule progress without library noise.
 * Output goes to standard error, leaving standard output to the report.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDERR";
    static final String APP_LOGGER = "io.admissionpolicy";

    /** Human-readable pattern for text mode. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{24} - %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the console appender and sets levels from {@code config}.
     *
     * @param config validated configuration; its level name is known to Logback
     */
    public static void configure(ValidatorConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level appLevel = Level.valueOf(config.loggingLevel());

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.addAppender(stderrAppender(context, encoderFor(config.loggingFormat(), context)));
        root.setLevel(appLevel.isGreaterOrEqual(Level.WARN) ? appLevel : Level.WARN);

        context.getLogger(APP_LOGGER).setLevel(appLevel);
    }

    private static Encoder<ILoggingEvent> encoderFor(String format, LoggerContext context) {
        if (ValidatorConfig.FORMAT_JSON.equals(format)) {
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

    private static ConsoleAppender<ILoggingEvent> stderrAppender(
            LoggerContext context, Encoder<ILoggingEvent> encoder) {
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }
}
