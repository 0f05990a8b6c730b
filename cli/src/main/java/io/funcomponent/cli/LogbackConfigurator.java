package io.funcomponent.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.EncoderBase;
import ch.qos.logback.core.joran.spi.ConsoleTarget;
import io.funcomponent.cli.config.CompilerConfig;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging} section of a {@link CompilerConfig} to Logback.
 *
 * <p>Every log line goes to stderr. Stdout is reserved for the component YAML, so
 * {@code compile fn.yaml > component.yaml} never mixes the two. The configured level applies to
 * the compiler's own loggers; third-party loggers stay at WARN unless the configured level is
 * stricter.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDERR";

    /** Human-readable pattern for text mode. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    static final String COMPILER_LOGGER = "io.funcomponent";

    private LogbackConfigurator() {
        // utility class
    }

    /** Replaces the root appenders with a single stderr appender in the configured format. */
    public static void configure(CompilerConfig config) {
        configure(config.loggingFormat(), config.loggingLevel());
    }

    /**
     * @param format "json" for one JSON object per event, anything else for {@link #TEXT_PATTERN}
     * @param level  level of the compiler's loggers, INFO if unparseable
     */
    static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level compilerLevel = Level.toLevel(level, Level.INFO);

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.setLevel(compilerLevel.isGreaterOrEqual(Level.WARN) ? compilerLevel : Level.WARN);
        context.getLogger(COMPILER_LOGGER).setLevel(compilerLevel);
        root.addAppender(stderrAppender(context, encoder(context, format)));
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        EncoderBase<ILoggingEvent> encoder;
        if ("json".equalsIgnoreCase(format)) {
            encoder = new JsonEncoder();
        } else {
            PatternLayoutEncoder patternEncoder = new PatternLayoutEncoder();
            patternEncoder.setPattern(TEXT_PATTERN);
            encoder = patternEncoder;
        }
        encoder.setContext(context);
        encoder.start();
        return encoder;
    }

    private static ConsoleAppender<ILoggingEvent> stderrAppender(
            LoggerContext context, Encoder<ILoggingEvent> encoder) {
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget(ConsoleTarget.SystemErr.getName());
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }
}
