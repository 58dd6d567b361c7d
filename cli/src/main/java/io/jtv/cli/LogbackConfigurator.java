package io.jtv.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.jtv.cli.config.CliConfig;
import org.slf4j.LoggerFactory;

/**
 * Points Logback at standard error once the CLI configuration is known, so that standard output
 * carries only program output. JSON mode uses Logback's {@link JsonEncoder}, which includes MDC
 * fields such as {@code programId}.
 */
final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDERR";

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} [%X{programId}] - %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the root appenders with a single stderr appender.
     *
     * @param trace whether reverse-block traces are logged; they are emitted at INFO and stay visible
     *              under a quieter root level
     */
    static void configure(CliConfig config, boolean trace) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(config.loggingLevel(), Level.WARN));
        root.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder(context, config.loggingFormat()));
        appender.start();
        root.addAppender(appender);

        Logger traceLogger = context.getLogger(TraceLogListener.class);
        traceLogger.setLevel(trace && !root.isInfoEnabled() ? Level.INFO : null);
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
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
