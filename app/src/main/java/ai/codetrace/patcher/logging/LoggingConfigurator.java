package ai.codetrace.patcher.logging;

import ai.codetrace.patcher.config.LogFormat;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.Iterator;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Logging setup for a run: the output format of the root logger's appenders and the MDC keys that tag
 * every line written while a file, and within it a symbol, is being processed. Both formats print the
 * same keys; text lines show them after the logger name and JSON lines under {@code mdc}.
 */
public final class LoggingConfigurator {

    public static final String FILE_KEY = "file";
    public static final String SYMBOL_KEY = "symbol";

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level [%thread] %logger{30} %X{" + FILE_KEY + "} %X{"
            + SYMBOL_KEY + "} - %msg%n";

    private LoggingConfigurator() {
    }

    /**
     * Replaces the encoder of every console or file appender attached to the root logger. Does nothing
     * when slf4j is not bound to logback.
     */
    public static void configure(LogFormat format) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        for (Iterator<Appender<ILoggingEvent>> iterator = root.iteratorForAppenders(); iterator.hasNext(); ) {
            if (iterator.next() instanceof OutputStreamAppender<ILoggingEvent> appender) {
                boolean running = appender.isStarted();
                if (running) {
                    appender.stop();
                }
                appender.setEncoder(encoderFor(format, context));
                if (running) {
                    appender.start();
                }
            }
        }
    }

    public static void enterFile(String filePath) {
        MDC.put(FILE_KEY, filePath);
    }

    public static void enterSymbol(String symbolName) {
        MDC.put(SYMBOL_KEY, symbolName);
    }

    public static void leaveSymbol() {
        MDC.remove(SYMBOL_KEY);
    }

    /** Drops both keys; pool threads are reused across files. */
    public static void leaveFile() {
        MDC.remove(FILE_KEY);
        MDC.remove(SYMBOL_KEY);
    }

    static Encoder<ILoggingEvent> encoderFor(LogFormat format, LoggerContext context) {
        Encoder<ILoggingEvent> encoder;
        if (format == LogFormat.JSON) {
            SimpleJsonLayout layout = new SimpleJsonLayout();
            layout.setContext(context);
            layout.start();
            LayoutWrappingEncoder<ILoggingEvent> wrapping = new LayoutWrappingEncoder<>();
            wrapping.setLayout(layout);
            encoder = wrapping;
        } else {
            PatternLayoutEncoder pattern = new PatternLayoutEncoder();
            pattern.setPattern(TEXT_PATTERN);
            encoder = pattern;
        }
        encoder.setContext(context);
        encoder.start();
        return encoder;
    }
}
