package ai.codetrace.patcher.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.codetrace.patcher.config.LogFormat;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    private final org.slf4j.Logger logger = LoggerFactory.getLogger("ai.codetrace.patcher.logging.sample");
    private CapturingAppender appender;

    @BeforeEach
    void attachAppender() {
        appender = new CapturingAppender();
        appender.setContext(context);
        appender.setName("capture");
        appender.setEncoder(LoggingConfigurator.encoderFor(LogFormat.TEXT, context));
        appender.start();
        root.addAppender(appender);
    }

    @AfterEach
    void restoreText() {
        root.detachAppender(appender);
        appender.stop();
        LoggingConfigurator.configure(LogFormat.TEXT);
        LoggingConfigurator.leaveFile();
    }

    @Test
    void fileAndSymbolKeysAreAddedAndRemoved() {
        LoggingConfigurator.enterFile("pkg/a.py");
        LoggingConfigurator.enterSymbol("f");

        assertThat(MDC.get(LoggingConfigurator.FILE_KEY)).isEqualTo("pkg/a.py");
        assertThat(MDC.get(LoggingConfigurator.SYMBOL_KEY)).isEqualTo("f");

        LoggingConfigurator.leaveSymbol();
        assertThat(MDC.get(LoggingConfigurator.SYMBOL_KEY)).isNull();
        assertThat(MDC.get(LoggingConfigurator.FILE_KEY)).isEqualTo("pkg/a.py");

        LoggingConfigurator.enterSymbol("g");
        LoggingConfigurator.leaveFile();
        assertThat(MDC.get(LoggingConfigurator.FILE_KEY)).isNull();
        assertThat(MDC.get(LoggingConfigurator.SYMBOL_KEY)).isNull();
    }

    @Test
    void textFormatPrintsFileAndSymbol() {
        LoggingConfigurator.enterFile("pkg/a.py");
        LoggingConfigurator.enterSymbol("f");

        logger.warn("rolled back");

        assertThat(appender.text()).contains("pkg/a.py f - rolled back");
    }

    @Test
    void jsonFormatReplacesTheEncoderOfRootAppenders() throws Exception {
        LoggingConfigurator.configure(LogFormat.JSON);
        LoggingConfigurator.enterFile("pkg/a.py");

        logger.warn("verification failed");

        assertThat(appender.isStarted()).isTrue();
        assertThat(appender.getEncoder()).isInstanceOfSatisfying(LayoutWrappingEncoder.class,
                encoder -> assertThat(encoder.getLayout()).isInstanceOf(SimpleJsonLayout.class));
        String[] lines = appender.text().split("\\R");
        JsonNode node = new ObjectMapper().readTree(lines[lines.length - 1]);
        assertThat(node.path("message").asText()).isEqualTo("verification failed");
        assertThat(node.path("mdc").path(LoggingConfigurator.FILE_KEY).asText()).isEqualTo("pkg/a.py");
    }

    @Test
    void textFormatRestoresThePatternEncoder() {
        LoggingConfigurator.configure(LogFormat.JSON);
        LoggingConfigurator.configure(LogFormat.TEXT);

        assertThat(appender.getEncoder()).isInstanceOfSatisfying(PatternLayoutEncoder.class,
                encoder -> assertThat(encoder.getPattern()).isEqualTo(LoggingConfigurator.TEXT_PATTERN));
    }

    /** Re-attaches the same buffer on every start, the way a console appender re-attaches stdout. */
    private static final class CapturingAppender extends OutputStreamAppender<ILoggingEvent> {

        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        @Override
        public void start() {
            setOutputStream(buffer);
            super.start();
        }

        String text() {
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }
}
