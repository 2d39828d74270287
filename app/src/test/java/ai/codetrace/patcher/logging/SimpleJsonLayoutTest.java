package ai.codetrace.patcher.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() throws Exception {
        LoggerContext context = new LoggerContext();
        LoggingEvent event = event(context, "hello \"world\"");

        String json = layout(context).doLayout(event);

        assertThat(json).endsWith(System.lineSeparator());
        JsonNode node = new ObjectMapper().readTree(json);
        assertThat(node.path("message").asText()).isEqualTo("hello \"world\"");
        assertThat(node.path("logger").asText()).isEqualTo("test.logger");
        assertThat(node.path("level").asText()).isEqualTo("INFO");
        assertThat(node.path("timestamp").asText()).startsWith("1970-01-01T00:00");
        assertThat(node.has("mdc")).isFalse();
        assertThat(node.has("error")).isFalse();
    }

    @Test
    void includesMdcAndThrowable() throws Exception {
        LoggerContext context = new LoggerContext();
        LoggingEvent event = event(context, "apply failed");
        event.setMDCPropertyMap(Map.of(LoggingConfigurator.FILE_KEY, "src/a.py",
                LoggingConfigurator.SYMBOL_KEY, "f"));
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("disk full")));

        JsonNode node = new ObjectMapper().readTree(layout(context).doLayout(event));

        assertThat(node.path("mdc").path("file").asText()).isEqualTo("src/a.py");
        assertThat(node.path("mdc").path("symbol").asText()).isEqualTo("f");
        assertThat(node.path("error").path("type").asText()).isEqualTo("java.lang.IllegalStateException");
        assertThat(node.path("error").path("message").asText()).isEqualTo("disk full");
        assertThat(node.path("error").path("stack").asText()).contains("disk full");
    }

    private static SimpleJsonLayout layout(LoggerContext context) {
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private static LoggingEvent event(LoggerContext context, String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLoggerContext(context);
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        return event;
    }
}
