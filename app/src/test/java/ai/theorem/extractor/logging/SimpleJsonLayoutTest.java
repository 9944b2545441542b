package ai.theorem.extractor.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    private LoggerContext context;
    private SimpleJsonLayout layout;

    @BeforeEach
    void setUp() {
        context = new LoggerContext();
        context.start();
        layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
    }

    @Test
    void formatsEventAsJson() {
        String json = layout.doLayout(event("hello world"));

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"hello world\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"error\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void flattensMdcEntriesIntoTopLevelFields() {
        LoggingEvent event = event("processing");
        event.setMDCPropertyMap(Map.of("paper", "https://arxiv.org/abs/1", "level", "ignored"));

        String json = layout.doLayout(event);

        assertThat(json).contains(",\"paper\":\"https://arxiv.org/abs/1\"");
        assertThat(json).doesNotContain("ignored");
    }

    @Test
    void addsErrorFieldForThrowables() {
        LoggingEvent event = event("failed");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("cannot parse")));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"error\":\"java.lang.IllegalStateException: cannot parse\"");
    }

    @Test
    void escapesControlCharactersAndQuotes() {
        String json = layout.doLayout(event("say \"hi\"\n\\end"));

        assertThat(json).contains("\"message\":\"say \\\"hi\\\"\\n\\\\end\"");
    }

    private LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
