package ai.texdocx.converter.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    private final LoggerContext context = new LoggerContext();

    @Test
    void formatsEventAsJson() {
        LoggingEvent event = event("hello \"world\"");

        String json = layout(context).doLayout(event);

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"hello \\\"world\\\"\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"WARN\"");
        assertThat(json).doesNotContain("\"mdc\"").doesNotContain("\"exception\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void promotesSourceAndNestsOtherMdcEntries() {
        LoggingEvent event = event("converting");
        event.setMDCPropertyMap(Map.of(SimpleJsonLayout.SOURCE_KEY, "paper.tex", "stage", "render"));

        String json = layout(context).doLayout(event);

        assertThat(json).contains("\"source\":\"paper.tex\"");
        assertThat(json).contains("\"mdc\":{\"stage\":\"render\"}");
    }

    @Test
    void includesExceptionText() {
        LoggingEvent event = event("failed");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("broken\nstate")));

        String json = layout(context).doLayout(event);

        assertThat(json).contains("\"exception\":\"java.lang.IllegalStateException: broken\\nstate");
    }

    @Test
    void quotesControlCharacters() {
        assertThat(SimpleJsonLayout.quote("a\tb\u0001")).isEqualTo("\"a\\tb\\u0001\"");
        assertThat(SimpleJsonLayout.quote(null)).isEqualTo("null");
    }

    private static SimpleJsonLayout layout(LoggerContext context) {
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private LoggingEvent event(String message) {
        context.start();
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.WARN);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
