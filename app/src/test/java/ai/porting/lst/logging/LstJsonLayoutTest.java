package ai.porting.lst.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LstJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        LstJsonLayout layout = startedLayout();
        LoggingEvent event = event("hello \"world\"");
        event.setMDCPropertyMap(Map.of());

        String json = layout.doLayout(event);

        assertThat(json).contains("\"message\":\"hello \\\"world\\\"\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).contains("\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).doesNotContain("\"mdc\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void includesMdcAndException() {
        LstJsonLayout layout = startedLayout();
        LoggingEvent event = event("build failed");
        event.setMDCPropertyMap(Map.of("file", "src/a.cpp"));
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("boom")));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"mdc\":{\"file\":\"src/a.cpp\"}");
        assertThat(json).contains("\"exception\":\"java.lang.IllegalStateException: boom\"");
    }

    private static LstJsonLayout startedLayout() {
        LoggerContext context = new LoggerContext();
        context.start();
        LstJsonLayout layout = new LstJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private static LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        return event;
    }
}
