package ai.texdocx.converter.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.texdocx.converter.config.LogFormat;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    @AfterEach
    void restoreTextLogging() {
        LoggingConfigurator.configure(LogFormat.TEXT, false);
        root().setLevel(Level.WARN);
    }

    @Test
    void jsonFormatSwapsEncoderAndVerboseEnablesDebug() {
        LoggingConfigurator.configure(LogFormat.JSON, true);

        assertThat(root().getLevel()).isEqualTo(Level.DEBUG);
        assertThat(consoleAppender().getEncoder()).isInstanceOfSatisfying(LayoutWrappingEncoder.class,
                encoder -> assertThat(encoder.getLayout()).isInstanceOf(SimpleJsonLayout.class));
    }

    @Test
    void textFormatUsesPattern() {
        LoggingConfigurator.configure(LogFormat.TEXT, false);

        assertThat(root().getLevel()).isEqualTo(Level.INFO);
        assertThat(consoleAppender().getEncoder()).isInstanceOfSatisfying(PatternLayoutEncoder.class,
                encoder -> assertThat(encoder.getPattern()).isEqualTo(LoggingConfigurator.TEXT_PATTERN));
    }

    private static Logger root() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        return context.getLogger(Logger.ROOT_LOGGER_NAME);
    }

    private static OutputStreamAppender<?> consoleAppender() {
        Appender<ILoggingEvent> appender = root().getAppender("CONSOLE");
        assertThat(appender).isInstanceOf(OutputStreamAppender.class);
        return (OutputStreamAppender<?>) appender;
    }
}
