package xyz.firestige.retry.listener;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingRetryListenerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(LoggingRetryListener.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void setUp() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    void firstTrySuccessIsSilent() {
        new LoggingRetryListener("orders").onSuccess("ok", 1);

        assertThat(appender.list).isEmpty();
    }

    @Test
    void retryAndFailureAreLogged() {
        LoggingRetryListener listener = new LoggingRetryListener("orders");

        listener.onRetry(new IOException("x"), 1, Duration.ofMillis(100));
        listener.onSuccess("ok", 2);
        listener.onFailure(new IOException("y"), 3);

        assertThat(appender.list).extracting(ILoggingEvent::getLevel)
            .containsExactly(Level.INFO, Level.INFO, Level.WARN);
        assertThat(appender.list.get(0).getFormattedMessage()).contains("orders").contains("100.0ms");
    }
}
