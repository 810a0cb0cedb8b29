package xyz.firestige.retry.api;

import org.junit.jupiter.api.Test;
import xyz.firestige.retry.exception.MaxRetriesExceededException;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryOutcomeTest {

    @Test
    void successReturnsValue() throws Exception {
        RetryOutcome<String> outcome = RetryOutcome.success("ok", 2, Duration.ofMillis(5));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getAttempts()).isEqualTo(2);
        assertThat(outcome.getCumulativeDelay()).isEqualTo(Duration.ofMillis(5));
        assertThat(outcome.getOrThrow()).isEqualTo("ok");
    }

    @Test
    void exhaustedWrapsLastFailure() {
        IOException last = new IOException("Always fails");
        RetryOutcome<String> outcome = RetryOutcome.exhausted(last, 2, Duration.ZERO);

        assertThat(outcome.isExhausted()).isTrue();
        assertThatThrownBy(outcome::getOrThrow)
            .isInstanceOf(MaxRetriesExceededException.class)
            .hasCause(last)
            .satisfies(e -> assertThat(((MaxRetriesExceededException) e).getAttempts()).isEqualTo(2));
    }

    @Test
    void nonRetryableRethrowsUnchanged() {
        IllegalArgumentException failure = new IllegalArgumentException("bad");
        RetryOutcome<String> outcome = RetryOutcome.nonRetryable(failure, 1, Duration.ZERO);

        assertThat(outcome.isNonRetryable()).isTrue();
        assertThatThrownBy(outcome::getOrThrow).isSameAs(failure);
    }
}
