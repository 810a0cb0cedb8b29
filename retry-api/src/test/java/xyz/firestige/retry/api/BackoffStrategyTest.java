package xyz.firestige.retry.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffStrategyTest {

    @Test
    void parsesNamesCaseInsensitively() {
        assertThat(BackoffStrategy.of("exponential")).isEqualTo(BackoffStrategy.EXPONENTIAL);
        assertThat(BackoffStrategy.of("CONSTANT")).isEqualTo(BackoffStrategy.CONSTANT);
        assertThat(BackoffStrategy.of(" Fibonacci ")).isEqualTo(BackoffStrategy.FIBONACCI);
    }

    @Test
    void acceptsAliases() {
        assertThat(BackoffStrategy.of("exponential-backoff")).isEqualTo(BackoffStrategy.EXPONENTIAL);
        assertThat(BackoffStrategy.of("fixed_delay")).isEqualTo(BackoffStrategy.CONSTANT);
        assertThat(BackoffStrategy.of("fixed")).isEqualTo(BackoffStrategy.CONSTANT);
    }

    @Test
    void rejectsUnknownTag() {
        assertThatThrownBy(() -> BackoffStrategy.of("quadratic"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("quadratic");
        assertThatThrownBy(() -> BackoffStrategy.of(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
