package xyz.firestige.retry.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.firestige.retry.api.BackoffStrategy;
import xyz.firestige.retry.api.PolicyRegistry;
import xyz.firestige.retry.api.RetryPolicy;
import xyz.firestige.retry.exception.UnknownPolicyException;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryPolicyRegistryTest {

    private InMemoryPolicyRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryPolicyRegistry();
    }

    @Test
    void seededWithDefaultPolicy() {
        assertThat(registry.names()).containsExactly(PolicyRegistry.DEFAULT_POLICY_NAME);
        assertThat(registry.getDefaultPolicy().getMaxAttempts()).isEqualTo(RetryPolicy.DEFAULT_MAX_ATTEMPTS);
    }

    @Test
    void registerReturnsReplacedPolicy() {
        RetryPolicy first = RetryPolicy.builder().maxAttempts(2).build();
        RetryPolicy second = RetryPolicy.builder().maxAttempts(4).build();

        assertThat(registry.register("api", first)).isEmpty();
        assertThat(registry.register("api", second)).contains(first);
        assertThat(registry.getPolicy("api")).isSameAs(second);
    }

    @Test
    void defineMergesOverDefault() {
        registry.register(PolicyRegistry.DEFAULT_POLICY_NAME,
            RetryPolicy.builder().baseDelay(Duration.ofMillis(50)).jitterFactor(0.0).build());

        RetryPolicy defined = registry.define("fib", b -> b.strategy(BackoffStrategy.FIBONACCI).maxAttempts(6));

        assertThat(defined.getStrategy()).isEqualTo(BackoffStrategy.FIBONACCI);
        assertThat(defined.getMaxAttempts()).isEqualTo(6);
        assertThat(defined.getBaseDelay()).isEqualTo(Duration.ofMillis(50));
        assertThat(defined.getJitterFactor()).isZero();
    }

    @Test
    void unknownPolicyRaises() {
        assertThatThrownBy(() -> registry.getPolicy("unknown"))
            .isInstanceOf(UnknownPolicyException.class)
            .hasMessage("Policy 'unknown' not found.");
        assertThat(registry.findPolicy("unknown")).isEmpty();
        assertThat(registry.findPolicy(null)).isEmpty();
    }

    @Test
    void removeAndNames() {
        registry.register("b", RetryPolicy.defaults());
        registry.register("a", RetryPolicy.defaults());

        assertThat(registry.names()).containsExactly("a", "b", "default");
        assertThat(registry.remove("a")).isPresent();
        assertThat(registry.remove("a")).isEqualTo(Optional.empty());
        assertThat(registry.names()).containsExactly("b", "default");
    }

    @Test
    void defaultPolicyCannotBeRemoved() {
        assertThatThrownBy(() -> registry.remove(PolicyRegistry.DEFAULT_POLICY_NAME))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blankNameRejected() {
        assertThatThrownBy(() -> registry.register(" ", RetryPolicy.defaults()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resetRestoresInitialState() {
        RetryPolicy initial = registry.getDefaultPolicy();
        registry.register("temp", RetryPolicy.defaults());
        registry.register(PolicyRegistry.DEFAULT_POLICY_NAME, RetryPolicy.builder().maxAttempts(9).build());

        registry.reset();

        assertThat(registry.names()).containsExactly(PolicyRegistry.DEFAULT_POLICY_NAME);
        assertThat(registry.getDefaultPolicy()).isSameAs(initial);
    }
}
