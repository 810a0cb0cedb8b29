package xyz.firestige.retry.spring.autoconfigure;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import xyz.firestige.retry.api.AsyncSleeper;
import xyz.firestige.retry.api.BackoffStrategy;
import xyz.firestige.retry.api.PolicyRegistry;
import xyz.firestige.retry.api.RetryPolicy;
import xyz.firestige.retry.api.Sleeper;
import xyz.firestige.retry.core.Retrier;
import xyz.firestige.retry.registry.InMemoryPolicyRegistry;
import xyz.firestige.retry.sleep.ScheduledAsyncSleeper;
import xyz.firestige.retry.sleep.ThreadSleeper;
import xyz.firestige.retry.sleep.TimerAsyncSleeper;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 验证默认开启时的装配与属性绑定
 */
class RetryAutoConfigurationEnabledTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(RetryAutoConfiguration.class));

    @Test
    void shouldCreateBeansByDefault() {
        contextRunner.run(ctx -> {
            assertThat(ctx).hasSingleBean(PolicyRegistry.class);
            assertThat(ctx).hasSingleBean(Retrier.class);
            assertThat(ctx.getBean(Sleeper.class)).isSameAs(ThreadSleeper.INSTANCE);
            assertThat(ctx.getBean(AsyncSleeper.class)).isInstanceOf(ScheduledAsyncSleeper.class);
            assertThat(ctx.getBean(PolicyRegistry.class).getDefaultPolicy().getMaxAttempts())
                .isEqualTo(RetryPolicy.DEFAULT_MAX_ATTEMPTS);
        });
    }

    @Test
    void shouldBindDefaultsAndNamedPolicies() {
        contextRunner
            .withPropertyValues(
                "chrono.retry.defaults.max-attempts=5",
                "chrono.retry.defaults.jitter-factor=0",
                "chrono.retry.policies.http.strategy=fibonacci",
                "chrono.retry.policies.http.base-delay=200ms",
                "chrono.retry.policies.http.retryable[0]=java.io.IOException",
                "chrono.retry.policies.fixed.strategy=fixed-delay",
                "chrono.retry.policies.fixed.max-attempts=2"
            )
            .run(ctx -> {
                PolicyRegistry registry = ctx.getBean(PolicyRegistry.class);
                assertThat(registry.names()).containsExactly("default", "fixed", "http");

                RetryPolicy http = registry.getPolicy("http");
                assertThat(http.getStrategy()).isEqualTo(BackoffStrategy.FIBONACCI);
                assertThat(http.getBaseDelay()).isEqualTo(Duration.ofMillis(200));
                assertThat(http.getMaxAttempts()).isEqualTo(5);
                assertThat(http.getJitterFactor()).isZero();
                assertThat(http.getRetryPredicate().isRetryable(new IOException())).isTrue();
                assertThat(http.getRetryPredicate().isRetryable(new IllegalStateException())).isFalse();

                RetryPolicy fixed = registry.getPolicy("fixed");
                assertThat(fixed.getStrategy()).isEqualTo(BackoffStrategy.CONSTANT);
                assertThat(fixed.getMaxAttempts()).isEqualTo(2);
            });
    }

    @Test
    void shouldRetryThroughConfiguredPolicy() {
        contextRunner
            .withPropertyValues(
                "chrono.retry.policies.fast.base-delay=0ms",
                "chrono.retry.policies.fast.max-attempts=3"
            )
            .run(ctx -> {
                int[] calls = {0};
                String result = ctx.getBean(Retrier.class).retry("fast", () -> {
                    if (++calls[0] < 3) {
                        throw new IOException("x");
                    }
                    return "ok";
                });
                assertThat(result).isEqualTo("ok");
                assertThat(calls[0]).isEqualTo(3);
            });
    }

    @Test
    void shouldUseTimerSleeperWhenConfigured() {
        contextRunner
            .withPropertyValues("chrono.retry.sleeper.type=timer", "chrono.retry.sleeper.tick-duration=5ms")
            .run(ctx -> assertThat(ctx.getBean(AsyncSleeper.class)).isInstanceOf(TimerAsyncSleeper.class));
    }

    @Test
    void shouldParseSleeperTypeIndependentOfDefaultLocale() {
        Locale original = Locale.getDefault();
        // 土耳其语环境下 "TIMER".toLowerCase() 得到无点 ı
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            contextRunner
                .withPropertyValues("chrono.retry.sleeper.type=TIMER")
                .run(ctx -> assertThat(ctx.getBean(AsyncSleeper.class)).isInstanceOf(TimerAsyncSleeper.class));
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void shouldFailOnUnknownStrategy() {
        contextRunner
            .withPropertyValues("chrono.retry.policies.bad.strategy=linear")
            .run(ctx -> assertThat(ctx).hasFailed()
                .getFailure().hasRootCauseInstanceOf(IllegalArgumentException.class));
    }

    @Test
    void shouldFailOnNonNumericJitter() {
        contextRunner
            .withPropertyValues("chrono.retry.defaults.jitter-factor=abc")
            .run(ctx -> assertThat(ctx).hasFailed());
    }

    @Test
    void shouldBackOffWhenUserDefinesRegistry() {
        contextRunner
            .withBean(PolicyRegistry.class, () -> new InMemoryPolicyRegistry(
                RetryPolicy.builder().maxAttempts(9).build()))
            .run(ctx -> assertThat(ctx.getBean(PolicyRegistry.class).getDefaultPolicy().getMaxAttempts()).isEqualTo(9));
    }
}
