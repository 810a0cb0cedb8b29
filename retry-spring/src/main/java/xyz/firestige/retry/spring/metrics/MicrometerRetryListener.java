package xyz.firestige.retry.spring.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import xyz.firestige.retry.api.RetryListener;
import xyz.firestige.retry.api.RetryOutcome;

import java.time.Duration;

/**
 * 基于 Micrometer 的重试指标监听器
 * <p>
 * 记录以下指标：
 * - chrono_retry_success: 最终成功的调用数
 * - chrono_retry_retries: 重试次数
 * - chrono_retry_exhausted: 次数耗尽的调用数
 * - chrono_retry_non_retryable: 因不可重试失败终止的调用数
 * - chrono_retry_backoff: 退避延迟分布
 *
 * @author AI
 * @since 1.0
 */
public class MicrometerRetryListener implements RetryListener {

    private final Counter success;
    private final Counter retries;
    private final Counter exhausted;
    private final Counter nonRetryable;
    private final Timer backoff;

    public MicrometerRetryListener(MeterRegistry registry) {
        this.success = Counter.builder("chrono_retry_success")
            .description("Calls that eventually succeeded")
            .register(registry);
        this.retries = Counter.builder("chrono_retry_retries")
            .description("Retries scheduled after a retryable failure")
            .register(registry);
        this.exhausted = Counter.builder("chrono_retry_exhausted")
            .description("Calls that used up every attempt")
            .register(registry);
        this.nonRetryable = Counter.builder("chrono_retry_non_retryable")
            .description("Calls stopped by a non-retryable failure")
            .register(registry);
        this.backoff = Timer.builder("chrono_retry_backoff")
            .description("Backoff delay before each retry")
            .register(registry);
    }

    @Override
    public void onRetry(Throwable failure, int attempt, Duration nextDelay) {
        retries.increment();
        backoff.record(nextDelay);
    }

    @Override
    public void onComplete(RetryOutcome<?> outcome) {
        switch (outcome.getKind()) {
            case SUCCESS:
                success.increment();
                break;
            case EXHAUSTED:
                exhausted.increment();
                break;
            case NON_RETRYABLE:
                nonRetryable.increment();
                break;
            default:
                break;
        }
    }
}
