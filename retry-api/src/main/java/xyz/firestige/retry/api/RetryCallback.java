package xyz.firestige.retry.api;

import java.time.Duration;

/**
 * 重试回调：在进入等待前触发
 */
@FunctionalInterface
public interface RetryCallback {

    void onRetry(Throwable failure, int attempt, Duration nextDelay);
}
