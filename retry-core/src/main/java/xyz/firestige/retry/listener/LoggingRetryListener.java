package xyz.firestige.retry.listener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.retry.api.RetryListener;

import java.time.Duration;

/**
 * 日志记录监听器
 * <p>重试记 INFO，最终失败记 WARN，首次即成功不记录
 */
public class LoggingRetryListener implements RetryListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRetryListener.class);

    private final String name;

    public LoggingRetryListener(String name) {
        this.name = name;
    }

    @Override
    public void onSuccess(Object result, int attempts) {
        if (attempts > 1) {
            log.info("重试成功 [policy={}, attempts={}]", name, attempts);
        }
    }

    @Override
    public void onRetry(Throwable failure, int attempt, Duration nextDelay) {
        log.info("第 {} 次尝试失败，{}ms 后重试 [policy={}, error={}]",
            attempt, nextDelay.toNanos() / 1_000_000.0, name, failure.toString());
    }

    @Override
    public void onFailure(Throwable failure, int attempts) {
        log.warn("重试终止 [policy={}, attempts={}, error={}]", name, attempts, failure.toString(), failure);
    }
}
