package xyz.firestige.retry.api;

import java.time.Duration;

/**
 * 重试生命周期监听器
 *
 * <p>所有方法都是尽力而为：实现抛出的异常会被执行器吞掉，不影响重试决策与最终结果。
 *
 * <h3>预置实现</h3>
 * <ul>
 *   <li>{@link #noop()} - 空实现（默认）</li>
 *   <li>{@code LoggingRetryListener} - 日志记录</li>
 *   <li>{@code MicrometerRetryListener} - Micrometer 指标</li>
 * </ul>
 *
 * @author AI
 * @since 1.0
 */
public interface RetryListener {

    /**
     * 操作成功时触发
     */
    default void onSuccess(Object result, int attempts) {
    }

    /**
     * 可重试失败、进入等待前触发
     */
    default void onRetry(Throwable failure, int attempt, Duration nextDelay) {
    }

    /**
     * 最终失败时触发（不可重试或次数耗尽）
     */
    default void onFailure(Throwable failure, int attempts) {
    }

    /**
     * 到达终态后触发，无论成功还是失败
     */
    default void onComplete(RetryOutcome<?> outcome) {
    }

    static RetryListener noop() {
        return new RetryListener() {
        };
    }
}
