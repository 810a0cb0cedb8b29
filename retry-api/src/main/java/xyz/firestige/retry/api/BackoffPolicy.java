package xyz.firestige.retry.api;

import java.time.Duration;

/**
 * 退避延迟计算
 * <p>
 * 纯函数：attempt → delay。除每次调用至多抽取一个均匀随机数用于抖动外，不持有任何可变状态，
 * 可在并发调用方之间共享。
 *
 * <h3>预置实现</h3>
 * <ul>
 *   <li>{@code ExponentialBackoffPolicy} - 指数退避</li>
 *   <li>{@code ConstantBackoffPolicy} - 固定延迟</li>
 *   <li>{@code FibonacciBackoffPolicy} - 斐波那契退避</li>
 *   <li>{@code PrecomputedBackoffPolicy} - 预计算查表（与上述结果一致）</li>
 * </ul>
 *
 * @author AI
 * @since 1.0
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * 计算第 attempt 次失败后的等待时间
     *
     * @param attempt 已完成的尝试次数（从 1 开始）
     * @return 非负延迟
     * @throws xyz.firestige.retry.exception.InvalidJitterFactorException 抖动因子为 NaN
     */
    Duration delay(int attempt);
}
