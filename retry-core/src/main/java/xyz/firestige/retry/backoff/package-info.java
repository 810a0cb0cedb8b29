/**
 * 退避延迟计算
 * <p>
 * 提供三种预置策略与一个查表实现：
 * <ul>
 *   <li>{@link xyz.firestige.retry.backoff.ExponentialBackoffPolicy} - 指数退避</li>
 *   <li>{@link xyz.firestige.retry.backoff.ConstantBackoffPolicy} - 固定延迟</li>
 *   <li>{@link xyz.firestige.retry.backoff.FibonacciBackoffPolicy} - 斐波那契退避</li>
 *   <li>{@link xyz.firestige.retry.backoff.PrecomputedBackoffPolicy} - 预计算查表</li>
 * </ul>
 * <p>
 * 使用者可实现 {@link xyz.firestige.retry.api.BackoffPolicy} 接口以定义自定义退避逻辑。
 *
 * @author AI
 * @since 1.0
 */
package xyz.firestige.retry.backoff;
