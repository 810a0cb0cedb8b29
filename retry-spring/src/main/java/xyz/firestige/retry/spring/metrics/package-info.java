/**
 * Micrometer 指标集成
 * <p>
 * 记录的指标：
 * <ul>
 *   <li>chrono_retry_success - 最终成功的调用数</li>
 *   <li>chrono_retry_retries - 重试次数</li>
 *   <li>chrono_retry_exhausted - 次数耗尽的调用数</li>
 *   <li>chrono_retry_non_retryable - 不可重试失败终止的调用数</li>
 *   <li>chrono_retry_backoff - 退避延迟分布</li>
 * </ul>
 *
 * @author AI
 * @since 1.0
 */
package xyz.firestige.retry.spring.metrics;
