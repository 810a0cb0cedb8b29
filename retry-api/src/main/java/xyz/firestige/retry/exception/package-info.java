/**
 * 重试引擎异常类型
 * <ul>
 *   <li>{@link xyz.firestige.retry.exception.RetryException} - 基础异常</li>
 *   <li>{@link xyz.firestige.retry.exception.MaxRetriesExceededException} - 重试次数耗尽</li>
 *   <li>{@link xyz.firestige.retry.exception.InvalidJitterFactorException} - 抖动因子为 NaN</li>
 *   <li>{@link xyz.firestige.retry.exception.UnknownPolicyException} - 命名策略不存在</li>
 * </ul>
 * <p>
 * 不可重试的业务异常不做包装，原样抛给调用方；回调自身的异常一律被吞掉，不会出现在这里。
 *
 * @author AI
 * @since 1.0
 */
package xyz.firestige.retry.exception;
