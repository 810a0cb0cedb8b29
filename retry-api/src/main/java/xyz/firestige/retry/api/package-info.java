/**
 * 重试引擎 API
 * <p>
 * 此包只定义契约，不包含实现。
 * <p>
 * 核心接口：
 * <ul>
 *   <li>{@link xyz.firestige.retry.api.BackoffPolicy} - 退避延迟计算</li>
 *   <li>{@link xyz.firestige.retry.api.RetryPredicate} - 失败分类</li>
 *   <li>{@link xyz.firestige.retry.api.RetryListener} - 生命周期监听</li>
 *   <li>{@link xyz.firestige.retry.api.Sleeper} / {@link xyz.firestige.retry.api.AsyncSleeper} - 挂起原语</li>
 *   <li>{@link xyz.firestige.retry.api.PolicyRegistry} - 命名策略注册表</li>
 * </ul>
 * <p>
 * 数据模型：
 * <ul>
 *   <li>{@link xyz.firestige.retry.api.RetryPolicy} - 策略配置</li>
 *   <li>{@link xyz.firestige.retry.api.RetryOutcome} - 终态结果</li>
 *   <li>{@link xyz.firestige.retry.api.RetryState} - 状态枚举</li>
 *   <li>{@link xyz.firestige.retry.api.BackoffStrategy} - 退避策略类型</li>
 * </ul>
 *
 * @author AI
 * @since 1.0
 */
package xyz.firestige.retry.api;
