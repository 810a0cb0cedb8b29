/**
 * 重试状态机
 *
 * <ul>
 *   <li>{@link xyz.firestige.retry.core.RetryExecutor} - 按策略执行操作，阻塞式与协作式两种挂起方式</li>
 *   <li>{@link xyz.firestige.retry.core.Retrier} - 基于策略注册表的入口</li>
 * </ul>
 */
package xyz.firestige.retry.core;
