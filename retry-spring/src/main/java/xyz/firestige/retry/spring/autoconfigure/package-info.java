/**
 * Spring Boot 自动配置
 * <p>
 * 核心组件：
 * <ul>
 *   <li>{@link xyz.firestige.retry.spring.autoconfigure.RetryAutoConfiguration} - 自动配置类</li>
 *   <li>{@link xyz.firestige.retry.spring.autoconfigure.RetryProperties} - 配置属性</li>
 * </ul>
 * <p>
 * 使用方式：
 * <pre>
 * # application.yml
 * chrono:
 *   retry:
 *     defaults:
 *       max-attempts: 5
 *       jitter-factor: 0.2
 *     policies:
 *       http:
 *         strategy: fibonacci
 *         base-delay: 200ms
 *         retryable:
 *           - java.io.IOException
 *     sleeper:
 *       type: timer
 * </pre>
 *
 * @author AI
 * @since 1.0
 */
package xyz.firestige.retry.spring.autoconfigure;
