package xyz.firestige.retry.api;

import java.util.Locale;

/**
 * 退避策略类型
 * <p>
 * 决定尝试次数到未抖动基础延迟的映射：
 * <ul>
 *   <li>{@link #EXPONENTIAL} - base * multiplier^(attempt-1)，受 maxDelay 限制</li>
 *   <li>{@link #CONSTANT} - 固定 base，忽略 attempt</li>
 *   <li>{@link #FIBONACCI} - base * fib(attempt)，受 maxDelay 限制</li>
 * </ul>
 *
 * @author AI
 * @since 1.0
 */
public enum BackoffStrategy {

    EXPONENTIAL,
    CONSTANT,
    FIBONACCI;

    /**
     * 按名称解析策略（忽略大小写，兼容 exponential-backoff / fixed-delay 写法）
     *
     * @param name 策略名称
     * @return 策略
     * @throws IllegalArgumentException 未知的策略名称
     */
    public static BackoffStrategy of(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("backoff strategy must not be blank");
        }
        switch (name.trim().toLowerCase(Locale.ROOT).replace('_', '-')) {
            case "exponential":
            case "exponential-backoff":
                return EXPONENTIAL;
            case "constant":
            case "fixed":
            case "fixed-delay":
                return CONSTANT;
            case "fibonacci":
                return FIBONACCI;
            default:
                throw new IllegalArgumentException("unknown backoff strategy: " + name);
        }
    }
}
