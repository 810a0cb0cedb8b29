package xyz.firestige.retry.backoff;

import xyz.firestige.retry.api.BackoffPolicy;
import xyz.firestige.retry.exception.InvalidJitterFactorException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 退避策略基类
 * <p>
 * 子类只负责计算未抖动的原始延迟（纳秒，double 精度），抖动混合统一在此完成：
 * <pre>
 * j     = clamp(jitterFactor, 0, 1)       // NaN 抛 InvalidJitterFactorException
 * delay = raw * (1 - j + uniform(0,1) * j)
 * </pre>
 * j = 0 时不抽取随机数，结果严格等于 raw；j = 1 时结果在 [0, raw] 上均匀分布。
 *
 * @author AI
 * @since 1.0
 */
public abstract class AbstractBackoffPolicy implements BackoffPolicy {

    private static final double MAX_NANOS = (double) Long.MAX_VALUE;

    private final double jitterFactor;
    private final DoubleSupplier random;

    protected AbstractBackoffPolicy(double jitterFactor, DoubleSupplier random) {
        this.jitterFactor = jitterFactor;
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public final Duration delay(int attempt) {
        checkAttempt(attempt);
        double normalized = normalizeJitter(jitterFactor);
        double raw = rawDelayNanos(attempt);
        return toDuration(applyJitter(raw, normalized));
    }

    /**
     * 未抖动的原始延迟
     */
    public final Duration rawDelay(int attempt) {
        checkAttempt(attempt);
        return toDuration(rawDelayNanos(attempt));
    }

    /**
     * @param attempt 从 1 开始的尝试次数
     * @return 原始延迟（纳秒），有限且非负
     */
    protected abstract double rawDelayNanos(int attempt);

    public double getJitterFactor() {
        return jitterFactor;
    }

    DoubleSupplier random() {
        return random;
    }

    private double applyJitter(double raw, double normalized) {
        if (normalized == 0.0 || raw <= 0.0) {
            return raw;
        }
        double sample = Math.max(0.0, Math.min(1.0, random.getAsDouble()));
        double blended = raw * (1.0 - normalized + sample * normalized);
        return Math.max(0.0, Math.min(raw, blended));
    }

    /**
     * 抖动因子归一化：越界值截断到 [0, 1]，NaN 视为使用错误
     *
     * @throws InvalidJitterFactorException jitterFactor 为 NaN
     */
    public static double normalizeJitter(double jitterFactor) {
        if (Double.isNaN(jitterFactor)) {
            throw new InvalidJitterFactorException(jitterFactor);
        }
        return Math.max(0.0, Math.min(1.0, jitterFactor));
    }

    /**
     * 默认随机源
     */
    public static DoubleSupplier threadLocalRandom() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }

    /**
     * Duration 转纳秒（double），超出 long 范围的值不会溢出
     */
    static double toNanos(Duration duration) {
        return duration.getSeconds() * 1_000_000_000.0 + duration.getNano();
    }

    static Duration toDuration(double nanos) {
        if (!(nanos > 0.0)) {
            return Duration.ZERO;
        }
        if (nanos >= MAX_NANOS) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos((long) nanos);
    }

    private static void checkAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
    }
}
