package xyz.firestige.retry.backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * 指数退避：raw = min(base * multiplier^(attempt-1), maxDelay)
 */
public class ExponentialBackoffPolicy extends AbstractBackoffPolicy {

    private final double baseNanos;
    private final double multiplier;
    private final double maxNanos;

    public ExponentialBackoffPolicy(Duration baseDelay, double multiplier, Duration maxDelay, double jitterFactor) {
        this(baseDelay, multiplier, maxDelay, jitterFactor, threadLocalRandom());
    }

    public ExponentialBackoffPolicy(Duration baseDelay, double multiplier, Duration maxDelay,
                                    double jitterFactor, DoubleSupplier random) {
        super(jitterFactor, random);
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay < 0");
        if (maxDelay.isNegative()) throw new IllegalArgumentException("maxDelay < 0");
        if (!Double.isFinite(multiplier) || multiplier <= 0) throw new IllegalArgumentException("invalid multiplier: " + multiplier);
        this.baseNanos = toNanos(baseDelay);
        this.multiplier = multiplier;
        this.maxNanos = toNanos(maxDelay);
    }

    @Override
    protected double rawDelayNanos(int attempt) {
        if (baseNanos == 0.0) {
            return 0.0;
        }
        // pow 溢出为 Infinity 时由 min 截断到 maxDelay
        double exponential = baseNanos * Math.pow(multiplier, attempt - 1);
        return Math.min(exponential, maxNanos);
    }
}
