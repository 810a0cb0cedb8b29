package xyz.firestige.retry.backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * 固定延迟：raw = base，与 attempt 无关
 */
public class ConstantBackoffPolicy extends AbstractBackoffPolicy {

    private final double delayNanos;

    public ConstantBackoffPolicy(Duration delay, double jitterFactor) {
        this(delay, jitterFactor, threadLocalRandom());
    }

    public ConstantBackoffPolicy(Duration delay, double jitterFactor, DoubleSupplier random) {
        super(jitterFactor, random);
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative");
        }
        this.delayNanos = toNanos(delay);
    }

    @Override
    protected double rawDelayNanos(int attempt) {
        return delayNanos;
    }
}
