package xyz.firestige.retry.backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * 斐波那契退避：raw = min(base * fib(attempt), maxDelay)
 * <p>
 * 序列 1, 1, 2, 3, 5, 8, 13, ...；迭代计算并在 long 溢出时饱和，迭代次数因此不超过 93 次。
 */
public class FibonacciBackoffPolicy extends AbstractBackoffPolicy {

    private final double baseNanos;
    private final double maxNanos;

    public FibonacciBackoffPolicy(Duration baseDelay, Duration maxDelay, double jitterFactor) {
        this(baseDelay, maxDelay, jitterFactor, threadLocalRandom());
    }

    public FibonacciBackoffPolicy(Duration baseDelay, Duration maxDelay, double jitterFactor, DoubleSupplier random) {
        super(jitterFactor, random);
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay < 0");
        if (maxDelay.isNegative()) throw new IllegalArgumentException("maxDelay < 0");
        this.baseNanos = toNanos(baseDelay);
        this.maxNanos = toNanos(maxDelay);
    }

    @Override
    protected double rawDelayNanos(int attempt) {
        if (baseNanos == 0.0) {
            return 0.0;
        }
        return Math.min(baseNanos * fibonacci(attempt), maxNanos);
    }

    /**
     * 第 n 个斐波那契数：fib(0)=0, fib(1)=fib(2)=1，超出 long 范围时返回 {@link Long#MAX_VALUE}
     */
    public static long fibonacci(int n) {
        if (n <= 0) {
            return 0;
        }
        if (n <= 2) {
            return 1;
        }
        long a = 1;
        long b = 1;
        for (int i = 2; i < n; i++) {
            if (b > Long.MAX_VALUE - a) {
                return Long.MAX_VALUE;
            }
            long next = a + b;
            a = b;
            b = next;
        }
        return b;
    }
}
