package xyz.firestige.retry.backoff;

import xyz.firestige.retry.api.RetryPolicy;

import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * 按 {@link RetryPolicy} 创建退避实现，实现方式在构造时选定
 *
 * @author AI
 * @since 1.0
 */
public final class BackoffPolicies {

    /**
     * 实现方式
     */
    public enum Mode {
        /** 逐次计算 */
        REFERENCE,
        /** 构造时按 maxAttempts 预计算查表 */
        PRECOMPUTED
    }

    private BackoffPolicies() {
    }

    public static AbstractBackoffPolicy create(RetryPolicy policy) {
        return create(policy, Mode.REFERENCE, AbstractBackoffPolicy.threadLocalRandom());
    }

    public static AbstractBackoffPolicy create(RetryPolicy policy, Mode mode) {
        return create(policy, mode, AbstractBackoffPolicy.threadLocalRandom());
    }

    public static AbstractBackoffPolicy create(RetryPolicy policy, Mode mode, DoubleSupplier random) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(mode, "mode");
        AbstractBackoffPolicy reference = reference(policy, random);
        if (mode == Mode.PRECOMPUTED) {
            return new PrecomputedBackoffPolicy(reference, policy.getMaxAttempts());
        }
        return reference;
    }

    private static AbstractBackoffPolicy reference(RetryPolicy policy, DoubleSupplier random) {
        switch (policy.getStrategy()) {
            case EXPONENTIAL:
                return new ExponentialBackoffPolicy(policy.getBaseDelay(), policy.getMultiplier(),
                    policy.getMaxDelay(), policy.getJitterFactor(), random);
            case CONSTANT:
                return new ConstantBackoffPolicy(policy.getBaseDelay(), policy.getJitterFactor(), random);
            case FIBONACCI:
                return new FibonacciBackoffPolicy(policy.getBaseDelay(), policy.getMaxDelay(),
                    policy.getJitterFactor(), random);
            default:
                throw new IllegalArgumentException("unsupported backoff strategy: " + policy.getStrategy());
        }
    }
}
