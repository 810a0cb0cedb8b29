package xyz.firestige.retry.api;

import java.time.Duration;
import java.util.Objects;

/**
 * 重试策略配置（不可变）
 *
 * <p>构造后只读，可在并发调用方之间共享。
 *
 * <h3>默认值</h3>
 * <ul>
 *   <li>strategy: EXPONENTIAL</li>
 *   <li>maxAttempts: 3</li>
 *   <li>baseDelay: 100ms</li>
 *   <li>multiplier: 2.0</li>
 *   <li>maxDelay: 10s</li>
 *   <li>jitterFactor: 0.1</li>
 *   <li>retryPredicate: 所有 Exception 都可重试</li>
 * </ul>
 *
 * <h3>使用示例</h3>
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .strategy(BackoffStrategy.FIBONACCI)
 *     .maxAttempts(5)
 *     .baseDelay(Duration.ofMillis(50))
 *     .jitterFactor(1.0)
 *     .retryOn(IOException.class)
 *     .onRetry((e, attempt, delay) -> log.warn("retry #{} in {}", attempt, delay))
 *     .build();
 * }</pre>
 *
 * <p>jitterFactor 按原样保存：越界值在计算时截断到 [0, 1]，NaN 在首次计算延迟时抛出
 * {@link xyz.firestige.retry.exception.InvalidJitterFactorException}。
 *
 * @author AI
 * @since 1.0
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(100);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);
    public static final double DEFAULT_JITTER_FACTOR = 0.1;

    private final BackoffStrategy strategy;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final RetryPredicate retryPredicate;
    private final SuccessCallback onSuccess;
    private final RetryCallback onRetry;
    private final FailureCallback onFailure;

    private RetryPolicy(Builder b) {
        this.strategy = b.strategy;
        this.maxAttempts = b.maxAttempts;
        this.baseDelay = b.baseDelay;
        this.multiplier = b.multiplier;
        this.maxDelay = b.maxDelay;
        this.jitterFactor = b.jitterFactor;
        this.retryPredicate = b.retryPredicate;
        this.onSuccess = b.onSuccess;
        this.onRetry = b.onRetry;
        this.onFailure = b.onFailure;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    /**
     * 以当前策略为基础创建构建器，用于在默认策略上覆盖部分字段
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.strategy = strategy;
        b.maxAttempts = maxAttempts;
        b.baseDelay = baseDelay;
        b.multiplier = multiplier;
        b.maxDelay = maxDelay;
        b.jitterFactor = jitterFactor;
        b.retryPredicate = retryPredicate;
        b.onSuccess = onSuccess;
        b.onRetry = onRetry;
        b.onFailure = onFailure;
        return b;
    }

    public BackoffStrategy getStrategy() {
        return strategy;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    public RetryPredicate getRetryPredicate() {
        return retryPredicate;
    }

    public SuccessCallback getOnSuccess() {
        return onSuccess;
    }

    public RetryCallback getOnRetry() {
        return onRetry;
    }

    public FailureCallback getOnFailure() {
        return onFailure;
    }

    /**
     * 将三个回调适配为监听器（未配置的回调不做任何事）
     */
    public RetryListener asListener() {
        if (onSuccess == null && onRetry == null && onFailure == null) {
            return RetryListener.noop();
        }
        return new RetryListener() {
            @Override
            public void onSuccess(Object result, int attempts) {
                if (onSuccess != null) onSuccess.onSuccess(result, attempts);
            }

            @Override
            public void onRetry(Throwable failure, int attempt, Duration nextDelay) {
                if (onRetry != null) onRetry.onRetry(failure, attempt, nextDelay);
            }

            @Override
            public void onFailure(Throwable failure, int attempts) {
                if (onFailure != null) onFailure.onFailure(failure, attempts);
            }
        };
    }

    @Override
    public String toString() {
        return "RetryPolicy{strategy=" + strategy
            + ", maxAttempts=" + maxAttempts
            + ", baseDelay=" + baseDelay
            + ", multiplier=" + multiplier
            + ", maxDelay=" + maxDelay
            + ", jitterFactor=" + jitterFactor + '}';
    }

    /**
     * {@link RetryPolicy} 构建器
     */
    public static final class Builder {

        private BackoffStrategy strategy = BackoffStrategy.EXPONENTIAL;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private double multiplier = DEFAULT_MULTIPLIER;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double jitterFactor = DEFAULT_JITTER_FACTOR;
        private RetryPredicate retryPredicate = RetryPredicate.all();
        private SuccessCallback onSuccess;
        private RetryCallback onRetry;
        private FailureCallback onFailure;

        private Builder() {
        }

        public Builder strategy(BackoffStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        /**
         * @throws IllegalArgumentException 未知的策略名称
         */
        public Builder strategy(String strategy) {
            this.strategy = BackoffStrategy.of(strategy);
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder retryPredicate(RetryPredicate retryPredicate) {
            this.retryPredicate = retryPredicate;
            return this;
        }

        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... kinds) {
            this.retryPredicate = RetryPredicate.anyOf(kinds);
            return this;
        }

        public Builder onSuccess(SuccessCallback onSuccess) {
            this.onSuccess = onSuccess;
            return this;
        }

        public Builder onRetry(RetryCallback onRetry) {
            this.onRetry = onRetry;
            return this;
        }

        public Builder onFailure(FailureCallback onFailure) {
            this.onFailure = onFailure;
            return this;
        }

        public RetryPolicy build() {
            Objects.requireNonNull(strategy, "strategy");
            Objects.requireNonNull(retryPredicate, "retryPredicate");
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            if (baseDelay == null || baseDelay.isNegative()) {
                throw new IllegalArgumentException("baseDelay must be non-negative");
            }
            if (maxDelay == null || maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must be non-negative");
            }
            if (!Double.isFinite(multiplier) || multiplier <= 0) {
                throw new IllegalArgumentException("multiplier must be a positive finite number");
            }
            return new RetryPolicy(this);
        }
    }
}
