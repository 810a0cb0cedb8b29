package xyz.firestige.retry.spring.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.ClassUtils;
import xyz.firestige.retry.api.RetryPolicy;
import xyz.firestige.retry.api.RetryPredicate;
import xyz.firestige.retry.backoff.BackoffPolicies;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 重试引擎配置属性
 *
 * @author AI
 * @since 1.0
 */
@ConfigurationProperties(prefix = "chrono.retry")
public class RetryProperties {

    /**
     * 是否启用重试自动配置
     */
    private boolean enabled = true;

    /**
     * 默认策略（覆盖内置默认值）
     */
    private PolicyConfig defaults = new PolicyConfig();

    /**
     * 命名策略，未配置的字段继承默认策略
     */
    private Map<String, PolicyConfig> policies = new LinkedHashMap<>();

    /**
     * 延迟计算方式：reference, precomputed
     */
    private BackoffPolicies.Mode backoffMode = BackoffPolicies.Mode.REFERENCE;

    /**
     * 协作式等待配置
     */
    private SleeperConfig sleeper = new SleeperConfig();

    /**
     * 监控配置
     */
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public PolicyConfig getDefaults() {
        return defaults;
    }

    public void setDefaults(PolicyConfig defaults) {
        this.defaults = defaults;
    }

    public Map<String, PolicyConfig> getPolicies() {
        return policies;
    }

    public void setPolicies(Map<String, PolicyConfig> policies) {
        this.policies = policies;
    }

    public BackoffPolicies.Mode getBackoffMode() {
        return backoffMode;
    }

    public void setBackoffMode(BackoffPolicies.Mode backoffMode) {
        this.backoffMode = backoffMode;
    }

    public SleeperConfig getSleeper() {
        return sleeper;
    }

    public void setSleeper(SleeperConfig sleeper) {
        this.sleeper = sleeper;
    }

    public MetricsConfig getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsConfig metrics) {
        this.metrics = metrics;
    }

    /**
     * 单个策略配置，字段为空表示沿用基础策略
     */
    public static class PolicyConfig {
        /**
         * 退避策略：exponential, constant, fibonacci
         */
        private String strategy;

        /**
         * 最大尝试次数（含首次调用）
         */
        private Integer maxAttempts;

        /**
         * 基础延迟
         */
        private Duration baseDelay;

        /**
         * 倍增因子（指数退避策略）
         */
        private Double multiplier;

        /**
         * 最大延迟（指数与斐波那契策略）
         */
        private Duration maxDelay;

        /**
         * 抖动系数，[0, 1] 之外的值会被截断
         */
        private Double jitterFactor;

        /**
         * 可重试的异常类全名，为空时所有 Exception 都可重试
         */
        private List<String> retryable = new ArrayList<>();

        /**
         * 在 base 上覆盖已配置的字段
         *
         * @throws IllegalArgumentException 策略名未知或异常类无法加载
         */
        public RetryPolicy.Builder applyTo(RetryPolicy.Builder base) {
            if (strategy != null) {
                base.strategy(strategy);
            }
            if (maxAttempts != null) {
                base.maxAttempts(maxAttempts);
            }
            if (baseDelay != null) {
                base.baseDelay(baseDelay);
            }
            if (multiplier != null) {
                base.multiplier(multiplier);
            }
            if (maxDelay != null) {
                base.maxDelay(maxDelay);
            }
            if (jitterFactor != null) {
                base.jitterFactor(jitterFactor);
            }
            if (retryable != null && !retryable.isEmpty()) {
                base.retryPredicate(RetryPredicate.anyOf(resolveRetryable()));
            }
            return base;
        }

        private List<Class<? extends Throwable>> resolveRetryable() {
            List<Class<? extends Throwable>> kinds = new ArrayList<>();
            for (String name : retryable) {
                Class<?> type;
                try {
                    type = ClassUtils.forName(name.trim(), ClassUtils.getDefaultClassLoader());
                } catch (ClassNotFoundException | LinkageError e) {
                    throw new IllegalArgumentException("retryable class not found: " + name, e);
                }
                if (!Throwable.class.isAssignableFrom(type)) {
                    throw new IllegalArgumentException("retryable class is not a Throwable: " + name);
                }
                kinds.add(type.asSubclass(Throwable.class));
            }
            return kinds;
        }

        // Getters and Setters

        public String getStrategy() {
            return strategy;
        }

        public void setStrategy(String strategy) {
            this.strategy = strategy;
        }

        public Integer getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(Double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(Double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }

        public List<String> getRetryable() {
            return retryable;
        }

        public void setRetryable(List<String> retryable) {
            this.retryable = retryable;
        }
    }

    /**
     * 协作式等待配置
     */
    public static class SleeperConfig {
        /**
         * 实现类型：scheduled（调度线程池）, timer（时间轮）
         */
        private String type = "scheduled";

        /**
         * 时间轮 tick 间隔
         */
        private Duration tickDuration = Duration.ofMillis(10);

        /**
         * 时间轮槽位数
         */
        private int wheelSize = 512;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Duration getTickDuration() {
            return tickDuration;
        }

        public void setTickDuration(Duration tickDuration) {
            this.tickDuration = tickDuration;
        }

        public int getWheelSize() {
            return wheelSize;
        }

        public void setWheelSize(int wheelSize) {
            this.wheelSize = wheelSize;
        }
    }

    /**
     * 监控配置
     */
    public static class MetricsConfig {
        /**
         * 是否启用指标收集
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
