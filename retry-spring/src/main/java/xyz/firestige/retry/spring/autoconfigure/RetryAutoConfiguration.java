package xyz.firestige.retry.spring.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.firestige.retry.api.AsyncSleeper;
import xyz.firestige.retry.api.PolicyRegistry;
import xyz.firestige.retry.api.RetryListener;
import xyz.firestige.retry.api.RetryPolicy;
import xyz.firestige.retry.api.Sleeper;
import xyz.firestige.retry.core.Retrier;
import xyz.firestige.retry.listener.LoggingRetryListener;
import xyz.firestige.retry.registry.InMemoryPolicyRegistry;
import xyz.firestige.retry.sleep.ScheduledAsyncSleeper;
import xyz.firestige.retry.sleep.ThreadSleeper;
import xyz.firestige.retry.sleep.TimerAsyncSleeper;
import xyz.firestige.retry.spring.metrics.MicrometerRetryListener;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 重试引擎自动配置
 *
 * @author AI
 * @since 1.0
 */
@AutoConfiguration
@ConditionalOnClass(Retrier.class)
@ConditionalOnProperty(prefix = "chrono.retry", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RetryProperties.class)
public class RetryAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RetryAutoConfiguration.class);

    /**
     * 策略注册表：defaults 覆盖内置默认值，命名策略再覆盖 defaults
     */
    @Bean
    @ConditionalOnMissingBean
    public PolicyRegistry retryPolicyRegistry(RetryProperties properties) {
        RetryPolicy defaultPolicy = properties.getDefaults().applyTo(RetryPolicy.builder()).build();
        InMemoryPolicyRegistry registry = new InMemoryPolicyRegistry(defaultPolicy);
        for (Map.Entry<String, RetryProperties.PolicyConfig> entry : properties.getPolicies().entrySet()) {
            RetryPolicy policy = entry.getValue().applyTo(defaultPolicy.toBuilder()).build();
            registry.register(entry.getKey(), policy);
        }
        log.info("重试策略注册表初始化完成: policies={}", registry.names());
        return registry;
    }

    /**
     * 阻塞式等待
     */
    @Bean
    @ConditionalOnMissingBean
    public Sleeper retrySleeper() {
        return ThreadSleeper.INSTANCE;
    }

    /**
     * 协作式等待，timer 类型在容器关闭时停止时间轮
     */
    @Bean
    @ConditionalOnMissingBean
    public AsyncSleeper retryAsyncSleeper(RetryProperties properties) {
        RetryProperties.SleeperConfig config = properties.getSleeper();
        String type = config.getType() == null ? "scheduled" : config.getType().trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "scheduled":
                return new ScheduledAsyncSleeper();
            case "timer":
                return new TimerAsyncSleeper(config.getTickDuration().toMillis(), config.getWheelSize());
            default:
                throw new IllegalArgumentException("Unknown sleeper type: " + config.getType());
        }
    }

    /**
     * 重试入口
     * <p>
     * 监听器：日志 + 容器中的其他 {@link RetryListener} + Micrometer（存在 MeterRegistry 且 metrics.enabled=true）
     */
    @Bean
    @ConditionalOnMissingBean
    public Retrier retrier(PolicyRegistry registry,
                           Sleeper sleeper,
                           AsyncSleeper asyncSleeper,
                           RetryProperties properties,
                           ObjectProvider<RetryListener> listenerProvider,
                           ObjectProvider<RetryMetricsBinder> metricsBinderProvider) {
        List<RetryListener> listeners = new ArrayList<>();
        listeners.add(new LoggingRetryListener("chrono-retry"));
        listeners.addAll(listenerProvider.orderedStream().collect(Collectors.toList()));
        RetryMetricsBinder binder = metricsBinderProvider.getIfAvailable();
        if (binder != null && properties.getMetrics().isEnabled()) {
            binder.listener().ifPresent(listeners::add);
        }
        return new Retrier(registry, sleeper, asyncSleeper, properties.getBackoffMode(), listeners);
    }

    /**
     * Micrometer 在类路径上时才加载
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        RetryMetricsBinder retryMetricsBinder(ObjectProvider<MeterRegistry> meterRegistryProvider) {
            return () -> {
                MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable();
                return meterRegistry != null
                    ? Optional.of(new MicrometerRetryListener(meterRegistry))
                    : Optional.empty();
            };
        }
    }

    /**
     * 延迟解析 MeterRegistry，避免自动配置顺序影响
     */
    @FunctionalInterface
    interface RetryMetricsBinder {
        Optional<RetryListener> listener();
    }
}
