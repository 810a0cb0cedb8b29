package xyz.firestige.retry.core;

import xyz.firestige.retry.api.AsyncSleeper;
import xyz.firestige.retry.api.PolicyRegistry;
import xyz.firestige.retry.api.RetryListener;
import xyz.firestige.retry.api.RetryPolicy;
import xyz.firestige.retry.api.Sleeper;
import xyz.firestige.retry.backoff.BackoffPolicies;
import xyz.firestige.retry.sleep.ScheduledAsyncSleeper;
import xyz.firestige.retry.sleep.ThreadSleeper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * 重试入口
 *
 * <p>持有策略注册表与挂起原语，按策略名或临时覆盖创建 {@link RetryExecutor}。
 * 应用启动时创建一次，之后只读。
 *
 * <pre>{@code
 * Retrier retrier = new Retrier(registry);
 * String body = retrier.retry("http", () -> client.get(url));
 * }</pre>
 *
 * @author AI
 * @since 1.0
 */
public class Retrier {

    private final PolicyRegistry registry;
    private final Sleeper sleeper;
    private final AsyncSleeper asyncSleeper;
    private final BackoffPolicies.Mode backoffMode;
    private final List<RetryListener> listeners;

    public Retrier(PolicyRegistry registry) {
        this(registry, ThreadSleeper.INSTANCE, new ScheduledAsyncSleeper(), BackoffPolicies.Mode.REFERENCE, List.of());
    }

    public Retrier(PolicyRegistry registry,
                   Sleeper sleeper,
                   AsyncSleeper asyncSleeper,
                   BackoffPolicies.Mode backoffMode,
                   Collection<? extends RetryListener> listeners) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.asyncSleeper = Objects.requireNonNull(asyncSleeper, "asyncSleeper");
        this.backoffMode = Objects.requireNonNull(backoffMode, "backoffMode");
        this.listeners = List.copyOf(listeners);
    }

    /**
     * 按命名策略执行
     *
     * @throws xyz.firestige.retry.exception.UnknownPolicyException 策略不存在，此时操作不会被调用
     */
    public <T> T retry(String policyName, Callable<T> operation) throws Exception {
        return executor(policyName).call(operation);
    }

    /**
     * 在默认策略上覆盖部分字段后执行
     */
    public <T> T retry(UnaryOperator<RetryPolicy.Builder> overrides, Callable<T> operation) throws Exception {
        RetryPolicy policy = overrides.apply(registry.getDefaultPolicy().toBuilder()).build();
        return executor(policy).call(operation);
    }

    /**
     * 按默认策略执行
     */
    public <T> T retry(Callable<T> operation) throws Exception {
        return executor(PolicyRegistry.DEFAULT_POLICY_NAME).call(operation);
    }

    public <T> CompletableFuture<T> retryAsync(String policyName, Supplier<? extends CompletionStage<T>> operation) {
        return executor(policyName).callAsync(operation);
    }

    public RetryExecutor executor(String policyName) {
        return executor(registry.getPolicy(policyName));
    }

    public RetryExecutor executor(RetryPolicy policy) {
        return RetryExecutor.builder(policy)
            .backoffMode(backoffMode)
            .sleeper(sleeper)
            .asyncSleeper(asyncSleeper)
            .listeners(listeners)
            .build();
    }

    public PolicyRegistry getRegistry() {
        return registry;
    }

    /**
     * 复制当前配置并追加监听器
     */
    public Retrier withListener(RetryListener listener) {
        List<RetryListener> all = new ArrayList<>(listeners);
        all.add(Objects.requireNonNull(listener));
        return new Retrier(registry, sleeper, asyncSleeper, backoffMode, all);
    }
}
