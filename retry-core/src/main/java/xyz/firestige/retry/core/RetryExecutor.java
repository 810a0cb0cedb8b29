package xyz.firestige.retry.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.retry.api.AsyncSleeper;
import xyz.firestige.retry.api.BackoffPolicy;
import xyz.firestige.retry.api.RetryListener;
import xyz.firestige.retry.api.RetryOutcome;
import xyz.firestige.retry.api.RetryPolicy;
import xyz.firestige.retry.api.Sleeper;
import xyz.firestige.retry.backoff.AbstractBackoffPolicy;
import xyz.firestige.retry.backoff.BackoffPolicies;
import xyz.firestige.retry.exception.MaxRetriesExceededException;
import xyz.firestige.retry.sleep.ScheduledAsyncSleeper;
import xyz.firestige.retry.sleep.ThreadSleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * 重试执行器
 *
 * <p>按 {@link RetryPolicy} 顺序重试同一个操作，对调用方而言是同步的。
 *
 * <h3>状态机</h3>
 * <ol>
 *   <li>attempts 递增后调用操作</li>
 *   <li>成功：触发 onSuccess，返回结果 → SUCCEEDED</li>
 *   <li>不可重试的失败：触发 onFailure，原样抛出 → FAILED</li>
 *   <li>可重试但次数已耗尽：触发 onFailure，抛出 {@code MaxRetriesExceededException} → FAILED</li>
 *   <li>否则计算延迟、触发 onRetry、挂起后回到第 1 步 → RETRYING</li>
 * </ol>
 * 分类判断先于次数判断：最后一次尝试上的不可重试失败仍按不可重试处理。
 *
 * <h3>挂起</h3>
 * 延迟 &lt;= 0 时不挂起；等待期间的中断立即向上传播并终止整个重试序列，其他异常被吞掉，视为等待正常结束。
 *
 * <h3>回调</h3>
 * 所有监听器都是尽力而为，抛出的异常被记录后丢弃，不影响重试决策与返回结果。
 *
 * <h3>并发</h3>
 * 执行器本身无可变状态，每次调用的状态都在 {@link RetryAttempt} 中，可被多个线程同时调用。
 *
 * @author AI
 * @since 1.0
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final AsyncSleeper asyncSleeper;
    private final List<RetryListener> listeners;

    public RetryExecutor(RetryPolicy policy) {
        this(builder(policy));
    }

    private RetryExecutor(Builder b) {
        this.policy = b.policy;
        this.backoff = b.backoff != null ? b.backoff : BackoffPolicies.create(b.policy, b.mode, b.random);
        this.sleeper = b.sleeper;
        this.asyncSleeper = b.asyncSleeper;
        List<RetryListener> all = new ArrayList<>();
        all.add(b.policy.asListener());
        all.addAll(b.listeners);
        this.listeners = Collections.unmodifiableList(all);
    }

    public static Builder builder(RetryPolicy policy) {
        return new Builder(policy);
    }

    /**
     * 执行操作直到成功或到达终态
     *
     * @return 操作返回值
     * @throws xyz.firestige.retry.exception.MaxRetriesExceededException 可重试失败耗尽全部尝试
     * @throws InterruptedException 等待期间被中断
     * @throws Exception 不可重试的失败，原样抛出
     */
    public <T> T call(Callable<T> operation) throws Exception {
        return execute(operation).getOrThrow();
    }

    /**
     * 执行操作并以 {@link RetryOutcome} 返回终态，失败不抛出
     *
     * @throws InterruptedException 等待期间被中断
     */
    public <T> RetryOutcome<T> execute(Callable<T> operation) throws InterruptedException {
        Objects.requireNonNull(operation, "operation");
        RetryAttempt attempt = new RetryAttempt();
        while (true) {
            int n = attempt.begin();
            T result;
            try {
                result = operation.call();
            } catch (Exception e) {
                RetryOutcome<T> terminal = handleFailure(attempt, e);
                if (terminal != null) {
                    return terminal;
                }
                Duration delay = nextDelay(attempt, e);
                suspend(delay, n);
                attempt.waited(delay);
                continue;
            }
            return succeed(attempt, result);
        }
    }

    /**
     * 协作式执行：等待通过 {@link AsyncSleeper} 完成，不阻塞调用线程
     * <p>
     * 操作同步抛出的异常与返回 stage 的异常完成同等对待。
     * 返回的 future 被取消后不再发起新的尝试；等待以 {@link CancellationException} 结束时，
     * 返回的 future 以该异常结束。
     */
    public <T> CompletableFuture<T> callAsync(Supplier<? extends CompletionStage<T>> operation) {
        Objects.requireNonNull(operation, "operation");
        CompletableFuture<T> result = new CompletableFuture<>();
        attemptAsync(operation, new RetryAttempt(), result);
        return result;
    }

    /**
     * 异步重试主循环
     * <p>
     * 已完成的 stage 与等待在当前栈上迭代处理，只有尚未完成时才挂接回调并返回，栈深度不随尝试次数增长。
     * 任何 Throwable（包括 Error）都会让 result 异常结束。
     */
    private <T> void attemptAsync(Supplier<? extends CompletionStage<T>> operation,
                                  RetryAttempt attempt, CompletableFuture<T> result) {
        try {
            while (!result.isDone()) {
                int n = attempt.begin();
                CompletableFuture<T> stage = invokeAsync(operation);
                if (!stage.isDone()) {
                    stage.whenComplete((value, error) -> {
                        try {
                            Duration delay = afterAttempt(attempt, value, error, result);
                            if (delay != null && awaitDelay(operation, attempt, result, delay, n)) {
                                attemptAsync(operation, attempt, result);
                            }
                        } catch (Throwable t) {
                            result.completeExceptionally(t);
                        }
                    });
                    return;
                }
                Duration delay = afterAttempt(attempt, valueOf(stage), failureOf(stage), result);
                if (delay == null || !awaitDelay(operation, attempt, result, delay, n)) {
                    return;
                }
            }
            log.debug("调用方已取消，停止重试: attempts={}", attempt.count());
        } catch (Throwable t) {
            result.completeExceptionally(t);
        }
    }

    private static <T> CompletableFuture<T> invokeAsync(Supplier<? extends CompletionStage<T>> operation) {
        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(operation.get(), "operation returned null stage");
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
        return asFuture(stage);
    }

    /**
     * 处理一次尝试的结果
     *
     * @return 下一次尝试前的等待时长；null 表示已到达终态，result 已结束
     */
    private <T> Duration afterAttempt(RetryAttempt attempt, T value, Throwable error, CompletableFuture<T> result) {
        if (error == null) {
            RetryOutcome<T> outcome = succeed(attempt, value);
            result.complete(outcome.getValue());
            return null;
        }
        Throwable failure = unwrap(error);
        RetryOutcome<T> terminal = handleFailure(attempt, failure);
        if (terminal != null) {
            result.completeExceptionally(terminal.isExhausted()
                ? new MaxRetriesExceededException(failure, terminal.getAttempts())
                : failure);
            return null;
        }
        return nextDelay(attempt, failure);
    }

    /**
     * 发起等待
     *
     * @return true 表示等待已结束，调用方继续下一次尝试；false 表示已挂接回调或序列已终止
     */
    private <T> boolean awaitDelay(Supplier<? extends CompletionStage<T>> operation, RetryAttempt attempt,
                                   CompletableFuture<T> result, Duration delay, int n) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        CompletableFuture<Void> wait;
        try {
            wait = asFuture(asyncSleeper.sleep(delay));
        } catch (RuntimeException e) {
            log.debug("挂起失败，忽略并继续下一次尝试: attempt={}", n, e);
            wait = CompletableFuture.completedFuture(null);
        }
        if (!wait.isDone()) {
            wait.whenComplete((v, sleepError) -> {
                try {
                    if (afterWait(attempt, result, delay, sleepError, n)) {
                        attemptAsync(operation, attempt, result);
                    }
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
            return false;
        }
        return afterWait(attempt, result, delay, failureOf(wait), n);
    }

    private boolean afterWait(RetryAttempt attempt, CompletableFuture<?> result, Duration delay,
                              Throwable sleepError, int n) {
        if (sleepError != null) {
            Throwable cause = unwrap(sleepError);
            if (isInterruption(cause)) {
                log.info("重试等待被取消，终止重试序列: attempt={}", n);
                result.completeExceptionally(cause);
                return false;
            }
            log.debug("等待异常结束，忽略并继续下一次尝试: attempt={}", n, cause);
        }
        attempt.waited(delay);
        return true;
    }

    private static <V> CompletableFuture<V> asFuture(CompletionStage<V> stage) {
        try {
            return stage.toCompletableFuture();
        } catch (UnsupportedOperationException e) {
            CompletableFuture<V> future = new CompletableFuture<>();
            stage.whenComplete((v, error) -> {
                if (error != null) {
                    future.completeExceptionally(error);
                } else {
                    future.complete(v);
                }
            });
            return future;
        }
    }

    /**
     * 已完成 future 的值，异常结束时为 null
     */
    private static <V> V valueOf(CompletableFuture<V> done) {
        return done.isCompletedExceptionally() ? null : done.getNow(null);
    }

    /**
     * 已完成 future 的异常，正常结束时为 null
     */
    private static Throwable failureOf(CompletableFuture<?> done) {
        if (!done.isCompletedExceptionally()) {
            return null;
        }
        try {
            done.join();
        } catch (CompletionException | CancellationException e) {
            return e;
        }
        return null;
    }

    private <T> RetryOutcome<T> succeed(RetryAttempt attempt, T result) {
        attempt.succeed();
        RetryOutcome<T> outcome = RetryOutcome.success(result, attempt.count(), attempt.cumulativeDelay());
        for (RetryListener listener : listeners) {
            notifySafely("onSuccess", () -> listener.onSuccess(result, attempt.count()));
        }
        complete(outcome);
        return outcome;
    }

    /**
     * 失败分类与次数判断
     *
     * @return 终态结果；null 表示需要重试
     */
    private <T> RetryOutcome<T> handleFailure(RetryAttempt attempt, Throwable failure) {
        int n = attempt.count();
        RetryOutcome<T> outcome;
        if (!isRetryable(failure)) {
            log.debug("不可重试的失败: attempt={}, error={}", n, failure.toString());
            outcome = RetryOutcome.nonRetryable(failure, n, attempt.cumulativeDelay());
        } else if (n >= policy.getMaxAttempts()) {
            log.debug("重试次数耗尽: attempts={}/{}, error={}", n, policy.getMaxAttempts(), failure.toString());
            outcome = RetryOutcome.exhausted(failure, n, attempt.cumulativeDelay());
        } else {
            return null;
        }
        attempt.fail(failure);
        for (RetryListener listener : listeners) {
            notifySafely("onFailure", () -> listener.onFailure(failure, n));
        }
        complete(outcome);
        return outcome;
    }

    private Duration nextDelay(RetryAttempt attempt, Throwable failure) {
        int n = attempt.count();
        Duration delay = backoff.delay(n);
        attempt.retry(failure);
        log.debug("准备重试: attempt={}/{}, delay={}, error={}", n, policy.getMaxAttempts(), delay, failure.toString());
        for (RetryListener listener : listeners) {
            notifySafely("onRetry", () -> listener.onRetry(failure, n, delay));
        }
        return delay;
    }

    private void complete(RetryOutcome<?> outcome) {
        for (RetryListener listener : listeners) {
            notifySafely("onComplete", () -> listener.onComplete(outcome));
        }
    }

    private boolean isRetryable(Throwable failure) {
        if (isInterruption(failure)) {
            return false;
        }
        return policy.getRetryPredicate().isRetryable(failure);
    }

    private void suspend(Duration delay, int attempt) throws InterruptedException {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            log.info("重试等待被中断，终止重试序列: attempt={}", attempt);
            throw e;
        } catch (RuntimeException e) {
            log.debug("等待期间出现异常，忽略并继续下一次尝试: attempt={}", attempt, e);
        }
    }

    private static void notifySafely(String callback, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("重试回调 {} 执行异常，已忽略", callback, e);
        }
    }

    private static boolean isInterruption(Throwable failure) {
        return failure instanceof InterruptedException || failure instanceof CancellationException;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public BackoffPolicy getBackoff() {
        return backoff;
    }

    /**
     * {@link RetryExecutor} 构建器
     */
    public static final class Builder {

        private final RetryPolicy policy;
        private BackoffPolicy backoff;
        private BackoffPolicies.Mode mode = BackoffPolicies.Mode.REFERENCE;
        private DoubleSupplier random = AbstractBackoffPolicy.threadLocalRandom();
        private Sleeper sleeper = ThreadSleeper.INSTANCE;
        private AsyncSleeper asyncSleeper = new ScheduledAsyncSleeper();
        private final List<RetryListener> listeners = new ArrayList<>();

        private Builder(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
        }

        /**
         * 直接指定退避实现，忽略 mode 与 random
         */
        public Builder backoff(BackoffPolicy backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder backoffMode(BackoffPolicies.Mode mode) {
            this.mode = Objects.requireNonNull(mode);
            return this;
        }

        public Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random);
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper);
            return this;
        }

        public Builder asyncSleeper(AsyncSleeper asyncSleeper) {
            this.asyncSleeper = Objects.requireNonNull(asyncSleeper);
            return this;
        }

        public Builder listener(RetryListener listener) {
            this.listeners.add(Objects.requireNonNull(listener));
            return this;
        }

        public Builder listeners(Collection<? extends RetryListener> listeners) {
            listeners.forEach(this::listener);
            return this;
        }

        public RetryExecutor build() {
            return new RetryExecutor(this);
        }
    }
}
