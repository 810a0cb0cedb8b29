package xyz.firestige.retry.core;

import org.junit.jupiter.api.Test;
import xyz.firestige.retry.api.AsyncSleeper;
import xyz.firestige.retry.api.RetryPolicy;
import xyz.firestige.retry.exception.MaxRetriesExceededException;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 协作式重试：等待通过 AsyncSleeper 完成
 */
class RetryExecutorAsyncTest {

    private final List<Duration> waits = new CopyOnWriteArrayList<>();

    /**
     * 记录等待时长并立即完成
     */
    private final AsyncSleeper instantSleeper = delay -> {
        waits.add(delay);
        return CompletableFuture.completedFuture(null);
    };

    private RetryExecutor executor(RetryPolicy policy, AsyncSleeper sleeper) {
        return RetryExecutor.builder(policy).asyncSleeper(sleeper).build();
    }

    private static RetryPolicy.Builder noJitter() {
        return RetryPolicy.builder().jitterFactor(0.0);
    }

    @Test
    void succeedsAfterFailedStages() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = executor(noJitter().maxAttempts(3).build(), instantSleeper).callAsync(() -> {
            if (calls.incrementAndGet() < 3) {
                return CompletableFuture.failedFuture(new IOException("transient"));
            }
            return CompletableFuture.completedFuture("ok");
        });

        assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(waits).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    void synchronousThrowIsTreatedAsFailure() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = executor(noJitter().maxAttempts(2).build(), instantSleeper).callAsync(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("sync");
            }
            return CompletableFuture.completedFuture("second");
        });

        assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("second");
    }

    @Test
    void exhaustionCompletesWithMaxRetriesExceeded() {
        CompletableFuture<String> result = executor(noJitter().maxAttempts(2).build(), instantSleeper)
            .callAsync(() -> CompletableFuture.failedFuture(new IOException("Always fails")));

        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(MaxRetriesExceededException.class)
            .hasRootCauseMessage("Always fails");
    }

    @Test
    void nonRetryableCompletesWithOriginalFailure() {
        AtomicInteger calls = new AtomicInteger();
        IllegalArgumentException failure = new IllegalArgumentException("bad");

        CompletableFuture<String> result = executor(noJitter().maxAttempts(4).retryOn(IOException.class).build(), instantSleeper)
            .callAsync(() -> {
                calls.incrementAndGet();
                return CompletableFuture.failedFuture(failure);
            });

        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCause(failure);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(waits).isEmpty();
    }

    @Test
    void cancelledWaitAbortsSequence() {
        AtomicInteger calls = new AtomicInteger();
        AsyncSleeper cancelled = delay -> CompletableFuture.failedFuture(new CancellationException("shutdown"));

        CompletableFuture<String> result = executor(noJitter().maxAttempts(5).build(), cancelled)
            .callAsync(() -> {
                calls.incrementAndGet();
                return CompletableFuture.failedFuture(new IOException("x"));
            });

        assertThat(result).isCompletedExceptionally();
        assertThatThrownBy(result::join).isInstanceOf(CancellationException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void otherWaitFailuresAreSwallowed() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AsyncSleeper broken = delay -> CompletableFuture.failedFuture(new IllegalStateException("timer broken"));

        CompletableFuture<String> result = executor(noJitter().maxAttempts(3).build(), broken).callAsync(() -> {
            if (calls.incrementAndGet() < 3) {
                return CompletableFuture.failedFuture(new IOException("x"));
            }
            return CompletableFuture.completedFuture("ok");
        });

        assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("ok");
    }

    @Test
    void cancellingResultStopsFurtherAttempts() {
        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<Void> gate = new CompletableFuture<>();
        AsyncSleeper gated = delay -> gate;

        CompletableFuture<String> result = executor(noJitter().maxAttempts(5).build(), gated).callAsync(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new IOException("x"));
        });
        result.cancel(false);
        gate.complete(null);

        assertThat(result).isCancelled();
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void manyZeroDelayAttemptsCompleteWithoutGrowingStack() {
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = executor(noJitter().maxAttempts(10_000).baseDelay(Duration.ZERO).build(), instantSleeper)
            .callAsync(() -> {
                calls.incrementAndGet();
                return CompletableFuture.failedFuture(new IOException("x"));
            });

        assertThat(result).isDone();
        assertThatThrownBy(result::join).hasCauseInstanceOf(MaxRetriesExceededException.class);
        assertThat(calls.get()).isEqualTo(10_000);
        assertThat(waits).isEmpty();
    }

    @Test
    void manyCompletedWaitsCompleteWithoutGrowingStack() {
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = executor(noJitter().maxAttempts(5_000).baseDelay(Duration.ofMillis(1)).build(), instantSleeper)
            .callAsync(() -> {
                if (calls.incrementAndGet() < 5_000) {
                    return CompletableFuture.failedFuture(new IOException("x"));
                }
                return CompletableFuture.completedFuture("last");
            });

        assertThat(result).isCompletedWithValue("last");
        assertThat(waits).hasSize(4_999);
    }

    @Test
    void errorOnLaterAttemptCompletesFuture() {
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = executor(noJitter().maxAttempts(3).build(), instantSleeper).callAsync(() -> {
            if (calls.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(new IOException("x"));
            }
            throw new AssertionError("fatal");
        });

        assertThat(result).isCompletedExceptionally();
        assertThatThrownBy(result::join).hasCauseInstanceOf(AssertionError.class);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void errorAfterPendingStageCompletesFuture() {
        CompletableFuture<String> pending = new CompletableFuture<>();
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = executor(noJitter().maxAttempts(3).build(), instantSleeper).callAsync(() -> {
            if (calls.incrementAndGet() == 1) {
                return pending;
            }
            throw new AssertionError("fatal");
        });
        pending.completeExceptionally(new IOException("late"));

        assertThatThrownBy(result::join).hasCauseInstanceOf(AssertionError.class);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void listenerErrorCompletesFuture() {
        RetryPolicy policy = noJitter()
            .maxAttempts(3)
            .onRetry((failure, attempt, delay) -> {
                throw new AssertionError("observer");
            })
            .build();

        CompletableFuture<String> result = executor(policy, instantSleeper)
            .callAsync(() -> CompletableFuture.failedFuture(new IOException("x")));

        assertThatThrownBy(result::join).hasCauseInstanceOf(AssertionError.class);
    }
}
