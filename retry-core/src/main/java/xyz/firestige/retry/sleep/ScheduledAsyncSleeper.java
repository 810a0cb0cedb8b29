package xyz.firestige.retry.sleep;

import xyz.firestige.retry.api.AsyncSleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 基于调度线程池的协作式挂起
 * <p>
 * 不传入调度器时使用 {@link CompletableFuture#delayedExecutor} 的共享定时线程。
 * 返回的 stage 被取消时会一并取消已提交的定时任务。
 *
 * @author AI
 * @since 1.0
 */
public class ScheduledAsyncSleeper implements AsyncSleeper {

    private final ScheduledExecutorService scheduler;

    public ScheduledAsyncSleeper() {
        this.scheduler = null;
    }

    public ScheduledAsyncSleeper(ScheduledExecutorService scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler);
    }

    @Override
    public CompletionStage<Void> sleep(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        long nanos = saturatedNanos(delay);
        if (scheduler == null) {
            return CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(nanos, TimeUnit.NANOSECONDS));
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        try {
            ScheduledFuture<?> task = scheduler.schedule(() -> future.complete(null), nanos, TimeUnit.NANOSECONDS);
            future.whenComplete((v, e) -> {
                if (future.isCancelled()) {
                    task.cancel(false);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    static long saturatedNanos(Duration delay) {
        try {
            return delay.toNanos();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }
}
