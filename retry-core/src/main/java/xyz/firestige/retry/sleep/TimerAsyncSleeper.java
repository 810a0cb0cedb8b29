package xyz.firestige.retry.sleep;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.retry.api.AsyncSleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 基于时间轮的协作式挂起
 * <p>
 * 大量并发重试共享一个 {@link HashedWheelTimer} 线程，等待期间不占用业务线程。
 * 精度受 tick 限制，适合毫秒级以上的退避。
 *
 * @author AI
 * @since 1.0
 */
public class TimerAsyncSleeper implements AsyncSleeper, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimerAsyncSleeper.class);

    private final Timer timer;
    private final boolean ownsTimer;

    public TimerAsyncSleeper() {
        this(10, 512);
    }

    public TimerAsyncSleeper(long tickMs, int wheelSize) {
        this(new HashedWheelTimer(
                r -> { Thread t = new Thread(r, "retry-wheel"); t.setDaemon(true); return t; },
                tickMs, TimeUnit.MILLISECONDS, wheelSize), true);
    }

    public TimerAsyncSleeper(Timer timer) {
        this(timer, false);
    }

    private TimerAsyncSleeper(Timer timer, boolean ownsTimer) {
        this.timer = Objects.requireNonNull(timer);
        this.ownsTimer = ownsTimer;
    }

    @Override
    public CompletionStage<Void> sleep(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        try {
            Timeout timeout = timer.newTimeout(t -> future.complete(null),
                ScheduledAsyncSleeper.saturatedNanos(delay), TimeUnit.NANOSECONDS);
            future.whenComplete((v, e) -> {
                if (future.isCancelled()) {
                    timeout.cancel();
                }
            });
        } catch (IllegalStateException | RejectedExecutionException e) {
            // 时间轮已停止或等待任务过多
            future.completeExceptionally(e);
        }
        return future;
    }

    @Override
    public void close() {
        if (ownsTimer) {
            int pending = timer.stop().size();
            log.info("TimerAsyncSleeper 已关闭, 未触发的等待数={}", pending);
        }
    }
}
