package xyz.firestige.retry.sleep;

import xyz.firestige.retry.api.Sleeper;

import java.time.Duration;

/**
 * 阻塞当前线程的挂起实现（默认）
 * <p>
 * 亚毫秒部分以纳秒参数传给 {@link Thread#sleep(long, int)}：正的延迟不会被截断为 0，
 * 但 JDK 17 会把非零的纳秒部分向上取整为 1ms，实际等待精度为毫秒级。
 */
public final class ThreadSleeper implements Sleeper {

    public static final ThreadSleeper INSTANCE = new ThreadSleeper();

    @Override
    public void sleep(Duration delay) throws InterruptedException {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        long millis;
        int nanos;
        try {
            long total = delay.toNanos();
            millis = total / 1_000_000L;
            nanos = (int) (total % 1_000_000L);
        } catch (ArithmeticException overflow) {
            millis = Long.MAX_VALUE;
            nanos = 0;
        }
        Thread.sleep(millis, nanos);
    }
}
