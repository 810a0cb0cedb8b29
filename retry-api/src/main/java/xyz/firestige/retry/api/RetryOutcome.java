package xyz.firestige.retry.api;

import xyz.firestige.retry.exception.MaxRetriesExceededException;
import xyz.firestige.retry.exception.RetryException;

import java.time.Duration;
import java.util.Objects;

/**
 * 一次重试调用的终态结果
 *
 * <ul>
 *   <li>{@link Kind#SUCCESS} - 操作成功，携带返回值</li>
 *   <li>{@link Kind#EXHAUSTED} - 可重试失败耗尽全部尝试，携带最后一次失败</li>
 *   <li>{@link Kind#NON_RETRYABLE} - 出现不可重试失败，立即终止</li>
 * </ul>
 *
 * @param <T> 操作返回值类型
 * @author AI
 * @since 1.0
 */
public final class RetryOutcome<T> {

    public enum Kind {
        SUCCESS,
        EXHAUSTED,
        NON_RETRYABLE
    }

    private final Kind kind;
    private final T value;
    private final Throwable failure;
    private final int attempts;
    private final Duration cumulativeDelay;

    private RetryOutcome(Kind kind, T value, Throwable failure, int attempts, Duration cumulativeDelay) {
        this.kind = kind;
        this.value = value;
        this.failure = failure;
        this.attempts = attempts;
        this.cumulativeDelay = cumulativeDelay == null ? Duration.ZERO : cumulativeDelay;
    }

    public static <T> RetryOutcome<T> success(T value, int attempts, Duration cumulativeDelay) {
        return new RetryOutcome<>(Kind.SUCCESS, value, null, attempts, cumulativeDelay);
    }

    public static <T> RetryOutcome<T> exhausted(Throwable lastFailure, int attempts, Duration cumulativeDelay) {
        return new RetryOutcome<>(Kind.EXHAUSTED, null, Objects.requireNonNull(lastFailure), attempts, cumulativeDelay);
    }

    public static <T> RetryOutcome<T> nonRetryable(Throwable failure, int attempts, Duration cumulativeDelay) {
        return new RetryOutcome<>(Kind.NON_RETRYABLE, null, Objects.requireNonNull(failure), attempts, cumulativeDelay);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isExhausted() {
        return kind == Kind.EXHAUSTED;
    }

    public boolean isNonRetryable() {
        return kind == Kind.NON_RETRYABLE;
    }

    /**
     * 成功时的返回值，失败时为 null
     */
    public T getValue() {
        return value;
    }

    /**
     * 失败时的原始异常（EXHAUSTED 时为最后一次失败），成功时为 null
     */
    public Throwable getFailure() {
        return failure;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * 本次调用累计等待的时长
     */
    public Duration getCumulativeDelay() {
        return cumulativeDelay;
    }

    /**
     * 按终态返回值或抛出异常
     * <ul>
     *   <li>SUCCESS - 返回值</li>
     *   <li>NON_RETRYABLE - 原样抛出原始异常</li>
     *   <li>EXHAUSTED - 抛出 {@link MaxRetriesExceededException}</li>
     * </ul>
     */
    public T getOrThrow() throws Exception {
        switch (kind) {
            case SUCCESS:
                return value;
            case EXHAUSTED:
                throw new MaxRetriesExceededException(failure, attempts);
            default:
                if (failure instanceof Exception) {
                    throw (Exception) failure;
                }
                if (failure instanceof Error) {
                    throw (Error) failure;
                }
                throw new RetryException("non-retryable failure", failure);
        }
    }

    @Override
    public String toString() {
        return "RetryOutcome{kind=" + kind + ", attempts=" + attempts
            + ", cumulativeDelay=" + cumulativeDelay
            + (failure != null ? ", failure=" + failure : "") + '}';
    }
}
