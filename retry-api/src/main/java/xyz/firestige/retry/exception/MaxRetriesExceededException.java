package xyz.firestige.retry.exception;

/**
 * 重试次数耗尽异常
 * <p>
 * 仅在所有尝试都以可重试失败结束时抛出，携带最后一次的原始异常与总尝试次数。
 * 原始异常同时作为 {@link #getCause()} 暴露。
 *
 * @author AI
 * @since 1.0
 */
public class MaxRetriesExceededException extends RetryException {

    private final Throwable originalException;
    private final int attempts;

    public MaxRetriesExceededException(Throwable originalException, int attempts) {
        super(buildMessage(originalException, attempts), originalException);
        this.originalException = originalException;
        this.attempts = attempts;
    }

    private static String buildMessage(Throwable original, int attempts) {
        if (original == null) {
            return "Max retries (" + attempts + ") exceeded.";
        }
        return "Max retries (" + attempts + ") exceeded. Original error: "
            + original.getClass().getName() + ": " + original.getMessage();
    }

    public Throwable getOriginalException() {
        return originalException;
    }

    public int getAttempts() {
        return attempts;
    }
}
