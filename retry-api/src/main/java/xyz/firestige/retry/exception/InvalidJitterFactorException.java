package xyz.firestige.retry.exception;

/**
 * 抖动因子非法异常
 * <p>
 * jitterFactor 为 NaN 时在首次计算延迟时抛出；越界的数值会被静默截断到 [0, 1]，不会触发此异常。
 *
 * @author AI
 * @since 1.0
 */
public class InvalidJitterFactorException extends RetryException {

    private final double jitterFactor;

    public InvalidJitterFactorException(double jitterFactor) {
        super("jitter factor must be a number, got " + jitterFactor);
        this.jitterFactor = jitterFactor;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
