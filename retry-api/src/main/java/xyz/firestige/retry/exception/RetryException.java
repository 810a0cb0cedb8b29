package xyz.firestige.retry.exception;

/**
 * 重试引擎基础异常
 *
 * @author AI
 * @since 1.0
 */
public class RetryException extends RuntimeException {

    public RetryException(String message) {
        super(message);
    }

    public RetryException(String message, Throwable cause) {
        super(message, cause);
    }
}
