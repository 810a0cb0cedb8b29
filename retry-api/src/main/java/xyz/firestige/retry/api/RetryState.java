package xyz.firestige.retry.api;

/**
 * 单次调用的重试状态
 *
 * <pre>
 * RUNNING ──成功──→ SUCCEEDED
 * RUNNING ──失败──→ FAILED
 * RUNNING ──可重试─→ RETRYING ──等待结束─→ RUNNING
 * </pre>
 *
 * @author AI
 * @since 1.0
 */
public enum RetryState {

    RUNNING,
    RETRYING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public boolean canTransitionTo(RetryState target) {
        switch (this) {
            case RUNNING:
                return target == SUCCEEDED || target == FAILED || target == RETRYING;
            case RETRYING:
                return target == RUNNING;
            default:
                return false;
        }
    }
}
