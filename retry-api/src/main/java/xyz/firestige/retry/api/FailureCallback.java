package xyz.firestige.retry.api;

/**
 * 最终失败回调（不可重试或次数耗尽）
 */
@FunctionalInterface
public interface FailureCallback {

    void onFailure(Throwable failure, int attempts);
}
