package xyz.firestige.retry.api;

/**
 * 成功回调
 */
@FunctionalInterface
public interface SuccessCallback {

    void onSuccess(Object result, int attempts);
}
