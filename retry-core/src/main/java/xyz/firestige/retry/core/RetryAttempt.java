package xyz.firestige.retry.core;

import xyz.firestige.retry.api.RetryState;

import java.time.Duration;

/**
 * 单次调用的尝试状态
 * <p>
 * 仅存在于一次 call 的生命周期内，由执行该调用的栈帧独占，不在并发调用之间共享。
 */
final class RetryAttempt {

    private int count;
    private Throwable lastFailure;
    private Duration cumulativeDelay = Duration.ZERO;
    private RetryState state = RetryState.RUNNING;

    /**
     * 开始下一次尝试
     *
     * @return 递增后的尝试次数
     */
    int begin() {
        if (state == RetryState.RETRYING) {
            transition(RetryState.RUNNING);
        } else if (state != RetryState.RUNNING) {
            throw new IllegalStateException("attempt already finished: " + state);
        }
        return ++count;
    }

    void succeed() {
        transition(RetryState.SUCCEEDED);
    }

    void fail(Throwable failure) {
        this.lastFailure = failure;
        transition(RetryState.FAILED);
    }

    void retry(Throwable failure) {
        this.lastFailure = failure;
        transition(RetryState.RETRYING);
    }

    void waited(Duration delay) {
        if (delay != null && !delay.isNegative()) {
            cumulativeDelay = cumulativeDelay.plus(delay);
        }
    }

    int count() {
        return count;
    }

    Throwable lastFailure() {
        return lastFailure;
    }

    Duration cumulativeDelay() {
        return cumulativeDelay;
    }

    RetryState state() {
        return state;
    }

    private void transition(RetryState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("illegal retry state transition: " + state + " -> " + target);
        }
        state = target;
    }
}
