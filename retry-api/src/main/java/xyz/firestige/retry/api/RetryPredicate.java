package xyz.firestige.retry.api;

import java.util.List;
import java.util.Objects;

/**
 * 失败分类：判断一次失败是否应当重试
 *
 * @author AI
 * @since 1.0
 */
@FunctionalInterface
public interface RetryPredicate {

    boolean isRetryable(Throwable failure);

    /**
     * 默认分类：所有 {@link Exception} 都可重试
     */
    static RetryPredicate all() {
        return failure -> failure instanceof Exception;
    }

    /**
     * 仅当失败是给定类型之一（含子类）时重试
     */
    @SafeVarargs
    static RetryPredicate anyOf(Class<? extends Throwable>... kinds) {
        return anyOf(List.of(kinds));
    }

    static RetryPredicate anyOf(List<Class<? extends Throwable>> kinds) {
        List<Class<? extends Throwable>> copy = List.copyOf(kinds);
        return failure -> failure != null && copy.stream().anyMatch(k -> k.isInstance(failure));
    }

    default RetryPredicate and(RetryPredicate other) {
        Objects.requireNonNull(other);
        return failure -> isRetryable(failure) && other.isRetryable(failure);
    }

    default RetryPredicate negate() {
        return failure -> !isRetryable(failure);
    }
}
