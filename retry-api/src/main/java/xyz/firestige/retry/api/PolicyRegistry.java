package xyz.firestige.retry.api;

import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * 命名策略注册表
 *
 * <p>启动时创建并注册策略，之后只读；{@link #reset()} 仅供测试脚手架恢复初始状态使用。
 *
 * @author AI
 * @since 1.0
 */
public interface PolicyRegistry {

    String DEFAULT_POLICY_NAME = "default";

    /**
     * 按名称获取策略
     *
     * @throws xyz.firestige.retry.exception.UnknownPolicyException 策略不存在
     */
    RetryPolicy getPolicy(String name);

    Optional<RetryPolicy> findPolicy(String name);

    /**
     * 注册或替换策略
     *
     * @return 被替换的旧策略
     */
    Optional<RetryPolicy> register(String name, RetryPolicy policy);

    /**
     * 在默认策略的基础上覆盖部分字段后注册
     */
    default RetryPolicy define(String name, UnaryOperator<RetryPolicy.Builder> overrides) {
        RetryPolicy policy = overrides.apply(getDefaultPolicy().toBuilder()).build();
        register(name, policy);
        return policy;
    }

    Optional<RetryPolicy> remove(String name);

    Set<String> names();

    default RetryPolicy getDefaultPolicy() {
        return getPolicy(DEFAULT_POLICY_NAME);
    }

    /**
     * 恢复到只包含默认策略的初始状态
     */
    void reset();
}
