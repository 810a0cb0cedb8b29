package xyz.firestige.retry.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.retry.api.PolicyRegistry;
import xyz.firestige.retry.api.RetryPolicy;
import xyz.firestige.retry.exception.UnknownPolicyException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存的命名策略注册表
 * <p>
 * 始终包含名为 {@value PolicyRegistry#DEFAULT_POLICY_NAME} 的默认策略，默认策略可被替换但不可删除。
 *
 * @author AI
 * @since 1.0
 */
public class InMemoryPolicyRegistry implements PolicyRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPolicyRegistry.class);

    private final RetryPolicy initialDefault;
    private final Map<String, RetryPolicy> policies = new ConcurrentHashMap<>();

    public InMemoryPolicyRegistry() {
        this(RetryPolicy.defaults());
    }

    public InMemoryPolicyRegistry(RetryPolicy defaultPolicy) {
        this.initialDefault = Objects.requireNonNull(defaultPolicy, "defaultPolicy");
        policies.put(DEFAULT_POLICY_NAME, initialDefault);
    }

    @Override
    public RetryPolicy getPolicy(String name) {
        return findPolicy(name).orElseThrow(() -> new UnknownPolicyException(name));
    }

    @Override
    public Optional<RetryPolicy> findPolicy(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(policies.get(name));
    }

    @Override
    public Optional<RetryPolicy> register(String name, RetryPolicy policy) {
        checkName(name);
        Objects.requireNonNull(policy, "policy");
        RetryPolicy previous = policies.put(name, policy);
        log.info("注册重试策略: name={}, policy={}, replaced={}", name, policy, previous != null);
        return Optional.ofNullable(previous);
    }

    @Override
    public Optional<RetryPolicy> remove(String name) {
        if (DEFAULT_POLICY_NAME.equals(name)) {
            throw new IllegalArgumentException("default policy cannot be removed");
        }
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(policies.remove(name));
    }

    @Override
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(policies.keySet()));
    }

    @Override
    public void reset() {
        policies.clear();
        policies.put(DEFAULT_POLICY_NAME, initialDefault);
        log.debug("策略注册表已重置");
    }

    private static void checkName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("policy name must not be blank");
        }
    }
}
