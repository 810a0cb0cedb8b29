package xyz.firestige.retry.exception;

/**
 * 命名策略不存在
 *
 * @author AI
 * @since 1.0
 */
public class UnknownPolicyException extends RetryException {

    private final String policyName;

    public UnknownPolicyException(String policyName) {
        super("Policy '" + policyName + "' not found.");
        this.policyName = policyName;
    }

    public String getPolicyName() {
        return policyName;
    }
}
