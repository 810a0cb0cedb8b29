package xyz.firestige.retry.backoff;

/**
 * 查表实现
 * <p>
 * 构造时预先计算 1..size 次尝试的原始延迟，运行时只做数组查找和抖动混合；
 * 超出表长的尝试回退到参考实现。结果与参考实现逐位一致。
 *
 * @author AI
 * @since 1.0
 */
public class PrecomputedBackoffPolicy extends AbstractBackoffPolicy {

    static final int MAX_TABLE_SIZE = 1024;

    private final AbstractBackoffPolicy reference;
    private final double[] rawNanos;

    public PrecomputedBackoffPolicy(AbstractBackoffPolicy reference, int size) {
        super(reference.getJitterFactor(), reference.random());
        if (size < 1) {
            throw new IllegalArgumentException("size must be >= 1");
        }
        this.reference = reference;
        this.rawNanos = new double[Math.min(size, MAX_TABLE_SIZE)];
        for (int i = 0; i < rawNanos.length; i++) {
            rawNanos[i] = reference.rawDelayNanos(i + 1);
        }
    }

    @Override
    protected double rawDelayNanos(int attempt) {
        if (attempt <= rawNanos.length) {
            return rawNanos[attempt - 1];
        }
        return reference.rawDelayNanos(attempt);
    }

    public int tableSize() {
        return rawNanos.length;
    }
}
