package xyz.firestige.retry.api;

import java.time.Duration;

/**
 * 阻塞式挂起原语
 *
 * <p>阻塞当前线程直到延迟结束。中断必须以 {@link InterruptedException} 抛出；
 * 其他异常由执行器吞掉并视为等待正常结束。
 *
 * @author AI
 * @since 1.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * @param delay 等待时长，&lt;= 0 时不得挂起
     * @throws InterruptedException 等待期间线程被中断
     */
    void sleep(Duration delay) throws InterruptedException;
}
