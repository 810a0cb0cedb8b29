package xyz.firestige.retry.api;

import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * 协作式挂起原语
 *
 * <p>不阻塞任何线程，返回在延迟结束后完成的 stage，由调度器在完成时恢复同一次逻辑调用。
 * 以 {@link java.util.concurrent.CancellationException} 完成表示中断，执行器会立即终止重试序列；
 * 以其他异常完成时视为等待正常结束。
 *
 * @author AI
 * @since 1.0
 */
@FunctionalInterface
public interface AsyncSleeper {

    CompletionStage<Void> sleep(Duration delay);
}
