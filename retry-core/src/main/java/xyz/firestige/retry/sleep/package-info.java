/**
 * 挂起原语
 *
 * <ul>
 *   <li>{@link xyz.firestige.retry.sleep.ThreadSleeper} - 阻塞当前线程</li>
 *   <li>{@link xyz.firestige.retry.sleep.ScheduledAsyncSleeper} - 基于调度线程池的协作式等待</li>
 *   <li>{@link xyz.firestige.retry.sleep.TimerAsyncSleeper} - 基于时间轮的协作式等待</li>
 * </ul>
 */
package xyz.firestige.retry.sleep;
