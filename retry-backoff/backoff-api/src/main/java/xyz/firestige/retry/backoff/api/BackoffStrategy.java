package xyz.firestige.retry.backoff.api;

import java.time.Duration;

/**
 * 退避策略接口
 * <p>
 * 有状态的延迟序列生成器：每次调用 {@link #nextDelay()} 返回下一次重试前需要等待的时长并推进内部游标，
 * {@link #reset()} 将游标恢复到构造时的状态。
 * <p>
 * <b>线程安全</b>：实现不加锁。同一实例同一时刻只能被一次 {@code execute} 调用持有；
 * 需要并发执行独立重试序列的调用方必须为每次调用创建新的实例（或使用工厂）。
 *
 * @since 1.0
 */
public interface BackoffStrategy {

    /**
     * 返回下一次重试前的等待时长，并推进内部状态
     *
     * @return 等待时长，不为 null
     */
    Duration nextDelay();

    /**
     * 恢复到初始状态
     */
    void reset();
}
