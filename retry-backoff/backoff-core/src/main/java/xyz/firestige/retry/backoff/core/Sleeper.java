package xyz.firestige.retry.backoff.core;

import java.time.Duration;

/**
 * 阻塞等待
 * <p>
 * 中断时必须抛出 {@link InterruptedException}，不得吞掉。
 *
 * @since 1.0
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /**
     * 基于 {@link Thread#sleep(long, int)} 的默认实现
     * <p>
     * 超过 {@code Long.MAX_VALUE} 毫秒的时长按 {@code Long.MAX_VALUE} 毫秒等待
     */
    static Sleeper threadSleeper() {
        return duration -> {
            if (duration.isZero()) {
                return;
            }
            if (duration.compareTo(Duration.ofMillis(Long.MAX_VALUE)) >= 0) {
                Thread.sleep(Long.MAX_VALUE);
                return;
            }
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
        };
    }
}
