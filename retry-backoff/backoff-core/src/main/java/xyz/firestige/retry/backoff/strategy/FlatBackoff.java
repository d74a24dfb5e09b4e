package xyz.firestige.retry.backoff.strategy;

import xyz.firestige.retry.backoff.api.BackoffStrategy;

import java.time.Duration;

/**
 * 固定延迟退避策略
 *
 * @since 1.0
 */
public class FlatBackoff implements BackoffStrategy {

    private final Duration delay;

    /**
     * 零延迟
     */
    public FlatBackoff() {
        this(Duration.ZERO);
    }

    public FlatBackoff(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative");
        }
        this.delay = delay;
    }

    @Override
    public Duration nextDelay() {
        return delay;
    }

    @Override
    public void reset() {
        // 无状态
    }

    @Override
    public String toString() {
        return "FlatBackoff{delay=" + delay + '}';
    }
}
