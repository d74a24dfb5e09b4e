package xyz.firestige.retry.backoff.strategy;

import xyz.firestige.retry.backoff.api.BackoffStrategy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 指数退避策略
 * <p>
 * 首次返回 baseDelay，之后每次翻倍，上限 maxDelay：base, 2·base, 4·base … max, max。
 * 可选 jitter 会在返回值上叠加 [0, jitter] 的随机时长，不影响游标本身。
 * <p>
 * 非线程安全，同一时刻只能被一个重试执行持有。
 *
 * @since 1.0
 */
public class ExponentialBackoff implements BackoffStrategy {

    // 随机抖动以纳秒计算，且需 +1 作为 nextLong 的上界
    private static final Duration MAX_JITTER = Duration.ofNanos(Long.MAX_VALUE - 1);

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Duration jitter;

    private Duration currentDelay;

    public ExponentialBackoff(Duration baseDelay, Duration maxDelay) {
        this(baseDelay, maxDelay, Duration.ZERO);
    }

    public ExponentialBackoff(Duration baseDelay, Duration maxDelay, Duration jitter) {
        if (baseDelay == null || baseDelay.isNegative()) throw new IllegalArgumentException("invalid baseDelay");
        if (maxDelay == null || maxDelay.isNegative()) throw new IllegalArgumentException("invalid maxDelay");
        if (baseDelay.compareTo(maxDelay) > 0) throw new IllegalArgumentException("baseDelay > maxDelay");
        if (jitter == null || jitter.isNegative()) throw new IllegalArgumentException("invalid jitter");
        if (jitter.compareTo(MAX_JITTER) > 0) throw new IllegalArgumentException("jitter too large");
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.currentDelay = baseDelay;
    }

    @Override
    public Duration nextDelay() {
        Duration delay = currentDelay;
        // 先比较再翻倍，避免溢出
        currentDelay = delay.compareTo(maxDelay.dividedBy(2)) > 0 ? maxDelay : delay.multipliedBy(2);
        return jitter.isZero() ? delay : delay.plus(randomJitter());
    }

    @Override
    public void reset() {
        currentDelay = baseDelay;
    }

    private Duration randomJitter() {
        return Duration.ofNanos(ThreadLocalRandom.current().nextLong(jitter.toNanos() + 1));
    }

    @Override
    public String toString() {
        return "ExponentialBackoff{baseDelay=" + baseDelay + ", maxDelay=" + maxDelay + ", jitter=" + jitter + '}';
    }
}
