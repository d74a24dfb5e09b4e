package xyz.firestige.retry.backoff.api;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 重试配置
 * <p>
 * 构建后不可变。退避策略以引用方式持有，执行器在每次 {@code execute} 时负责重置它。
 *
 * <pre>
 * RetryConfig config = new RetryConfig.Builder(3, new ExponentialBackoff(base, max))
 *     .shouldRetry(e -> e instanceof IOException)
 *     .onRetry((attempt, e) -> log.warn("retry {}", attempt))
 *     .build();
 * </pre>
 *
 * @since 1.0
 */
public final class RetryConfig {

    private final int maxAttempts;
    private final BackoffStrategy backoff;
    private final RetryListener onRetry;
    private final Predicate<Exception> shouldRetry;

    private RetryConfig(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.backoff = builder.backoff;
        this.onRetry = builder.onRetry;
        this.shouldRetry = builder.shouldRetry;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public BackoffStrategy getBackoff() {
        return backoff;
    }

    public Optional<RetryListener> getOnRetry() {
        return Optional.ofNullable(onRetry);
    }

    public Predicate<Exception> getShouldRetry() {
        return shouldRetry;
    }

    @Override
    public String toString() {
        return "RetryConfig{maxAttempts=" + maxAttempts
            + ", backoff=" + backoff.getClass().getSimpleName()
            + ", onRetry=" + (onRetry != null)
            + '}';
    }

    /**
     * {@link RetryConfig} 构建器
     */
    public static class Builder {

        private final int maxAttempts;
        private final BackoffStrategy backoff;
        private RetryListener onRetry;
        private Predicate<Exception> shouldRetry = e -> true;

        public Builder(int maxAttempts, BackoffStrategy backoff) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            this.backoff = Objects.requireNonNull(backoff, "backoff");
        }

        /**
         * 设置重试回调，覆盖之前的设置；传入 null 表示不回调
         */
        public Builder onRetry(RetryListener onRetry) {
            this.onRetry = onRetry;
            return this;
        }

        /**
         * 设置可重试判定，覆盖之前的设置
         */
        public Builder shouldRetry(Predicate<Exception> shouldRetry) {
            this.shouldRetry = Objects.requireNonNull(shouldRetry, "shouldRetry");
            return this;
        }

        public RetryConfig build() {
            return new RetryConfig(this);
        }
    }
}
