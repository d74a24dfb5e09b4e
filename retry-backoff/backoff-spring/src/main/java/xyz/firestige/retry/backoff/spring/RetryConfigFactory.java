package xyz.firestige.retry.backoff.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.retry.backoff.api.BackoffStrategy;
import xyz.firestige.retry.backoff.api.RetryConfig;
import xyz.firestige.retry.backoff.api.RetryListener;
import xyz.firestige.retry.backoff.spring.autoconfigure.RetryBackoffProperties;
import xyz.firestige.retry.backoff.strategy.ExponentialBackoff;
import xyz.firestige.retry.backoff.strategy.FlatBackoff;

import java.util.Objects;

/**
 * 按 {@code retry.backoff.*} 属性创建重试配置
 * <p>
 * 每次调用都会创建新的退避策略实例，因此并发调用方拿到的配置互不共享游标。
 * 返回的构建器已挂上基础回调（如指标记录），调用方追加回调时应使用
 * {@link #newBuilder(RetryListener)}，直接调用 {@code onRetry} 会覆盖基础回调。
 *
 * @since 1.0
 */
public class RetryConfigFactory {

    private static final Logger log = LoggerFactory.getLogger(RetryConfigFactory.class);

    private final RetryBackoffProperties properties;
    private final RetryListener baseListener;

    public RetryConfigFactory(RetryBackoffProperties properties, RetryListener baseListener) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.baseListener = Objects.requireNonNull(baseListener, "baseListener");
    }

    public BackoffStrategy newBackoff() {
        BackoffStrategy backoff;
        switch (properties.getType()) {
            case FLAT:
                backoff = new FlatBackoff(properties.getDelay());
                break;
            case EXPONENTIAL:
                backoff = new ExponentialBackoff(properties.getBaseDelay(), properties.getMaxDelay(), properties.getJitter());
                break;
            default:
                throw new IllegalStateException("Unsupported backoff type: " + properties.getType());
        }
        log.debug("[Retry] 创建退避策略: type={}, backoff={}", properties.getType(), backoff);
        return backoff;
    }

    public RetryConfig.Builder newBuilder() {
        return new RetryConfig.Builder(properties.getMaxAttempts(), newBackoff())
            .onRetry(baseListener);
    }

    public RetryConfig.Builder newBuilder(RetryListener listener) {
        return new RetryConfig.Builder(properties.getMaxAttempts(), newBackoff())
            .onRetry(baseListener.andThen(listener));
    }

    public RetryConfig newConfig() {
        return newBuilder().build();
    }
}
