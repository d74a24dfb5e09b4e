package xyz.firestige.retry.backoff.spring.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 重试退避配置属性
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "retry.backoff")
public class RetryBackoffProperties {

    /**
     * 是否启用自动配置
     */
    private boolean enabled = true;

    /**
     * 最大尝试次数（含首次）
     */
    private int maxAttempts = 3;

    /**
     * 退避策略类型
     */
    private BackoffType type = BackoffType.EXPONENTIAL;

    /**
     * 固定延迟（flat 策略）
     */
    private Duration delay = Duration.ofMillis(100);

    /**
     * 初始延迟（exponential 策略）
     */
    private Duration baseDelay = Duration.ofMillis(100);

    /**
     * 延迟上限（exponential 策略）
     */
    private Duration maxDelay = Duration.ofSeconds(10);

    /**
     * 随机抖动上限（exponential 策略）
     */
    private Duration jitter = Duration.ZERO;

    /**
     * 监控配置
     */
    private Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public BackoffType getType() {
        return type;
    }

    public void setType(BackoffType type) {
        this.type = type;
    }

    public Duration getDelay() {
        return delay;
    }

    public void setDelay(Duration delay) {
        this.delay = delay;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
        this.baseDelay = baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }

    public Duration getJitter() {
        return jitter;
    }

    public void setJitter(Duration jitter) {
        this.jitter = jitter;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    public enum BackoffType {
        FLAT, EXPONENTIAL
    }

    public static class Metrics {
        /**
         * 是否记录重试指标
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
