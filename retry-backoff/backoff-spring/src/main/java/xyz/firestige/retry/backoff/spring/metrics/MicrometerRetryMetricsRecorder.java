package xyz.firestige.retry.backoff.spring.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import xyz.firestige.retry.backoff.api.RetryListener;

/**
 * 基于 Micrometer 的重试指标记录器
 * <p>
 * 记录以下指标：
 * - retry_backoff_retries: 触发重试的次数，按异常类型（exception 标签）区分
 *
 * @since 1.0
 */
public class MicrometerRetryMetricsRecorder implements RetryListener {

    static final String RETRIES = "retry_backoff_retries";

    private final MeterRegistry registry;

    public MicrometerRetryMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onRetry(int attempt, Exception failure) {
        Counter.builder(RETRIES)
            .description("Retries scheduled after a failed attempt")
            .tag("exception", failure.getClass().getSimpleName())
            .register(registry)
            .increment();
    }
}
