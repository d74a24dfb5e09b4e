package xyz.firestige.retry.backoff.spring.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.firestige.retry.backoff.api.RetryExecutor;
import xyz.firestige.retry.backoff.api.RetryListener;
import xyz.firestige.retry.backoff.core.DefaultRetryExecutor;
import xyz.firestige.retry.backoff.spring.RetryConfigFactory;
import xyz.firestige.retry.backoff.spring.metrics.MicrometerRetryMetricsRecorder;

/**
 * 重试退避自动配置
 *
 * @since 1.0
 */
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(RetryExecutor.class)
@ConditionalOnProperty(prefix = "retry.backoff", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RetryBackoffProperties.class)
public class RetryBackoffAutoConfiguration {

    /**
     * 重试执行器 Bean（无状态，可全局共享）
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor() {
        return new DefaultRetryExecutor();
    }

    /**
     * 重试配置工厂 Bean
     * <p>
     * 容器中所有 {@link RetryListener} Bean 按顺序组合为基础回调
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryConfigFactory retryConfigFactory(RetryBackoffProperties properties,
                                                 ObjectProvider<RetryListener> listeners) {
        RetryListener baseListener = listeners.orderedStream()
            .reduce(RetryListener::andThen)
            .orElseGet(RetryListener::noop);
        return new RetryConfigFactory(properties, baseListener);
    }

    /**
     * Micrometer 指标（存在 MeterRegistry 时启用）
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "retry.backoff.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean
        MicrometerRetryMetricsRecorder retryMetricsRecorder(MeterRegistry meterRegistry) {
            return new MicrometerRetryMetricsRecorder(meterRegistry);
        }
    }
}
