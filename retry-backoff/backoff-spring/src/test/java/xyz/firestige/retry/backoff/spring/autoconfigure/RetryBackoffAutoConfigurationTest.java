package xyz.firestige.retry.backoff.spring.autoconfigure;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.firestige.retry.backoff.api.RetryConfig;
import xyz.firestige.retry.backoff.api.RetryExecutor;
import xyz.firestige.retry.backoff.api.RetryListener;
import xyz.firestige.retry.backoff.core.DefaultRetryExecutor;
import xyz.firestige.retry.backoff.spring.RetryConfigFactory;
import xyz.firestige.retry.backoff.spring.metrics.MicrometerRetryMetricsRecorder;
import xyz.firestige.retry.backoff.strategy.ExponentialBackoff;
import xyz.firestige.retry.backoff.strategy.FlatBackoff;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * 验证 retry.backoff.* 自动装配
 */
class RetryBackoffAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(RetryBackoffAutoConfiguration.class));

    @Test
    void shouldCreateBeansWithDefaults() {
        contextRunner.run(ctx -> {
            assertThat(ctx).hasSingleBean(RetryExecutor.class);
            assertThat(ctx).hasSingleBean(RetryConfigFactory.class);
            assertThat(ctx).doesNotHaveBean(MicrometerRetryMetricsRecorder.class);

            RetryBackoffProperties properties = ctx.getBean(RetryBackoffProperties.class);
            assertThat(properties.getMaxAttempts()).isEqualTo(3);
            assertThat(properties.getType()).isEqualTo(RetryBackoffProperties.BackoffType.EXPONENTIAL);
            assertThat(properties.getBaseDelay()).isEqualTo(Duration.ofMillis(100));
            assertThat(properties.getMaxDelay()).isEqualTo(Duration.ofSeconds(10));

            RetryConfig config = ctx.getBean(RetryConfigFactory.class).newConfig();
            assertThat(config.getMaxAttempts()).isEqualTo(3);
            assertThat(config.getBackoff()).isInstanceOf(ExponentialBackoff.class);
        });
    }

    @Test
    void shouldNotCreateBeansWhenDisabled() {
        contextRunner
            .withPropertyValues("retry.backoff.enabled=false")
            .run(ctx -> {
                assertThat(ctx).doesNotHaveBean(RetryExecutor.class);
                assertThat(ctx).doesNotHaveBean(RetryConfigFactory.class);
            });
    }

    @Test
    void shouldBindFlatBackoffProperties() {
        contextRunner
            .withPropertyValues(
                "retry.backoff.type=flat",
                "retry.backoff.delay=250ms",
                "retry.backoff.max-attempts=7")
            .run(ctx -> {
                RetryConfig config = ctx.getBean(RetryConfigFactory.class).newConfig();
                assertThat(config.getMaxAttempts()).isEqualTo(7);
                assertThat(config.getBackoff()).isInstanceOf(FlatBackoff.class);
                assertThat(config.getBackoff().nextDelay()).isEqualTo(Duration.ofMillis(250));
            });
    }

    @Test
    void shouldBindExponentialBackoffProperties() {
        contextRunner
            .withPropertyValues(
                "retry.backoff.type=exponential",
                "retry.backoff.base-delay=10ms",
                "retry.backoff.max-delay=30ms")
            .run(ctx -> {
                RetryConfig config = ctx.getBean(RetryConfigFactory.class).newConfig();
                assertThat(config.getBackoff().nextDelay()).isEqualTo(Duration.ofMillis(10));
                assertThat(config.getBackoff().nextDelay()).isEqualTo(Duration.ofMillis(20));
                assertThat(config.getBackoff().nextDelay()).isEqualTo(Duration.ofMillis(30));
            });
    }

    @Test
    void shouldBackOffWhenUserDefinesExecutor() {
        contextRunner
            .withUserConfiguration(CustomExecutorConfig.class)
            .run(ctx -> {
                assertThat(ctx).hasSingleBean(RetryExecutor.class);
                assertThat(ctx.getBean(RetryExecutor.class)).isSameAs(CustomExecutorConfig.EXECUTOR);
            });
    }

    @Test
    void shouldCreateMetricsRecorderWhenMeterRegistryPresent() {
        contextRunner
            .withUserConfiguration(MetricsConfig.class)
            .withPropertyValues(
                "retry.backoff.base-delay=1ms",
                "retry.backoff.max-delay=2ms")
            .run(ctx -> {
                assertThat(ctx).hasSingleBean(MicrometerRetryMetricsRecorder.class);

                RetryExecutor executor = ctx.getBean(RetryExecutor.class);
                RetryConfig config = ctx.getBean(RetryConfigFactory.class).newConfig();
                assertThatThrownBy(() -> executor.execute(config, attempt -> {
                    throw new IllegalStateException("this failed");
                })).isInstanceOf(IllegalStateException.class);

                SimpleMeterRegistry registry = ctx.getBean(SimpleMeterRegistry.class);
                assertThat(registry.get("retry_backoff_retries")
                    .tag("exception", "IllegalStateException")
                    .counter()
                    .count()).isEqualTo(2.0);
            });
    }

    @Test
    void shouldNotCreateMetricsRecorderWhenMetricsDisabled() {
        contextRunner
            .withUserConfiguration(MetricsConfig.class)
            .withPropertyValues("retry.backoff.metrics.enabled=false")
            .run(ctx -> assertThat(ctx).doesNotHaveBean(MicrometerRetryMetricsRecorder.class));
    }

    @Test
    void shouldComposeUserListeners() {
        contextRunner
            .withUserConfiguration(ListenerConfig.class)
            .withPropertyValues(
                "retry.backoff.type=flat",
                "retry.backoff.delay=0ms")
            .run(ctx -> {
                RetryConfig config = ctx.getBean(RetryConfigFactory.class).newConfig();
                assertThatThrownBy(() -> ctx.getBean(RetryExecutor.class).execute(config, attempt -> {
                    throw new IllegalStateException("attempt " + attempt);
                })).hasMessage("attempt 2");

                assertThat(ListenerConfig.ATTEMPTS).containsExactly(0, 1);
            });
    }

    @Configuration(proxyBeanMethods = false)
    static class MetricsConfig {
        @Bean
        SimpleMeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomExecutorConfig {
        static final RetryExecutor EXECUTOR = new DefaultRetryExecutor();

        @Bean
        RetryExecutor customRetryExecutor() {
            return EXECUTOR;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class ListenerConfig {
        static final List<Integer> ATTEMPTS = new ArrayList<>();

        @Bean
        RetryListener recordingListener() {
            ATTEMPTS.clear();
            return (attempt, failure) -> ATTEMPTS.add(attempt);
        }
    }
}
