package xyz.firestige.retry.backoff.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.retry.backoff.api.BackoffStrategy;
import xyz.firestige.retry.backoff.api.RetryConfig;
import xyz.firestige.retry.backoff.api.RetryExecutor;
import xyz.firestige.retry.backoff.api.RetryOperation;
import xyz.firestige.retry.backoff.exception.NonRetryableException;

import java.time.Duration;
import java.util.Objects;

/**
 * 默认重试执行器
 * <p>
 * 执行流程：
 * <ol>
 *   <li>重置退避策略</li>
 *   <li>依次尝试 0 .. maxAttempts-1，成功则再次重置退避策略并返回</li>
 *   <li>{@link NonRetryableException} 立即抛出</li>
 *   <li>最后一次尝试失败、或 shouldRetry 返回 false 时原样抛出</li>
 *   <li>否则回调 onRetry，等待 {@link BackoffStrategy#nextDelay()} 后继续</li>
 * </ol>
 * 执行器本身无状态、可共享；退避策略实例则不能被并发的两次执行共用。
 *
 * @since 1.0
 */
public class DefaultRetryExecutor implements RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultRetryExecutor.class);

    private final Sleeper sleeper;

    public DefaultRetryExecutor() {
        this(Sleeper.threadSleeper());
    }

    public DefaultRetryExecutor(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public <T> T execute(RetryConfig config, RetryOperation<T> operation) throws Exception {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(operation, "operation");

        BackoffStrategy backoff = config.getBackoff();
        backoff.reset();

        int maxAttempts = config.getMaxAttempts();
        for (int attempt = 0; ; attempt++) {
            try {
                T result = operation.call(attempt);
                backoff.reset();
                return result;
            } catch (NonRetryableException | InterruptedException e) {
                log.debug("[Retry] 不可重试，终止于第 {} 次尝试", attempt);
                throw e;
            } catch (Exception e) {
                if (attempt >= maxAttempts - 1) {
                    log.debug("[Retry] 已耗尽 {} 次尝试", maxAttempts);
                    throw e;
                }
                if (!config.getShouldRetry().test(e)) {
                    log.debug("[Retry] shouldRetry 拒绝重试，终止于第 {} 次尝试: {}", attempt, e.getClass().getName());
                    throw e;
                }
                final int failedAttempt = attempt;
                config.getOnRetry().ifPresent(listener -> listener.onRetry(failedAttempt, e));

                Duration delay = backoff.nextDelay();
                log.debug("[Retry] 第 {} 次尝试失败，{}ms 后重试", attempt, delay.toMillis());
                sleeper.sleep(delay);
            }
        }
    }
}
