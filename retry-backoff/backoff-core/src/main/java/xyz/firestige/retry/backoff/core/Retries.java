package xyz.firestige.retry.backoff.core;

import xyz.firestige.retry.backoff.api.BackoffStrategy;
import xyz.firestige.retry.backoff.api.RetryConfig;
import xyz.firestige.retry.backoff.api.RetryOperation;

/**
 * 重试静态入口
 *
 * <pre>
 * String result = Retries.retry(new RetryConfig.Builder(3, backoff).build(), attempt -> call());
 * </pre>
 *
 * @since 1.0
 */
public final class Retries {

    private static final DefaultRetryExecutor EXECUTOR = new DefaultRetryExecutor();

    private Retries() {
    }

    public static <T> T retry(RetryConfig config, RetryOperation<T> operation) throws Exception {
        return EXECUTOR.execute(config, operation);
    }

    /**
     * @deprecated 使用 {@link #retry(RetryConfig, RetryOperation)}
     */
    @Deprecated
    public static <T> T retry(int upTo, BackoffStrategy backoff, RetryOperation<T> operation) throws Exception {
        return retry(new RetryConfig.Builder(upTo, backoff).build(), operation);
    }
}
