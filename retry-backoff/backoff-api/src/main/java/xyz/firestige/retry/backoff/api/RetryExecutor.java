package xyz.firestige.retry.backoff.api;

/**
 * 重试执行器
 * <p>
 * 在调用方线程上运行重试循环：每次 {@code execute} 开始前重置退避策略，
 * 成功后再次重置；失败时按 {@link RetryConfig} 决定继续重试或原样抛出异常。
 *
 * @since 1.0
 */
public interface RetryExecutor {

    /**
     * 执行操作，失败时按配置重试
     *
     * @param config    重试配置
     * @param operation 被重试的操作，接收从 0 开始的尝试序号
     * @return 操作的成功结果
     * @throws Exception 最终失败时抛出的原始异常（不包装）；等待期间被中断时抛出 {@link InterruptedException}
     */
    <T> T execute(RetryConfig config, RetryOperation<T> operation) throws Exception;
}
