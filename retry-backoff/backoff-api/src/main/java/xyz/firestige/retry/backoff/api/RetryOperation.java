package xyz.firestige.retry.backoff.api;

/**
 * 被重试的操作
 *
 * @param <T> 结果类型
 * @since 1.0
 */
@FunctionalInterface
public interface RetryOperation<T> {

    /**
     * 执行一次尝试
     *
     * @param attempt 当前尝试序号（从 0 开始）
     * @return 操作结果
     * @throws Exception 任意失败，由执行器按重试配置决定是否重试
     */
    T call(int attempt) throws Exception;
}
