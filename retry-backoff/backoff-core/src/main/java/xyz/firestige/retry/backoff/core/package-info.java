/**
 * 重试执行器实现
 * <p>
 * {@link xyz.firestige.retry.backoff.core.DefaultRetryExecutor} 在调用方线程上运行重试循环，
 * {@link xyz.firestige.retry.backoff.core.Retries} 提供静态入口。
 *
 * @since 1.0
 */
package xyz.firestige.retry.backoff.core;
