/**
 * 带退避的重试执行 API
 * <p>
 * 此包只定义契约，不包含实现。
 * <p>
 * 核心接口：
 * <ul>
 *   <li>{@link xyz.firestige.retry.backoff.api.RetryExecutor} - 执行器入口</li>
 *   <li>{@link xyz.firestige.retry.backoff.api.BackoffStrategy} - 退避策略接口</li>
 *   <li>{@link xyz.firestige.retry.backoff.api.RetryOperation} - 被重试的操作</li>
 *   <li>{@link xyz.firestige.retry.backoff.api.RetryListener} - 重试回调</li>
 * </ul>
 * <p>
 * 数据模型：
 * <ul>
 *   <li>{@link xyz.firestige.retry.backoff.api.RetryConfig} - 重试配置及其构建器</li>
 * </ul>
 *
 * @since 1.0
 */
package xyz.firestige.retry.backoff.api;
