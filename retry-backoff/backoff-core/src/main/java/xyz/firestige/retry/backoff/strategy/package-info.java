/**
 * 退避策略实现
 * <p>
 * 提供预置的退避策略：
 * <ul>
 *   <li>{@link xyz.firestige.retry.backoff.strategy.FlatBackoff} - 固定延迟</li>
 *   <li>{@link xyz.firestige.retry.backoff.strategy.ExponentialBackoff} - 指数退避（带上限，可选抖动）</li>
 * </ul>
 * <p>
 * 使用者可实现 {@link xyz.firestige.retry.backoff.api.BackoffStrategy} 接口以定义自定义退避逻辑。
 *
 * @since 1.0
 */
package xyz.firestige.retry.backoff.strategy;
