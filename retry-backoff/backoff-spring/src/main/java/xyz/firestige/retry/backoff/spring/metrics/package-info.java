/**
 * Micrometer 指标集成
 * <p>
 * 记录的指标：
 * <ul>
 *   <li>retry_backoff_retries - 触发重试的次数（exception 标签）</li>
 * </ul>
 *
 * @since 1.0
 */
package xyz.firestige.retry.backoff.spring.metrics;
