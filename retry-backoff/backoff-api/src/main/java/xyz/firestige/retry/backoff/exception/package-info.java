/**
 * 重试控制异常
 * <ul>
 *   <li>{@link xyz.firestige.retry.backoff.exception.NonRetryableException} - 立即终止重试</li>
 * </ul>
 *
 * @since 1.0
 */
package xyz.firestige.retry.backoff.exception;
