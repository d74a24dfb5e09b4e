/**
 * Spring Boot 自动配置
 * <p>
 * 核心组件：
 * <ul>
 *   <li>{@link xyz.firestige.retry.backoff.spring.autoconfigure.RetryBackoffAutoConfiguration} - 自动配置类</li>
 *   <li>{@link xyz.firestige.retry.backoff.spring.autoconfigure.RetryBackoffProperties} - 配置属性</li>
 * </ul>
 * <p>
 * 使用方式：
 * <pre>
 * # application.yml
 * retry:
 *   backoff:
 *     enabled: true
 *     max-attempts: 5
 *     type: exponential
 *     base-delay: 200ms
 *     max-delay: 5s
 *     jitter: 50ms
 * </pre>
 *
 * @since 1.0
 */
package xyz.firestige.retry.backoff.spring.autoconfigure;
