package xyz.firestige.retry.backoff.exception;

/**
 * 不可重试异常
 * <p>
 * 操作内部抛出此异常时，执行器立即原样抛出，不再询问可重试判定，也不等待、不继续尝试。
 * 消息和原因均可省略，未提供时为 null。
 *
 * @since 1.0
 */
public class NonRetryableException extends RuntimeException {

    public NonRetryableException() {
        super();
    }

    public NonRetryableException(String message) {
        super(message);
    }

    public NonRetryableException(Throwable cause) {
        super(null, cause);
    }

    public NonRetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
