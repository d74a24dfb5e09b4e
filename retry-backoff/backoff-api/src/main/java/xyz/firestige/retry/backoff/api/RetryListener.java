package xyz.firestige.retry.backoff.api;

import java.util.Objects;

/**
 * 重试回调
 * <p>
 * 仅在某次失败确定会触发下一次尝试时调用；最终耗尽、被判定不重试或成功时都不会调用。
 *
 * @since 1.0
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * @param attempt 刚刚失败的尝试序号（从 0 开始）
     * @param failure 该次尝试抛出的异常
     */
    void onRetry(int attempt, Exception failure);

    /**
     * 组合回调，先执行当前回调再执行 {@code after}
     */
    default RetryListener andThen(RetryListener after) {
        Objects.requireNonNull(after, "after");
        return (attempt, failure) -> {
            onRetry(attempt, failure);
            after.onRetry(attempt, failure);
        };
    }

    /**
     * 空操作实现
     */
    static RetryListener noop() {
        return (attempt, failure) -> {};
    }
}
