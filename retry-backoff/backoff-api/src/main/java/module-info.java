/**
 * Retry Backoff API 模块
 * <p>
 * 提供带退避的重试执行契约：退避策略、重试配置、执行器接口。
 */
module xyz.firestige.retry.backoff.api {
    // 导出核心 API
    exports xyz.firestige.retry.backoff.api;

    // 导出异常包
    exports xyz.firestige.retry.backoff.exception;

    requires java.base;
}
