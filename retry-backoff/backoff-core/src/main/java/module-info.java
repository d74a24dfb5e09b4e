/**
 * Retry Backoff Core 模块
 * <p>
 * 提供 API 的默认实现：重试执行器、静态入口、内置退避策略。
 */
module xyz.firestige.retry.backoff.core {
    exports xyz.firestige.retry.backoff.core;
    exports xyz.firestige.retry.backoff.strategy;

    // 依赖 API 模块
    requires transitive xyz.firestige.retry.backoff.api;

    // 依赖外部库
    requires org.slf4j;
}
