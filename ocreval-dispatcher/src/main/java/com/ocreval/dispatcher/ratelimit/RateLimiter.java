package com.ocreval.dispatcher.ratelimit;

/**
 * 速率限制器接口。
 * <p>
 * 提供两种实现：
 * - {@link InMemoryRateLimiter}：内存滑动窗口实现
 * - {@link NoOpRateLimiter}：不限流
 */
public interface RateLimiter {

    /**
     * 尝试获取请求许可。
     *
     * @param slot 限流维度（通常是引擎名）
     * @return true 表示允许请求，false 表示已达速率限制
     */
    boolean tryAcquire(String slot);

    /**
     * 获取某个维度在当前窗口内剩余的可用请求数。
     */
    long remainingQuota(String slot);
}
