package com.ocreval.dispatcher.ratelimit;

import com.ocreval.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * 基于内存的滑动窗口限流器。
 * <p>
 * 每个限流维度维护一个时间戳队列，
 * 通过清理过期记录并计数来判断是否超限。
 */
@Slf4j
public class InMemoryRateLimiter implements RateLimiter {

    private final DispatcherProperties properties;
    private final Clock clock;

    /** slot -> 请求时间戳队列 */
    private final Map<String, ConcurrentLinkedDeque<Long>> windows = new ConcurrentHashMap<>();

    public InMemoryRateLimiter(DispatcherProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public InMemoryRateLimiter(DispatcherProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String slot) {
        ConcurrentLinkedDeque<Long> timestamps = windows.computeIfAbsent(slot,
                k -> new ConcurrentLinkedDeque<>());

        // 同一维度的检查与记录必须原子进行，否则并发下会超发
        synchronized (timestamps) {
            long now = clock.millis();
            evictExpired(timestamps, now);

            if (timestamps.size() >= properties.getRateLimitMaxRequests()) {
                log.debug("{} 已达速率限制 ({}/{})",
                        slot, timestamps.size(), properties.getRateLimitMaxRequests());
                return false;
            }

            timestamps.addLast(now);
            return true;
        }
    }

    @Override
    public long remainingQuota(String slot) {
        ConcurrentLinkedDeque<Long> timestamps = windows.get(slot);
        if (timestamps == null) {
            return properties.getRateLimitMaxRequests();
        }
        synchronized (timestamps) {
            evictExpired(timestamps, clock.millis());
            return Math.max(0, properties.getRateLimitMaxRequests() - timestamps.size());
        }
    }

    private void evictExpired(ConcurrentLinkedDeque<Long> timestamps, long now) {
        long windowStart = now - properties.getRateLimitWindowSeconds() * 1000L;
        while (!timestamps.isEmpty() && timestamps.peekFirst() != null && timestamps.peekFirst() <= windowStart) {
            timestamps.pollFirst();
        }
    }
}
