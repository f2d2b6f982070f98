package com.ocreval.dispatcher.ratelimit;

/**
 * 不做任何限制的限流器。
 */
public class NoOpRateLimiter implements RateLimiter {

    @Override
    public boolean tryAcquire(String slot) {
        return true;
    }

    @Override
    public long remainingQuota(String slot) {
        return Long.MAX_VALUE;
    }
}
