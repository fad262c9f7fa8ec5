package com.p2pchat.signaling.ratelimit;

/**
 * 단일 키에 대한 토큰 버킷. 호출 시점의 시각으로 지연 충전한다.
 */
class TokenBucket {

    private final int capacity;
    private final double refillPerMillis;
    private double tokens;
    private long lastRefillMillis;
    private volatile long lastAccessMillis;

    TokenBucket(int capacity, double refillPerSecond, long nowMillis) {
        this.capacity = Math.max(0, capacity);
        this.refillPerMillis = Math.max(0.0, refillPerSecond) / 1000.0;
        this.tokens = this.capacity;
        this.lastRefillMillis = nowMillis;
        this.lastAccessMillis = nowMillis;
    }

    synchronized boolean tryConsume(long nowMillis) {
        refill(nowMillis);
        lastAccessMillis = nowMillis;
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    long getLastAccessMillis() {
        return lastAccessMillis;
    }

    private void refill(long nowMillis) {
        long elapsed = nowMillis - lastRefillMillis;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + elapsed * refillPerMillis);
        lastRefillMillis = nowMillis;
    }
}
