package com.p2pchat.signaling.ratelimit;

import com.p2pchat.signaling.config.SignalingProperties;
import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 키(주소 또는 identity)와 종류별 토큰 버킷으로 연결/메시지 허용 여부를 판단한다.
 * 거부 시 연결 종료 같은 후속 조치는 호출 측이 결정한다.
 */
@Component
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final SignalingProperties.RateLimit config;
    private final Clock clock;
    private final ConcurrentMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    public RateLimiter(SignalingProperties properties, Clock clock) {
        this.config = properties.getRateLimit();
        this.clock = clock;
    }

    public boolean admit(String key, RateLimitKind kind) {
        SignalingProperties.Bucket settings = settingsFor(kind);
        long now = clock.millis();
        TokenBucket bucket = buckets.computeIfAbsent(kind.name() + ":" + key,
                ignored -> new TokenBucket(settings.getCapacity(), settings.getRefillPerSecond(), now));
        return bucket.tryConsume(now);
    }

    /**
     * 오래 사용되지 않은 버킷을 정리한다. 제거된 키는 다음 요청 때 가득 찬 버킷으로 다시 시작한다.
     */
    @Scheduled(fixedDelayString = "${signaling.rate-limit.idle-bucket-eviction:PT10M}")
    public int evictIdleBuckets() {
        long cutoff = clock.millis() - config.getIdleBucketEviction().toMillis();
        int before = buckets.size();
        buckets.values().removeIf(bucket -> bucket.getLastAccessMillis() < cutoff);
        int evicted = before - buckets.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate-limit buckets", evicted);
        }
        return evicted;
    }

    int bucketCount() {
        return buckets.size();
    }

    private SignalingProperties.Bucket settingsFor(RateLimitKind kind) {
        return switch (kind) {
            case CONNECTION -> config.getConnection();
            case MESSAGE -> config.getMessage();
        };
    }
}
