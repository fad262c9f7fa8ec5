package com.p2pchat.signaling.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * application.yml의 signaling 설정 값을 바인딩하기 위한 POJO.
 */
@ConfigurationProperties(prefix = "signaling")
public class SignalingProperties {

    private Duration idleTimeout = Duration.ofSeconds(60);
    private Duration idleCheckInterval = Duration.ofSeconds(5);
    private DataSize maxMessageSize = DataSize.ofKilobytes(16);
    private Duration sendTimeLimit = Duration.ofSeconds(5);
    private DataSize sendBufferSize = DataSize.ofKilobytes(128);
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
    private boolean trustForwardedFor = false;
    private RateLimit rateLimit = new RateLimit();

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    public Duration getIdleCheckInterval() {
        return idleCheckInterval;
    }

    public void setIdleCheckInterval(Duration idleCheckInterval) {
        this.idleCheckInterval = idleCheckInterval;
    }

    public DataSize getMaxMessageSize() {
        return maxMessageSize;
    }

    public void setMaxMessageSize(DataSize maxMessageSize) {
        this.maxMessageSize = maxMessageSize;
    }

    public Duration getSendTimeLimit() {
        return sendTimeLimit;
    }

    public void setSendTimeLimit(Duration sendTimeLimit) {
        this.sendTimeLimit = sendTimeLimit;
    }

    public DataSize getSendBufferSize() {
        return sendBufferSize;
    }

    public void setSendBufferSize(DataSize sendBufferSize) {
        this.sendBufferSize = sendBufferSize;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins == null ? new ArrayList<>() : allowedOrigins;
    }

    public boolean isTrustForwardedFor() {
        return trustForwardedFor;
    }

    public void setTrustForwardedFor(boolean trustForwardedFor) {
        this.trustForwardedFor = trustForwardedFor;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    /**
     * 연결 시도와 시그널링 메시지에 각각 별도의 토큰 버킷을 둔다.
     */
    public static class RateLimit {
        private Bucket connection = new Bucket(10, 0.2);
        private Bucket message = new Bucket(50, 10.0);
        private Duration idleBucketEviction = Duration.ofMinutes(10);

        public Bucket getConnection() {
            return connection;
        }

        public void setConnection(Bucket connection) {
            this.connection = connection;
        }

        public Bucket getMessage() {
            return message;
        }

        public void setMessage(Bucket message) {
            this.message = message;
        }

        public Duration getIdleBucketEviction() {
            return idleBucketEviction;
        }

        public void setIdleBucketEviction(Duration idleBucketEviction) {
            this.idleBucketEviction = idleBucketEviction;
        }
    }

    /**
     * 버킷 용량과 초당 충전량. 충전량이 0이면 버킷 수명 동안 고정 할당량으로 동작한다.
     */
    public static class Bucket {
        private int capacity;
        private double refillPerSecond;

        public Bucket() {
        }

        public Bucket(int capacity, double refillPerSecond) {
            this.capacity = capacity;
            this.refillPerSecond = refillPerSecond;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public double getRefillPerSecond() {
            return refillPerSecond;
        }

        public void setRefillPerSecond(double refillPerSecond) {
            this.refillPerSecond = refillPerSecond;
        }
    }
}
