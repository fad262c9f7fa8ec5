package com.p2pchat.signaling.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 토큰 발급/검증에 공통으로 쓰는 HMAC 키와 클레임 설정.
 */
@ConfigurationProperties(prefix = "jwt")
public class JwtProperties {

    private String secret;
    private String issuer = "p2p-chat";
    private long ttlSeconds = 24 * 60 * 60;

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }
}
