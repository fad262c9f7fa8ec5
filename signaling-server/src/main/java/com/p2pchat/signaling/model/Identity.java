package com.p2pchat.signaling.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 검증된 토큰에서 추출한 사용자 식별 정보.
 * 인가 판단에는 쓰지 않고 rate limit 버킷 키와 로그 용도로만 사용한다.
 */
public class Identity {

    private final String subject;
    private final Instant expiresAt;

    public Identity(String subject, Instant expiresAt) {
        this.subject = Objects.requireNonNull(subject, "subject must not be null");
        this.expiresAt = expiresAt;
    }

    public String getSubject() {
        return subject;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Identity)) {
            return false;
        }
        Identity other = (Identity) o;
        return subject.equals(other.subject) && Objects.equals(expiresAt, other.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, expiresAt);
    }

    @Override
    public String toString() {
        return subject;
    }
}
