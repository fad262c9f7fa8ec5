package com.p2pchat.signaling.domain.member.entity;

import java.time.Instant;
import java.util.Objects;

/**
 * 개발용 인메모리 회원. 비밀번호는 BCrypt 해시로만 보관한다.
 */
public class Member {

    private final String username;
    private final String passwordHash;
    private final Instant createdAt;

    public Member(String username, String passwordHash, Instant createdAt) {
        this.username = Objects.requireNonNull(username, "username must not be null");
        this.passwordHash = Objects.requireNonNull(passwordHash, "passwordHash must not be null");
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public String getUsername() {
        return username;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
