package com.p2pchat.signaling.domain.member.dto;

import java.time.Instant;

public class MemberResponse {

    private String username;
    private Instant createdAt;

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
