package com.p2pchat.signaling.domain.auth.service;

/**
 * 토큰 검증 실패 사유.
 */
public enum AuthFailure {
    MISSING,
    INVALID,
    EXPIRED
}
