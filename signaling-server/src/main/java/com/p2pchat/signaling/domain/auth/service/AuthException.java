package com.p2pchat.signaling.domain.auth.service;

/**
 * 토큰 검증 또는 로그인 실패를 표현하는 런타임 예외.
 */
public class AuthException extends RuntimeException {

    private final AuthFailure failure;

    public AuthException(AuthFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public AuthException(AuthFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public AuthFailure getFailure() {
        return failure;
    }
}
