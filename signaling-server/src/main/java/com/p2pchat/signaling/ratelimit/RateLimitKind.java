package com.p2pchat.signaling.ratelimit;

/**
 * 서로 다른 버킷을 쓰는 제한 대상. 메시지 폭주가 연결 할당량을 소모하지 않도록 분리한다.
 */
public enum RateLimitKind {
    CONNECTION,
    MESSAGE
}
