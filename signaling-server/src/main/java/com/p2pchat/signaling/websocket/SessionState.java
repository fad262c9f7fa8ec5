package com.p2pchat.signaling.websocket;

/**
 * 연결 하나의 시그널링 상태. 어느 상태에서든 CLOSED로 갈 수 있다.
 */
public enum SessionState {
    CONNECTING,
    AUTHENTICATED,
    AWAITING_PEER,
    PAIRED,
    CLOSED
}
