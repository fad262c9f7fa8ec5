package com.p2pchat.signaling.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * error 프레임의 reason 값. 모두 세션을 유지한 채 송신자에게만 통보된다.
 */
public enum ErrorReason {
    MALFORMED_MESSAGE("malformed-message"),
    UNKNOWN_MESSAGE("unknown-message"),
    PAYLOAD_TOO_LARGE("payload-too-large"),
    INVALID_ROOM("invalid-room"),
    ALREADY_JOINED("already-joined"),
    ROOM_FULL("room-full"),
    NO_PEER("no-peer");

    private final String value;

    ErrorReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }
}
