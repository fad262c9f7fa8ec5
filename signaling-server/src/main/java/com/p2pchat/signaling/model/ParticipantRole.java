package com.p2pchat.signaling.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 방 참가 순서에 따른 권장 역할. 실제 offer/answer 역할은 두 피어가 협상한다.
 */
public enum ParticipantRole {
    OFFERER("offerer"),
    ANSWERER("answerer");

    private final String value;

    ParticipantRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /**
     * 상대 피어에게 배정할 반대 역할을 반환한다.
     */
    public ParticipantRole opposite() {
        return this == OFFERER ? ANSWERER : OFFERER;
    }
}
