package com.p2pchat.signaling.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 시그널링 프레임의 type 구분자.
 */
public enum SignalType {
    // 클라이언트 -> 서버
    JOIN("join", true, "room"),
    OFFER("offer", true, "sdp"),
    ANSWER("answer", true, "sdp"),
    ICE_CANDIDATE("ice-candidate", true, "candidate"),
    LEAVE("leave", true, null),
    PING("ping", true, null),
    // 서버 -> 클라이언트
    JOINED("joined", false, null),
    PEER_JOINED("peer-joined", false, null),
    PEER_LEFT("peer-left", false, null),
    PONG("pong", false, null),
    ERROR("error", false, null);

    private static final Map<String, SignalType> BY_VALUE = Arrays.stream(values())
            .collect(Collectors.toMap(SignalType::toValue, Function.identity()));

    private final String value;
    private final boolean clientOriginated;
    private final String requiredField;

    SignalType(String value, boolean clientOriginated, String requiredField) {
        this.value = value;
        this.clientOriginated = clientOriginated;
        this.requiredField = requiredField;
    }

    public static Optional<SignalType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_VALUE.get(value));
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    public boolean isClientOriginated() {
        return clientOriginated;
    }

    /**
     * payload 안에 비어 있지 않은 문자열로 반드시 존재해야 하는 필드명. 없으면 null.
     */
    public String getRequiredField() {
        return requiredField;
    }

    /**
     * 피어에게 그대로 중계되는 메시지(offer/answer/ice-candidate) 여부.
     */
    public boolean isRelayed() {
        return this == OFFER || this == ANSWER || this == ICE_CANDIDATE;
    }
}
