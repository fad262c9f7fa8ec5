package com.p2pchat.signaling.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * {@code {"type": ..., "payload": {...}}} 형태의 시그널링 메시지.
 * SDP/ICE 페이로드는 해석하지 않고 그대로 보관한다.
 */
public class SignalMessage {

    private final SignalType type;
    private final ObjectNode payload;

    public SignalMessage(SignalType type, ObjectNode payload) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.payload = payload == null ? JsonNodeFactory.instance.objectNode() : payload;
    }

    public static SignalMessage joined(String room, ParticipantRole role, Identity peer) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("room", room);
        payload.put("role", role.toValue());
        if (peer != null) {
            payload.put("peer", peer.getSubject());
        }
        return new SignalMessage(SignalType.JOINED, payload);
    }

    public static SignalMessage peerJoined(Identity peer, ParticipantRole peerRole, long sequence) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("peer", peer.getSubject());
        payload.put("role", peerRole.toValue());
        payload.put("seq", sequence);
        return new SignalMessage(SignalType.PEER_JOINED, payload);
    }

    public static SignalMessage peerLeft(Identity peer, long sequence) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("peer", peer.getSubject());
        payload.put("seq", sequence);
        return new SignalMessage(SignalType.PEER_LEFT, payload);
    }

    public static SignalMessage error(ErrorReason reason, String message) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("reason", reason.toValue());
        payload.put("message", message);
        return new SignalMessage(SignalType.ERROR, payload);
    }

    public static SignalMessage pong() {
        return new SignalMessage(SignalType.PONG, null);
    }

    public SignalType getType() {
        return type;
    }

    public ObjectNode getPayload() {
        return payload;
    }

    /**
     * payload의 문자열 필드를 읽는다. 없거나 문자열이 아니면 null.
     */
    public String text(String field) {
        JsonNode node = payload.get(field);
        if (node == null || !node.isTextual()) {
            return null;
        }
        return node.asText();
    }

    @Override
    public String toString() {
        // payload에는 SDP/ICE 원문이 들어 있으므로 로그에 남기지 않는다.
        return "SignalMessage{type=" + type.toValue() + "}";
    }
}
