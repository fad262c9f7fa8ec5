package com.p2pchat.signaling.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p2pchat.signaling.model.ErrorReason;
import com.p2pchat.signaling.model.SignalMessage;
import com.p2pchat.signaling.model.SignalType;
import org.springframework.stereotype.Component;

/**
 * 텍스트 프레임과 {@link SignalMessage} 사이의 JSON 변환.
 */
@Component
public class SignalMessageCodec {

    private final ObjectMapper objectMapper;

    public SignalMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws SignalingException JSON이 아니거나 필수 필드가 없으면 MALFORMED_MESSAGE,
     *         클라이언트가 보낼 수 없는 type이면 UNKNOWN_MESSAGE
     */
    public SignalMessage decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new SignalingException(ErrorReason.MALFORMED_MESSAGE, "Message is not valid JSON");
        }
        if (root == null || !root.isObject()) {
            throw new SignalingException(ErrorReason.MALFORMED_MESSAGE, "Message must be a JSON object");
        }
        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new SignalingException(ErrorReason.MALFORMED_MESSAGE, "type is required");
        }
        String typeValue = typeNode.asText();
        SignalType type = SignalType.fromValue(typeValue)
                .filter(SignalType::isClientOriginated)
                .orElseThrow(() -> new SignalingException(ErrorReason.UNKNOWN_MESSAGE,
                        "Unknown message type: " + typeValue));

        JsonNode payloadNode = root.get("payload");
        ObjectNode payload;
        if (payloadNode == null || payloadNode.isNull()) {
            payload = objectMapper.createObjectNode();
        } else if (payloadNode.isObject()) {
            payload = (ObjectNode) payloadNode;
        } else {
            throw new SignalingException(ErrorReason.MALFORMED_MESSAGE, "payload must be a JSON object");
        }

        String field = type.getRequiredField();
        if (field != null) {
            JsonNode value = payload.get(field);
            if (value == null || !value.isTextual() || value.asText().isBlank()) {
                throw new SignalingException(ErrorReason.MALFORMED_MESSAGE, field + " is required");
            }
        }
        return new SignalMessage(type, payload);
    }

    public String encode(SignalMessage message) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", message.getType().toValue());
        root.set("payload", message.getPayload());
        return root.toString();
    }
}
