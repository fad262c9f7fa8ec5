package com.p2pchat.signaling.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.p2pchat.signaling.model.ErrorReason;
import com.p2pchat.signaling.model.ParticipantRole;
import com.p2pchat.signaling.model.SignalMessage;
import com.p2pchat.signaling.model.SignalType;
import org.junit.jupiter.api.Test;

class SignalMessageCodecTest {

    private final SignalMessageCodec codec = new SignalMessageCodec(new ObjectMapper());

    @Test
    void decodesClientMessages() {
        SignalMessage join = codec.decode("{\"type\":\"join\",\"payload\":{\"room\":\"r1\"}}");
        SignalMessage candidate = codec.decode(
                "{\"type\":\"ice-candidate\",\"payload\":{\"candidate\":\"candidate:1 1 udp 2122260223 10.0.0.1 5000 typ host\"}}");
        SignalMessage leave = codec.decode("{\"type\":\"leave\"}");

        assertThat(join.getType()).isEqualTo(SignalType.JOIN);
        assertThat(join.text("room")).isEqualTo("r1");
        assertThat(candidate.getType()).isEqualTo(SignalType.ICE_CANDIDATE);
        assertThat(leave.getType()).isEqualTo(SignalType.LEAVE);
        assertThat(leave.getPayload().isEmpty()).isTrue();
    }

    @Test
    void keepsOpaquePayloadUntouched() {
        String frame = "{\"type\":\"offer\",\"payload\":{\"sdp\":\"v=0\\r\\no=- 1 2 IN IP4 127.0.0.1\",\"extra\":{\"k\":[1,2]}}}";

        SignalMessage offer = codec.decode(frame);

        assertThat(offer.text("sdp")).isEqualTo("v=0\r\no=- 1 2 IN IP4 127.0.0.1");
        assertThat(codec.encode(offer)).isEqualTo(frame);
    }

    @Test
    void rejectsInvalidJson() {
        assertThat(reasonOf("{not json")).isEqualTo(ErrorReason.MALFORMED_MESSAGE);
        assertThat(reasonOf("[1,2]")).isEqualTo(ErrorReason.MALFORMED_MESSAGE);
        assertThat(reasonOf("{\"payload\":{}}")).isEqualTo(ErrorReason.MALFORMED_MESSAGE);
        assertThat(reasonOf("{\"type\":\"offer\",\"payload\":\"sdp\"}")).isEqualTo(ErrorReason.MALFORMED_MESSAGE);
    }

    @Test
    void rejectsUnknownAndServerOnlyTypes() {
        assertThat(reasonOf("{\"type\":\"chat\",\"payload\":{}}")).isEqualTo(ErrorReason.UNKNOWN_MESSAGE);
        assertThat(reasonOf("{\"type\":\"peer-joined\",\"payload\":{}}")).isEqualTo(ErrorReason.UNKNOWN_MESSAGE);
        assertThat(reasonOf("{\"type\":\"error\",\"payload\":{}}")).isEqualTo(ErrorReason.UNKNOWN_MESSAGE);
    }

    @Test
    void rejectsMissingOrEmptyRequiredFields() {
        assertThat(reasonOf("{\"type\":\"offer\",\"payload\":{}}")).isEqualTo(ErrorReason.MALFORMED_MESSAGE);
        assertThat(reasonOf("{\"type\":\"answer\",\"payload\":{\"sdp\":\"\"}}")).isEqualTo(ErrorReason.MALFORMED_MESSAGE);
        assertThat(reasonOf("{\"type\":\"ice-candidate\",\"payload\":{\"candidate\":42}}"))
                .isEqualTo(ErrorReason.MALFORMED_MESSAGE);
        assertThat(reasonOf("{\"type\":\"join\"}")).isEqualTo(ErrorReason.MALFORMED_MESSAGE);
    }

    @Test
    void encodesServerMessages() {
        String encoded = codec.encode(SignalMessage.joined("r1", ParticipantRole.OFFERER, null));

        assertThat(encoded).isEqualTo("{\"type\":\"joined\",\"payload\":{\"room\":\"r1\",\"role\":\"offerer\"}}");
        assertThat(codec.encode(SignalMessage.error(ErrorReason.ROOM_FULL, "Room is full: r1")))
                .isEqualTo("{\"type\":\"error\",\"payload\":{\"reason\":\"room-full\",\"message\":\"Room is full: r1\"}}");
    }

    private ErrorReason reasonOf(String frame) {
        SignalingException ex = catchThrowableOfType(() -> codec.decode(frame), SignalingException.class);
        assertThat(ex).as("expected SignalingException for %s", frame).isNotNull();
        return ex.getReason();
    }
}
