package com.p2pchat.signaling.websocket;

import com.p2pchat.signaling.model.ErrorReason;

/**
 * 세션을 닫지 않고 error 프레임으로 송신자에게만 알리는 프로토콜/페어링 오류.
 */
public class SignalingException extends RuntimeException {

    private final ErrorReason reason;

    public SignalingException(ErrorReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ErrorReason getReason() {
        return reason;
    }
}
