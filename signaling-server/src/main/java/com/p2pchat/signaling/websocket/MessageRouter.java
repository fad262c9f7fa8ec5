package com.p2pchat.signaling.websocket;

import com.p2pchat.signaling.model.ErrorReason;
import com.p2pchat.signaling.model.SignalMessage;
import com.p2pchat.signaling.room.JoinResult;
import com.p2pchat.signaling.room.RelayResult;
import com.p2pchat.signaling.room.RoomNames;
import com.p2pchat.signaling.room.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

/**
 * 세션이 받은 메시지를 type에 따라 레지스트리 작업이나 세션 응답으로 분기한다.
 * 세션 간 효과(알림, 중계)는 모두 {@link RoomRegistry}를 거친다.
 */
@Component
public class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final RoomRegistry roomRegistry;

    public MessageRouter(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    /**
     * @throws SignalingException 송신자에게 error 프레임으로 알려야 하는 비치명적 오류
     */
    public void route(SignalingSession session, SignalMessage message) {
        switch (message.getType()) {
            case JOIN -> join(session, message.text("room"));
            case LEAVE -> leave(session);
            case OFFER, ANSWER, ICE_CANDIDATE -> relay(session, message);
            case PING -> session.deliver(SignalMessage.pong());
            default -> throw new SignalingException(ErrorReason.UNKNOWN_MESSAGE,
                    "Unsupported message type: " + message.getType().toValue());
        }
    }

    public void join(SignalingSession session, String roomName) {
        if (!RoomNames.isValid(roomName)) {
            throw new SignalingException(ErrorReason.INVALID_ROOM, "Invalid room name");
        }
        if (session.isJoined()) {
            throw new SignalingException(ErrorReason.ALREADY_JOINED, "Already joined room " + session.getRoomName());
        }
        JoinResult result = roomRegistry.join(roomName, session);
        if (result.isRoomFull()) {
            session.awaitPeer();
            throw new SignalingException(ErrorReason.ROOM_FULL, "Room is full: " + roomName);
        }
        // 다른 스레드에서 닫힌 세션의 disconnect가 방 배정보다 먼저 끝났으면 여기서 정리한다.
        // disconnect는 CLOSED 전환 후 방을 읽으므로 둘 중 한쪽은 반드시 leave를 호출한다.
        if (session.getState() == SessionState.CLOSED) {
            log.debug("Session {} closed while joining room {}, releasing slot", session.getSessionId(), roomName);
            roomRegistry.leave(roomName, session.getSessionId());
            return;
        }
        log.debug("Session {} joined room {} as {}", session.getSessionId(), roomName, result.getRole().toValue());
    }

    /**
     * 명시적 leave는 방에서 나간 뒤 연결을 정상 종료한다.
     */
    public void leave(SignalingSession session) {
        String roomName = session.getRoomName();
        if (roomName != null) {
            roomRegistry.leave(roomName, session.getSessionId());
        }
        session.close(CloseStatus.NORMAL);
    }

    /**
     * 연결이 어떤 이유로든 닫혔을 때 호출되는 정리 경로.
     */
    public void disconnect(SignalingSession session) {
        session.markClosed();
        String roomName = session.getRoomName();
        if (roomName != null) {
            roomRegistry.leave(roomName, session.getSessionId());
        }
    }

    private void relay(SignalingSession session, SignalMessage message) {
        String roomName = session.getRoomName();
        if (roomName == null || session.getState() != SessionState.PAIRED) {
            throw new SignalingException(ErrorReason.NO_PEER, "No peer in room");
        }
        RelayResult result = roomRegistry.relay(roomName, session.getSessionId(), message);
        if (result == RelayResult.NO_PEER) {
            throw new SignalingException(ErrorReason.NO_PEER, "No peer in room");
        }
    }
}
