package com.p2pchat.signaling.websocket;

import com.p2pchat.signaling.model.Identity;
import com.p2pchat.signaling.model.ParticipantRole;
import com.p2pchat.signaling.model.SignalMessage;
import com.p2pchat.signaling.room.Participant;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

/**
 * 연결 하나의 서버 측 상태 머신.
 *
 * <p>피어에 대한 참조는 갖지 않는다. 방 참가 여부와 PAIRED 전환은 모두 {@link com.p2pchat.signaling.room.RoomRegistry}가
 * 방 락 안에서 호출하는 {@link Participant} 콜백으로만 바뀐다.
 */
public class SignalingSession implements Participant {

    private static final Logger log = LoggerFactory.getLogger(SignalingSession.class);

    private final String id;
    private final Identity identity;
    private final String remoteAddress;
    private final WebSocketSession connection;
    private final SignalMessageCodec codec;
    private final Clock clock;
    private final Instant connectedAt;

    private volatile SessionState state = SessionState.CONNECTING;
    private volatile String roomName;
    private volatile ParticipantRole role;
    private volatile Instant joinedAt;
    private volatile Instant lastActivity;

    public SignalingSession(String id, Identity identity, String remoteAddress, WebSocketSession connection,
            SignalMessageCodec codec, Clock clock) {
        this.id = id;
        this.identity = identity;
        this.remoteAddress = remoteAddress;
        this.connection = connection;
        this.codec = codec;
        this.clock = clock;
        this.connectedAt = clock.instant();
        this.lastActivity = connectedAt;
    }

    /**
     * 핸드셰이크에서 인증과 허용 검사를 통과한 뒤 호출된다.
     */
    public synchronized void activate() {
        if (state == SessionState.CONNECTING) {
            state = SessionState.AUTHENTICATED;
        }
    }

    /**
     * 방이 가득 차 등록되지 못했을 때. 방 없이 AWAITING_PEER에 머물며 재시도를 기다린다.
     */
    public synchronized void awaitPeer() {
        if (state == SessionState.AUTHENTICATED) {
            state = SessionState.AWAITING_PEER;
        }
    }

    public void touch() {
        lastActivity = clock.instant();
    }

    @Override
    public synchronized void assignedTo(String roomName, ParticipantRole role) {
        this.roomName = roomName;
        this.role = role;
        this.joinedAt = clock.instant();
        if (state != SessionState.CLOSED) {
            state = SessionState.AWAITING_PEER;
        }
    }

    @Override
    public synchronized void releasedFrom(String roomName) {
        if (!roomName.equals(this.roomName)) {
            return;
        }
        this.roomName = null;
        this.role = null;
        this.joinedAt = null;
        if (state != SessionState.CLOSED) {
            state = SessionState.AUTHENTICATED;
        }
    }

    @Override
    public boolean deliver(SignalMessage message) {
        synchronized (this) {
            if (state == SessionState.CLOSED || !connection.isOpen()) {
                return false;
            }
            switch (message.getType()) {
                case PEER_JOINED -> state = SessionState.PAIRED;
                case PEER_LEFT -> state = SessionState.AWAITING_PEER;
                default -> {
                }
            }
        }
        try {
            connection.sendMessage(new TextMessage(codec.encode(message)));
            return true;
        } catch (IOException | SessionLimitExceededException ex) {
            log.warn("Failed to send {} to session {}: {}", message.getType().toValue(), id, ex.getMessage());
            close(CloseStatus.SERVER_ERROR);
            return false;
        }
    }

    /**
     * CLOSED로 전환하고 연결을 닫는다. 이미 닫혔으면 아무것도 하지 않는다.
     */
    public void close(CloseStatus status) {
        if (!markClosed()) {
            return;
        }
        try {
            connection.close(status);
        } catch (IOException ex) {
            log.debug("Error while closing session {}: {}", id, ex.getMessage());
        }
    }

    /**
     * @return 이번 호출로 CLOSED가 되었으면 true
     */
    public synchronized boolean markClosed() {
        if (state == SessionState.CLOSED) {
            return false;
        }
        state = SessionState.CLOSED;
        return true;
    }

    @Override
    public String getSessionId() {
        return id;
    }

    @Override
    public Identity getIdentity() {
        return identity;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public SessionState getState() {
        return state;
    }

    public String getRoomName() {
        return roomName;
    }

    public boolean isJoined() {
        return roomName != null;
    }

    public ParticipantRole getRole() {
        return role;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }
}
