package com.p2pchat.signaling.websocket;

import com.p2pchat.signaling.config.SignalingProperties;
import com.p2pchat.signaling.model.ErrorReason;
import com.p2pchat.signaling.model.Identity;
import com.p2pchat.signaling.model.SignalMessage;
import com.p2pchat.signaling.ratelimit.RateLimitKind;
import com.p2pchat.signaling.ratelimit.RateLimiter;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * 브라우저와의 WebSocket 시그널링 프레임을 받아 세션 상태 머신과 {@link MessageRouter}로 넘긴다.
 */
@Component
public class SignalingWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(SignalingWebSocketHandler.class);

    static final CloseStatus RATE_LIMITED = CloseStatus.POLICY_VIOLATION.withReason("Message rate limit exceeded");

    private final MessageRouter messageRouter;
    private final RateLimiter rateLimiter;
    private final SignalMessageCodec codec;
    private final SignalingProperties properties;
    private final Clock clock;

    // 세션 ID -> 시그널링 세션
    private final Map<String, SignalingSession> sessions = new ConcurrentHashMap<>();

    public SignalingWebSocketHandler(MessageRouter messageRouter, RateLimiter rateLimiter,
            SignalMessageCodec codec, SignalingProperties properties, Clock clock) {
        this.messageRouter = messageRouter;
        this.rateLimiter = rateLimiter;
        this.codec = codec;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        // 인증/허용은 TokenHandshakeInterceptor에서 끝났다. identity가 없으면 우회된 연결이다.
        Identity identity = (Identity) session.getAttributes().get(TokenHandshakeInterceptor.ATTR_IDENTITY);
        if (identity == null) {
            log.warn("Closing session {} without authenticated identity", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Unauthenticated"));
            return;
        }
        String remoteAddress = (String) session.getAttributes().get(TokenHandshakeInterceptor.ATTR_REMOTE_ADDRESS);

        // 송신은 여러 스레드(피어의 중계, 레지스트리 알림)에서 일어나므로 버퍼 크기와 시간이 제한된 데코레이터로 감싼다.
        WebSocketSession outbound = new ConcurrentWebSocketSessionDecorator(session,
                (int) properties.getSendTimeLimit().toMillis(),
                (int) properties.getSendBufferSize().toBytes(),
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);
        SignalingSession signalingSession = new SignalingSession(session.getId(), identity, remoteAddress,
                outbound, codec, clock);
        sessions.put(session.getId(), signalingSession);
        signalingSession.activate();
        log.info("WebSocket connected: {} ({})", session.getId(), identity.getSubject());

        String roomName = (String) session.getAttributes().get(TokenHandshakeInterceptor.ATTR_ROOM);
        if (roomName != null) {
            dispatch(signalingSession, () -> messageRouter.join(signalingSession, roomName));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        SignalingSession signalingSession = sessions.get(session.getId());
        if (signalingSession == null || signalingSession.getState() == SessionState.CLOSED) {
            return;
        }
        signalingSession.touch();

        if (!rateLimiter.admit("id:" + signalingSession.getIdentity().getSubject(), RateLimitKind.MESSAGE)) {
            log.warn("Message rate limit exceeded for session {} ({})", session.getId(),
                    signalingSession.getIdentity().getSubject());
            signalingSession.close(RATE_LIMITED);
            return;
        }

        dispatch(signalingSession, () -> {
            long maxBytes = properties.getMaxMessageSize().toBytes();
            if (message.getPayloadLength() > maxBytes) {
                throw new SignalingException(ErrorReason.PAYLOAD_TOO_LARGE,
                        "Message exceeds " + maxBytes + " bytes");
            }
            SignalMessage signal = codec.decode(message.getPayload());
            log.debug("Incoming {} from session {}", signal.getType().toValue(), session.getId());
            messageRouter.route(signalingSession, signal);
        });
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        SignalingSession signalingSession = sessions.get(session.getId());
        if (signalingSession != null) {
            signalingSession.touch();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
        SignalingSession signalingSession = sessions.get(session.getId());
        if (signalingSession != null) {
            signalingSession.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        // 연결이 끊어지면 해당 세션을 방에서 정리하고 남은 피어에게 peer-left를 보낸다.
        SignalingSession signalingSession = sessions.remove(session.getId());
        if (signalingSession == null) {
            return;
        }
        messageRouter.disconnect(signalingSession);
        log.info("WebSocket closed: {} ({}) status {}", session.getId(),
                signalingSession.getIdentity().getSubject(), status.getCode());
    }

    /**
     * 서버 종료 시 열린 세션을 모두 GOING_AWAY로 닫는다. 정리는 일반 종료 경로를 따른다.
     */
    @PreDestroy
    public void shutdown() {
        List<SignalingSession> open = List.copyOf(sessions.values());
        if (!open.isEmpty()) {
            log.info("Closing {} signaling sessions for shutdown", open.size());
        }
        open.forEach(s -> s.close(CloseStatus.GOING_AWAY));
    }

    public Collection<SignalingSession> openSessions() {
        return List.copyOf(sessions.values());
    }

    private void dispatch(SignalingSession session, Runnable action) {
        try {
            action.run();
        } catch (SignalingException ex) {
            log.debug("Signaling error for session {}: {} {}", session.getSessionId(),
                    ex.getReason().toValue(), ex.getMessage());
            session.deliver(SignalMessage.error(ex.getReason(), ex.getMessage()));
        }
    }
}
