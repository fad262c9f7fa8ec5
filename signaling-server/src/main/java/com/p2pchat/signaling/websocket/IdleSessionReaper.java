package com.p2pchat.signaling.websocket;

import com.p2pchat.signaling.config.SignalingProperties;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

/**
 * 설정된 시간 동안 아무 프레임(ping 포함)도 받지 못한 세션을 전송 실패로 간주하고 닫는다.
 */
@Component
public class IdleSessionReaper {

    private static final Logger log = LoggerFactory.getLogger(IdleSessionReaper.class);

    static final CloseStatus IDLE_TIMEOUT = CloseStatus.SESSION_NOT_RELIABLE.withReason("Idle timeout");

    private final SignalingWebSocketHandler handler;
    private final SignalingProperties properties;
    private final Clock clock;

    public IdleSessionReaper(SignalingWebSocketHandler handler, SignalingProperties properties, Clock clock) {
        this.handler = handler;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${signaling.idle-check-interval:PT5S}")
    public int reapIdleSessions() {
        Instant cutoff = clock.instant().minus(properties.getIdleTimeout());
        int reaped = 0;
        for (SignalingSession session : handler.openSessions()) {
            if (session.getState() != SessionState.CLOSED && session.getLastActivity().isBefore(cutoff)) {
                log.info("Closing idle session {} ({}), last activity {}", session.getSessionId(),
                        session.getIdentity().getSubject(), session.getLastActivity());
                session.close(IDLE_TIMEOUT);
                reaped++;
            }
        }
        return reaped;
    }
}
