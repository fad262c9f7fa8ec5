package com.p2pchat.signaling.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.p2pchat.signaling.config.SignalingProperties;
import com.p2pchat.signaling.ratelimit.RateLimiter;
import com.p2pchat.signaling.room.RoomRegistry;
import com.p2pchat.signaling.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;

class IdleSessionReaperTest {

    private MutableClock clock;
    private RoomRegistry registry;
    private SignalingWebSocketHandler handler;
    private IdleSessionReaper reaper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        SignalingProperties properties = new SignalingProperties();
        properties.setIdleTimeout(Duration.ofSeconds(60));
        registry = new RoomRegistry(clock);
        handler = new SignalingWebSocketHandler(new MessageRouter(registry), new RateLimiter(properties, clock),
                new SignalMessageCodec(new ObjectMapper()), properties, clock);
        reaper = new IdleSessionReaper(handler, properties, clock);
    }

    @Test
    void closesOnlySessionsPastIdleTimeout() throws Exception {
        FakeConnection idle = new FakeConnection("A", "alice", "r1");
        FakeConnection active = new FakeConnection("B", "bob", "r1");
        handler.afterConnectionEstablished(idle.session);
        handler.afterConnectionEstablished(active.session);

        clock.advance(Duration.ofSeconds(45));
        handler.handleTextMessage(active.session, new TextMessage("{\"type\":\"ping\"}"));
        clock.advance(Duration.ofSeconds(30));

        assertThat(reaper.reapIdleSessions()).isEqualTo(1);
        verify(idle.session).close(IdleSessionReaper.IDLE_TIMEOUT);
        verify(active.session, never()).close(any());

        // 컨테이너의 종료 콜백으로 방이 정리되고 남은 피어가 알림을 받는다.
        handler.afterConnectionClosed(idle.session, IdleSessionReaper.IDLE_TIMEOUT);
        assertThat(active.framesOfType("peer-left")).hasSize(1);
        assertThat(registry.occupancy("r1")).isEqualTo(1);
    }

    @Test
    void pongFramesCountAsActivity() throws Exception {
        FakeConnection connection = new FakeConnection("A", "alice", null);
        handler.afterConnectionEstablished(connection.session);

        clock.advance(Duration.ofSeconds(50));
        handler.handlePongMessage(connection.session, new PongMessage());
        clock.advance(Duration.ofSeconds(50));

        assertThat(reaper.reapIdleSessions()).isZero();
        verify(connection.session, never()).close(any(CloseStatus.class));
    }

    @Test
    void alreadyClosedSessionsAreSkipped() throws Exception {
        FakeConnection connection = new FakeConnection("A", "alice", null);
        handler.afterConnectionEstablished(connection.session);
        clock.advance(Duration.ofMinutes(5));

        assertThat(reaper.reapIdleSessions()).isEqualTo(1);
        assertThat(reaper.reapIdleSessions()).isZero();
    }
}
