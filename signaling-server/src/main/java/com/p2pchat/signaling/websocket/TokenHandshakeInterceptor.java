package com.p2pchat.signaling.websocket;

import com.p2pchat.signaling.config.SignalingProperties;
import com.p2pchat.signaling.domain.auth.service.AuthException;
import com.p2pchat.signaling.domain.auth.service.TokenVerifier;
import com.p2pchat.signaling.model.Identity;
import com.p2pchat.signaling.ratelimit.RateLimitKind;
import com.p2pchat.signaling.ratelimit.RateLimiter;
import com.p2pchat.signaling.room.RoomNames;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * WebSocket 업그레이드 전에 주소 기준 허용 검사, 토큰 검증, identity 기준 허용 검사를 순서대로 수행한다.
 * 하나라도 실패하면 세션이 만들어지기 전에 HTTP 상태 코드로 거절한다.
 */
@Component
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

    public static final String ATTR_IDENTITY = "signaling.identity";
    public static final String ATTR_REMOTE_ADDRESS = "signaling.remoteAddress";
    public static final String ATTR_ROOM = "signaling.room";

    static final String ENDPOINT = "/ws";

    private static final Logger log = LoggerFactory.getLogger(TokenHandshakeInterceptor.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenVerifier tokenVerifier;
    private final RateLimiter rateLimiter;
    private final SignalingProperties properties;

    public TokenHandshakeInterceptor(TokenVerifier tokenVerifier, RateLimiter rateLimiter,
            SignalingProperties properties) {
        this.tokenVerifier = tokenVerifier;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
            WebSocketHandler wsHandler, Map<String, Object> attributes) {
        // 1. 인증 전에 주소 단위로 연결 시도를 제한한다. (credential stuffing 완화)
        String address = clientAddress(request);
        if (!rateLimiter.admit("addr:" + address, RateLimitKind.CONNECTION)) {
            log.warn("Connection rate limit exceeded for address {}", address);
            response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
            return false;
        }

        String roomName = roomFromPath(request.getURI().getRawPath());
        if (roomName != null && !RoomNames.isValid(roomName)) {
            log.warn("Refused handshake from {}: invalid room name in path", address);
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }

        // 2. 토큰 검증
        Identity identity;
        try {
            identity = tokenVerifier.verify(extractToken(request));
        } catch (AuthException ex) {
            log.warn("Refused handshake from {}: {}", address, ex.getFailure());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        // 3. 인증된 identity 단위 제한
        if (!rateLimiter.admit("id:" + identity.getSubject(), RateLimitKind.CONNECTION)) {
            log.warn("Connection rate limit exceeded for identity {}", identity.getSubject());
            response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
            return false;
        }

        attributes.put(ATTR_IDENTITY, identity);
        attributes.put(ATTR_REMOTE_ADDRESS, address);
        if (roomName != null) {
            attributes.put(ATTR_ROOM, roomName);
        }
        log.debug("Handshake accepted for {} from {}", identity.getSubject(), address);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
            WebSocketHandler wsHandler, Exception exception) {
        // 추가 작업 없음
    }

    /**
     * query의 token 파라미터를 우선하고, 없으면 Authorization: Bearer 헤더를 사용한다.
     */
    String extractToken(ServerHttpRequest request) {
        String fromQuery = UriComponentsBuilder.fromUri(request.getURI()).build()
                .getQueryParams().getFirst("token");
        if (fromQuery != null && !fromQuery.isBlank()) {
            return UriUtils.decode(fromQuery, StandardCharsets.UTF_8);
        }
        String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            return header.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }

    /**
     * /ws/{room} 형태의 경로에서 방 이름을 꺼낸다. /ws 이면 null.
     */
    static String roomFromPath(String rawPath) {
        if (rawPath == null) {
            return null;
        }
        int index = rawPath.indexOf(ENDPOINT + "/");
        if (index < 0) {
            return null;
        }
        String segment = rawPath.substring(index + ENDPOINT.length() + 1);
        if (segment.isEmpty()) {
            return null;
        }
        return UriUtils.decode(segment, StandardCharsets.UTF_8);
    }

    private String clientAddress(ServerHttpRequest request) {
        if (properties.isTrustForwardedFor()) {
            String forwarded = request.getHeaders().getFirst("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
        }
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote == null) {
            return "unknown";
        }
        return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
    }
}
