package com.p2pchat.signaling.global.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.p2pchat.signaling.domain.auth.service.AuthException;
import com.p2pchat.signaling.domain.auth.service.TokenVerifier;
import com.p2pchat.signaling.model.Identity;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * REST API의 Authorization: Bearer 토큰을 검증해 SecurityContext에 identity를 채운다.
 * WebSocket 핸드셰이크는 이 필터를 거치지 않는다.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenVerifier tokenVerifier;
    private final ObjectMapper objectMapper;

    public JwtAuthenticationFilter(TokenVerifier tokenVerifier, ObjectMapper objectMapper) {
        this.tokenVerifier = tokenVerifier;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith("/api/rooms");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            // 토큰이 없으면 인증 없이 진행하고, 보호된 경로는 entry point가 401을 돌려준다.
            filterChain.doFilter(request, response);
            return;
        }

        Identity identity;
        try {
            identity = tokenVerifier.verify(header.substring(BEARER_PREFIX.length()).trim());
        } catch (AuthException ex) {
            SecurityContextHolder.clearContext();
            writeError(response, ex.getMessage());
            return;
        }

        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(
                UsernamePasswordAuthenticationToken.authenticated(identity.getSubject(), null, List.of()));
        SecurityContextHolder.setContext(context);
        filterChain.doFilter(request, response);
    }

    private void writeError(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), Map.of("error", message));
    }
}
