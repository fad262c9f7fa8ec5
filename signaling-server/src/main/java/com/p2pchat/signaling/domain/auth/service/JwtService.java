package com.p2pchat.signaling.domain.auth.service;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.p2pchat.signaling.global.config.JwtProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import org.springframework.stereotype.Service;

/**
 * 개발용 로그인 API가 사용하는 토큰 발급기. 검증 쪽은 {@link TokenVerifier}가 담당한다.
 */
@Service
public class JwtService {

    private final JwtProperties properties;
    private final Clock clock;
    private volatile Algorithm algorithm;

    public JwtService(JwtProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public String issueToken(String subject) {
        Instant now = clock.instant();
        Instant exp = now.plusSeconds(properties.getTtlSeconds());
        return JWT.create()
                .withSubject(subject)
                .withIssuer(properties.getIssuer())
                .withIssuedAt(Date.from(now))
                .withExpiresAt(Date.from(exp))
                .sign(getAlgorithm());
    }

    private Algorithm getAlgorithm() {
        if (algorithm != null) {
            return algorithm;
        }
        String secret = properties.getSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("jwt.secret is required");
        }
        algorithm = Algorithm.HMAC256(secret);
        return algorithm;
    }
}
