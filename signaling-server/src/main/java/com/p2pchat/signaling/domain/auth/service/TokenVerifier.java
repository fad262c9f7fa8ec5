package com.p2pchat.signaling.domain.auth.service;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.p2pchat.signaling.global.config.JwtProperties;
import com.p2pchat.signaling.model.Identity;
import java.time.Clock;
import org.springframework.stereotype.Service;

/**
 * Bearer 토큰을 검증하고 subject 클레임을 {@link Identity}로 돌려준다.
 * 공유 HMAC 키 외에는 상태가 없다.
 */
@Service
public class TokenVerifier {

    private final JwtProperties properties;
    private final Clock clock;
    private volatile JWTVerifier verifier;

    public TokenVerifier(JwtProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws AuthException 토큰이 없으면 MISSING, 만료되었으면 EXPIRED, 그 밖의 서명/형식 오류는 INVALID
     */
    public Identity verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthException(AuthFailure.MISSING, "Missing access token");
        }
        DecodedJWT jwt;
        try {
            // 서명 비교는 java-jwt 내부에서 MessageDigest.isEqual로 상수 시간에 수행된다.
            jwt = getVerifier().verify(token);
        } catch (TokenExpiredException ex) {
            throw new AuthException(AuthFailure.EXPIRED, "Access token expired", ex);
        } catch (JWTVerificationException ex) {
            throw new AuthException(AuthFailure.INVALID, "Invalid access token", ex);
        }
        String subject = jwt.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new AuthException(AuthFailure.INVALID, "Access token has no subject");
        }
        return new Identity(subject, jwt.getExpiresAtAsInstant());
    }

    private JWTVerifier getVerifier() {
        JWTVerifier current = verifier;
        if (current != null) {
            return current;
        }
        String secret = properties.getSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("jwt.secret is required");
        }
        JWTVerifier.BaseVerification verification = (JWTVerifier.BaseVerification) JWT
                .require(Algorithm.HMAC256(secret))
                .withIssuer(properties.getIssuer())
                .withClaimPresence("exp");
        current = verification.build(clock);
        verifier = current;
        return current;
    }
}
