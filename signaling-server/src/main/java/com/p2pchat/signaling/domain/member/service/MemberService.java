package com.p2pchat.signaling.domain.member.service;

import com.p2pchat.signaling.domain.auth.service.AuthException;
import com.p2pchat.signaling.domain.auth.service.AuthFailure;
import com.p2pchat.signaling.domain.auth.service.JwtService;
import com.p2pchat.signaling.domain.member.dto.MemberLoginRequest;
import com.p2pchat.signaling.domain.member.dto.MemberResponse;
import com.p2pchat.signaling.domain.member.dto.MemberSignupRequest;
import com.p2pchat.signaling.domain.member.entity.Member;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * 개발/테스트용 회원 가입과 토큰 발급. 프로세스가 재시작되면 회원 정보는 사라진다.
 */
@Service
public class MemberService {

    private static final Logger log = LoggerFactory.getLogger(MemberService.class);

    private final Map<String, Member> members = new ConcurrentHashMap<>();
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final Clock clock;

    public MemberService(PasswordEncoder passwordEncoder, JwtService jwtService, Clock clock) {
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
        this.clock = clock;
    }

    public MemberResponse signup(MemberSignupRequest request) {
        String hash = passwordEncoder.encode(request.getPassword());
        Member member = new Member(request.getUsername(), hash, clock.instant());
        if (members.putIfAbsent(member.getUsername(), member) != null) {
            throw new IllegalArgumentException("Username already exists");
        }
        log.info("Member registered: {}", member.getUsername());
        return toResponse(member);
    }

    /**
     * @return 서명된 bearer 토큰
     * @throws AuthException 사용자가 없거나 비밀번호가 틀린 경우
     */
    public String login(MemberLoginRequest request) {
        Member member = members.get(request.getUsername());
        if (member == null || !passwordEncoder.matches(request.getPassword(), member.getPasswordHash())) {
            throw new AuthException(AuthFailure.INVALID, "Invalid credentials");
        }
        log.info("Member logged in: {}", member.getUsername());
        return jwtService.issueToken(member.getUsername());
    }

    private MemberResponse toResponse(Member member) {
        MemberResponse response = new MemberResponse();
        response.setUsername(member.getUsername());
        response.setCreatedAt(member.getCreatedAt());
        return response;
    }
}
