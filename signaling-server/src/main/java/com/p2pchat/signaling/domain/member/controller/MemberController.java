package com.p2pchat.signaling.domain.member.controller;

import com.p2pchat.signaling.domain.member.dto.MemberLoginRequest;
import com.p2pchat.signaling.domain.member.dto.MemberResponse;
import com.p2pchat.signaling.domain.member.dto.MemberSignupRequest;
import com.p2pchat.signaling.domain.member.dto.TokenResponse;
import com.p2pchat.signaling.domain.member.service.MemberService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/members")
public class MemberController {

    private final MemberService memberService;

    public MemberController(MemberService memberService) {
        this.memberService = memberService;
    }

    @PostMapping("/signup")
    public ResponseEntity<MemberResponse> signup(@Valid @RequestBody MemberSignupRequest request) {
        MemberResponse response = memberService.signup(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody MemberLoginRequest request) {
        return ResponseEntity.ok(new TokenResponse(memberService.login(request)));
    }
}
