package com.p2pchat.signaling.domain.member.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class MemberControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void signupThenLoginIssuesToken() throws Exception {
        String username = uniqueUsername();

        mockMvc.perform(post("/api/members/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(username, "secret-pw")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.username").value(username))
                .andExpect(jsonPath("$.createdAt").exists());

        mockMvc.perform(post("/api/members/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(username, "secret-pw")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").isNotEmpty());
    }

    @Test
    void duplicateSignupIsRejected() throws Exception {
        String username = uniqueUsername();
        signup(username, "secret-pw");

        mockMvc.perform(post("/api/members/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(username, "another-pw")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Username already exists"));
    }

    @Test
    void signupValidatesInput() throws Exception {
        mockMvc.perform(post("/api/members/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials("ab", "secret-pw")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        mockMvc.perform(post("/api/members/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(uniqueUsername(), "123")))
                .andExpect(status().isBadRequest());
    }

    @Test
    void loginWithWrongPasswordIsUnauthorized() throws Exception {
        String username = uniqueUsername();
        signup(username, "secret-pw");

        mockMvc.perform(post("/api/members/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(username, "wrong-pw")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid credentials"));

        mockMvc.perform(post("/api/members/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(uniqueUsername(), "secret-pw")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void roomStatusRequiresToken() throws Exception {
        mockMvc.perform(get("/api/rooms/{room}/status", "lobby"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/api/rooms/{room}/status", "lobby")
                        .header("Authorization", "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void roomStatusReportsEmptyRoom() throws Exception {
        String token = signupAndLogin();

        mockMvc.perform(get("/api/rooms/{room}/status", "quiet-room")
                        .header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.room").value("quiet-room"))
                .andExpect(jsonPath("$.occupants").value(0))
                .andExpect(jsonPath("$.full").value(false));

        mockMvc.perform(get("/api/rooms/{room}/status", "a".repeat(65))
                        .header("Authorization", "Bearer " + token))
                .andExpect(status().isBadRequest());
    }

    @Test
    void homeIsPublic() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(content().string("Hello, P2P Chat Signaling Server!"));
    }

    @Test
    void unmappedApiIsDenied() throws Exception {
        String token = signupAndLogin();

        mockMvc.perform(get("/api/admin").header("Authorization", "Bearer " + token))
                .andExpect(status().is4xxClientError());
    }

    private String signupAndLogin() throws Exception {
        String username = uniqueUsername();
        signup(username, "secret-pw");
        String body = mockMvc.perform(post("/api/members/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(username, "secret-pw")))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode json = objectMapper.readTree(body);
        return json.get("token").asText();
    }

    private void signup(String username, String password) throws Exception {
        mockMvc.perform(post("/api/members/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(username, password)))
                .andExpect(status().isCreated());
    }

    private String credentials(String username, String password) throws Exception {
        return objectMapper.writeValueAsString(Map.of("username", username, "password", password));
    }

    private static String uniqueUsername() {
        return "user-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
