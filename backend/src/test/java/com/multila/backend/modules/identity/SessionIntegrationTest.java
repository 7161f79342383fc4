package com.multila.backend.modules.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.multila.backend.modules.registry.domain.ApplicationSession;
import com.multila.backend.modules.registry.domain.AuthMode;
import com.multila.backend.support.AbstractPostgresIntegrationTest;
import com.multila.backend.support.ApiTestClient;
import com.multila.backend.support.TestFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class SessionIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestFixtures fixtures;

    private ApiTestClient client;

    @BeforeEach
    void setUp() {
        client = new ApiTestClient(mockMvc, objectMapper);
    }

    @Test
    void anonymousSessionIsCreatedThenResumedWithItsToken() throws Exception {
        fixtures.createApplicationSession("S1", AuthMode.NONE);

        JsonNode created = client.newAnonymousSession("S1");
        String token = created.path("token").asText();

        assertThat(created.path("sess_code").asText()).isEqualTo("S1");
        assertThat(created.path("auth_mode").asText()).isEqualTo("none");
        assertThat(token).matches("[0-9a-f]{64}");
        assertThat(created.path("config").path("exercises").has("ex1")).isTrue();

        mockMvc.perform(post("/session")
                        .header("Authorization", "Token " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sess": "S1"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").value(token))
                .andExpect(jsonPath("$.user_code").value(created.path("user_code").asText()));

        Integer userSessions = jdbcTemplate.queryForObject("select count(*) from user_app_session", Integer.class);
        assertThat(userSessions).isEqualTo(1);
    }

    @Test
    void unknownTokenIsUnauthorized() throws Exception {
        fixtures.createApplicationSession("S1", AuthMode.NONE);

        mockMvc.perform(post("/session/")
                        .header("Authorization", "Token deadbeef")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sess": "S1"}
                                """))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_TOKEN"));
    }

    @Test
    void unknownApplicationSessionIsNotFound() throws Exception {
        mockMvc.perform(post("/session/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sess": "nope"}
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("APP_SESSION_NOT_FOUND"));
    }

    @Test
    void registeredUserKeepsOneTokenAndOneUserSession() throws Exception {
        fixtures.createApplicationSession("S2", AuthMode.LOGIN);

        mockMvc.perform(post("/session/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sess": "S2"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.auth_mode").value("login"))
                .andExpect(jsonPath("$.token").doesNotExist());

        mockMvc.perform(post("/register_user/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username": "alice", "email": "alice@example.org", "password": "correct-horse"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.username").value("alice"));

        JsonNode first = login("S2", "alice", "correct-horse", 201);
        JsonNode second = login("S2", "alice", "correct-horse", 200);

        assertThat(second.path("token").asText()).isEqualTo(first.path("token").asText());
        assertThat(second.path("user_code").asText()).isEqualTo(first.path("user_code").asText());

        mockMvc.perform(post("/session/")
                        .header("Authorization", "Token " + first.path("token").asText())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sess": "S2"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_code").value(first.path("user_code").asText()));
    }

    @Test
    void wrongPasswordIsRejected() throws Exception {
        fixtures.createApplicationSession("S2", AuthMode.LOGIN);
        fixtures.createUser("bob", "bob@example.org", "correct-horse");

        mockMvc.perform(post("/session_login/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sess": "S2", "email": "bob@example.org", "password": "battery-staple"}
                                """))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
    }

    @Test
    void anonymousTokenCannotEnterLoginSession() throws Exception {
        fixtures.createApplicationSession("S1", AuthMode.NONE);
        fixtures.createApplicationSession("S2", AuthMode.LOGIN);
        String token = client.newAnonymousSession("S1").path("token").asText();

        mockMvc.perform(post("/session/")
                        .header("Authorization", "Token " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sess": "S2"}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("AUTH_MODE_MISMATCH"));
    }

    @Test
    void weakPasswordIsRejectedOnRegistration() throws Exception {
        mockMvc.perform(post("/register_user/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username": "carol", "password": "short"}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("PW_TOO_SHORT"));
    }

    @Test
    void defaultSessionIsResolvedFromReferrer() throws Exception {
        ApplicationSession session = fixtures.createApplicationSession("S1", AuthMode.NONE);
        fixtures.makeDefault(session);

        mockMvc.perform(get("/session/default")
                        .param("referrer", TestFixtures.APP_URL + "/S1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sess_code").value("S1"));

        mockMvc.perform(get("/session/default")
                        .param("referrer", "https://unknown.example.org/"))
                .andExpect(status().isNotFound());
    }

    private JsonNode login(String sess, String username, String password, int expectedStatus) throws Exception {
        MvcResult result = mockMvc.perform(post("/session_login/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sess": "%s", "username": "%s", "password": "%s"}
                                """.formatted(sess, username, password)))
                .andExpect(status().is(expectedStatus))
                .andReturn();
        return client.read(result);
    }
}
