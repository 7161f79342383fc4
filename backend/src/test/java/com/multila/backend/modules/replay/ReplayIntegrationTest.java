package com.multila.backend.modules.replay;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
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
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class ReplayIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String EMBED_ORIGIN = "https://apps.example.org";
    private static final String CONTROLLER_ORIGIN = "https://admin.example.org";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestFixtures fixtures;

    private ApiTestClient client;
    private String token;
    private String adminToken;
    private long trackingSessionId;

    @BeforeEach
    void setUp() throws Exception {
        client = new ApiTestClient(mockMvc, objectMapper);
        fixtures.createApplicationSession("S1", AuthMode.NONE);
        fixtures.createStaff("replay-admin", "admin-secret-1");
        token = client.newAnonymousSession("S1").path("token").asText();
        trackingSessionId = client.openTrackingSession(token);
        client.sendMouseEvent(token, trackingSessionId, "2024-03-01T10:00:02Z");
        client.sendMouseEvent(token, trackingSessionId, "2024-03-01T10:00:01Z");
        adminToken = client.adminAccessToken("replay-admin", "admin-secret-1");
    }

    @Test
    void describesRecordedSession() throws Exception {
        mockMvc.perform(get("/replay/" + trackingSessionId).header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.replayUrl").value(
                        TestFixtures.APP_URL + "/S1/?sess=S1&replay=" + trackingSessionId))
                .andExpect(jsonPath("$.embedOrigin").value(EMBED_ORIGIN))
                .andExpect(jsonPath("$.controllerOrigin").value(CONTROLLER_ORIGIN))
                .andExpect(jsonPath("$.eventCount").value(2))
                .andExpect(jsonPath("$.config.exercises.ex1.hints").value(2));
    }

    @Test
    void chunksFollowEventTime() throws Exception {
        client.sendEvent(token, trackingSessionId, "2024-03-01T10:00:02Z", "mouse",
                "{\"frames\": [[\"m\", 5, 5, 0.2]], \"timeElapsed\": 0.9}");
        client.sendEvent(token, trackingSessionId, "2024-03-01T10:00:00Z", "custom_marker", "[1, 2]");

        chunk(0)
                .andExpect(jsonPath("$.i").value(0))
                .andExpect(jsonPath("$.n_chunks").value(4))
                .andExpect(jsonPath("$.replaydata.event_type").value("custom_marker"))
                .andExpect(jsonPath("$.replaydata.replayable").value(false))
                .andExpect(jsonPath("$.replaydata.event_value[1]").value(2))
                .andExpect(jsonPath("$.replaydata.event_time").value("2024-03-01T10:00:00Z"));
        chunk(1)
                .andExpect(jsonPath("$.i").value(1))
                .andExpect(jsonPath("$.n_chunks").doesNotExist())
                .andExpect(jsonPath("$.replaydata.event_type").value("mouse"))
                .andExpect(jsonPath("$.replaydata.event_time").value("2024-03-01T10:00:01Z"));
        chunk(2)
                .andExpect(jsonPath("$.replaydata.event_time").value("2024-03-01T10:00:02Z"))
                .andExpect(jsonPath("$.replaydata.event_value.timeElapsed").value(0.5));
        chunk(3)
                .andExpect(jsonPath("$.replaydata.event_time").value("2024-03-01T10:00:02Z"))
                .andExpect(jsonPath("$.replaydata.event_value.timeElapsed").value(0.9));
        chunk(4)
                .andExpect(jsonPath("$.replaydata").doesNotExist());
    }

    @Test
    void messagesDriveTheReplay() throws Exception {
        message("UNINITIALIZED", CONTROLLER_ORIGIN, "embed_loaded", "null")
                .andExpect(jsonPath("$.state").value("AWAITING_CONFIG"));
        message("AWAITING_CONFIG", EMBED_ORIGIN, "init", "null")
                .andExpect(jsonPath("$.state").value("IDLE"))
                .andExpect(jsonPath("$.outbound[0].target").value("embed"))
                .andExpect(jsonPath("$.outbound[0].msgtype").value("app_config"));
        message("IDLE", EMBED_ORIGIN, "pulldata", "1")
                .andExpect(jsonPath("$.outbound[0].msgtype").value("replaydata"))
                .andExpect(jsonPath("$.outbound[0].data.i").value(1))
                .andExpect(jsonPath("$.outbound[0].data.n_chunks").value(2));
        message("IDLE", EMBED_ORIGIN, "pulldata", "2")
                .andExpect(jsonPath("$.state").value("IDLE"))
                .andExpect(jsonPath("$.outbound[0].msgtype").value("replay_stopped"));
        message("IDLE", CONTROLLER_ORIGIN, "replay_ctrl_stop", "null")
                .andExpect(jsonPath("$.state").value("STOPPED"))
                .andExpect(jsonPath("$.reload_live_after_ms").value(3000));
    }

    @Test
    void foreignOriginIsIgnored() throws Exception {
        message("IDLE", "https://evil.example.net", "replay_ctrl_play", "null")
                .andExpect(jsonPath("$.accepted").value(false))
                .andExpect(jsonPath("$.state").value("IDLE"))
                .andExpect(jsonPath("$.outbound").isEmpty());
    }

    @Test
    void unknownTrackingSessionIsNotFound() throws Exception {
        mockMvc.perform(get("/replay/999999").header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TRACKING_SESSION_NOT_FOUND"));
    }

    private ResultActions chunk(int index) throws Exception {
        return mockMvc.perform(get("/replay/" + trackingSessionId + "/chunks/" + index)
                        .header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk());
    }

    private ResultActions message(String state, String origin, String msgtype, String data) throws Exception {
        return mockMvc.perform(post("/replay/" + trackingSessionId + "/messages")
                        .header("Authorization", "Bearer " + adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"state": "%s", "origin": "%s", "msgtype": "%s", "data": %s}
                                """.formatted(state, origin, msgtype, data)))
                .andExpect(status().isOk());
    }
}
