package com.multila.backend.modules.registry;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.multila.backend.modules.registry.domain.ApplicationSession;
import com.multila.backend.modules.registry.domain.AuthMode;
import com.multila.backend.support.AbstractPostgresIntegrationTest;
import com.multila.backend.support.TestFixtures;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class GateIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestFixtures fixtures;

    @Test
    void visitorsAreForwardedInTurn() throws Exception {
        ApplicationSession first = fixtures.createApplicationSession("GA", AuthMode.NONE);
        ApplicationSession second = fixtures.createApplicationSession("GB", AuthMode.NONE);
        fixtures.createGate("G1", "study", first, second);

        expectRedirect("/gate/G1", TestFixtures.APP_URL + "/GA/?sess=GA");
        expectRedirect("/gate/G1/", TestFixtures.APP_URL + "/GB/?sess=GB");
        expectRedirect("/gate/G1", TestFixtures.APP_URL + "/GA/?sess=GA");
    }

    @Test
    void disabledMemberIsSkipped() throws Exception {
        ApplicationSession first = fixtures.createApplicationSession("GA", AuthMode.NONE);
        ApplicationSession second = fixtures.createApplicationSession("GB", AuthMode.NONE);
        fixtures.createGate("G1", "study", first, second);
        fixtures.disable(first);

        expectRedirect("/gate/G1", TestFixtures.APP_URL + "/GB/?sess=GB");
        expectRedirect("/gate/G1", TestFixtures.APP_URL + "/GB/?sess=GB");
    }

    @Test
    void unknownGateIsNotFound() throws Exception {
        mockMvc.perform(get("/gate/NOPE"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("GATE_NOT_FOUND"));
    }

    private void expectRedirect(String path, String location) throws Exception {
        mockMvc.perform(get(path))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", location));
    }
}
