package com.phillippitts.huevoice.integration;

import com.phillippitts.huevoice.config.IntegrationTestConfiguration;
import com.phillippitts.huevoice.service.pipeline.CaptureMode;
import com.phillippitts.huevoice.service.supervisor.PipelineSupervisor;
import com.phillippitts.huevoice.service.supervisor.SupervisorState;
import com.phillippitts.huevoice.testutil.FakeLight;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Drives a text command through the running pipeline: HTTP submit, command channel, dispatcher
 * stage, light cache and finally the (fake) bridge.
 */
@Tag("integration")
@ActiveProfiles("test")
@AutoConfigureMockMvc
@Import(IntegrationTestConfiguration.class)
@SpringBootTest(properties = {
        "pipeline.auto-start=false",
        "audio.capture.ambient-calibration=60ms"
})
@DirtiesContext
class TextCommandEndToEndIntegrationTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private PipelineSupervisor supervisor;

    @Autowired
    @Qualifier("deskLight")
    private FakeLight desk;

    @Autowired
    @Qualifier("hallLight")
    private FakeLight hall;

    @AfterEach
    void tearDown() {
        supervisor.stop();
    }

    @Test
    void shouldSwitchLightsFromSubmittedText() throws Exception {
        supervisor.start(CaptureMode.CONTINUOUS);
        assertThat(supervisor.state()).isEqualTo(SupervisorState.RUNNING);

        mvc.perform(post("/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"turn on the lights\"}"))
                .andExpect(status().isAccepted());

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            assertThat(desk.isOn()).isTrue();
            assertThat(hall.isOn()).isTrue();
        });

        mvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.supervisor").value("RUNNING"))
                .andExpect(jsonPath("$.mode").value("CONTINUOUS"))
                .andExpect(jsonPath("$.undoDepth").value(1));
    }
}
