package decentralabs.settlement.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(OutputCaptureExtension.class)
class RequestLoggingFilterTest {

    private MockMvc mockMvc;
    private RequestLoggingFilter filter;

    @BeforeEach
    void setUp() {
        filter = new RequestLoggingFilter();
        LocalhostOnlyFilter localhostOnlyFilter = new LocalhostOnlyFilter();
        ReflectionTestUtils.setField(localhostOnlyFilter, "allowPrivateNetworks", false);
        mockMvc = MockMvcBuilders
            .standaloneSetup(new FilterTestController())
            .addFilters(filter, localhostOnlyFilter)
            .build();
    }

    @Test
    void logsMethodPathAndStatus(CapturedOutput output) throws Exception {
        mockMvc.perform(post("/intents"))
            .andExpect(status().isOk());

        assertThat(output.getOut()).containsPattern("POST /intents -> 200 \\(\\d+ ms\\)");
    }

    @Test
    void logsRequestsRejectedByLaterFilters(CapturedOutput output) throws Exception {
        mockMvc.perform(post("/intents/abc/reconcile").with(req -> { req.setRemoteAddr("8.8.8.8"); return req; }))
            .andExpect(status().isForbidden());

        assertThat(output.getOut()).containsPattern("POST /intents/abc/reconcile -> 403 \\(\\d+ ms\\)");
    }

    @Test
    void logsDecodedPathWithoutPathParameters(CapturedOutput output) throws Exception {
        mockMvc.perform(get("/intents/abc;jsessionid=1"))
            .andExpect(status().isOk());

        assertThat(output.getOut())
            .contains("GET /intents/abc -> 200")
            .doesNotContain("jsessionid");
    }

    @Test
    void logsAndRethrowsHandlerFailures(CapturedOutput output) {
        assertThrows(Exception.class, () -> mockMvc.perform(get("/intents/abc/failing")));

        assertThat(output.getOut()).containsPattern("GET /intents/abc/failing failed after \\d+ ms");
    }

    @Test
    void disabledFilterLogsNothing(CapturedOutput output) throws Exception {
        ReflectionTestUtils.setField(filter, "enabled", false);

        mockMvc.perform(post("/intents"))
            .andExpect(status().isOk());

        assertThat(output.getOut()).doesNotContain("POST /intents -> 200");
    }
}
