package decentralabs.settlement.controller.health;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.methods.response.Web3ClientVersion;

import decentralabs.settlement.config.IntentProperties;
import decentralabs.settlement.config.TargetChainProperties;
import decentralabs.settlement.service.settlement.TargetChainRpcProvider;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private TargetChainRpcProvider rpcProvider;

    @Mock
    private Web3j web3j;

    @Mock
    private ObjectProvider<JdbcTemplate> jdbcTemplateProvider;

    @Mock
    private JdbcTemplate jdbcTemplate;

    private TargetChainProperties targetChainProperties;
    private IntentProperties intentProperties;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        targetChainProperties = new TargetChainProperties();
        targetChainProperties.setSettlementPrivateKey("0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318");
        intentProperties = new IntentProperties();
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        HealthController controller = new HealthController(
            rpcProvider, targetChainProperties, intentProperties, jdbcTemplateProvider, clock);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @SuppressWarnings("unchecked")
    private void rpcAnswers(String version) throws IOException {
        Web3ClientVersion response = new Web3ClientVersion();
        response.setResult(version);
        Request<?, Web3ClientVersion> request = mock(Request.class);
        when(request.send()).thenReturn(response);
        doReturn(request).when(web3j).web3ClientVersion();
        when(rpcProvider.web3j()).thenReturn(web3j);
    }

    private void databaseAnswers() {
        when(jdbcTemplateProvider.getIfAvailable()).thenReturn(jdbcTemplate);
        when(jdbcTemplate.queryForObject(eq("SELECT 1"), eq(Integer.class))).thenReturn(1);
    }

    @Test
    @DisplayName("Should report UP when RPC, key and database are available")
    void shouldReportUp() throws Exception {
        rpcAnswers("Geth/v1.13.0");
        databaseAnswers();

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.service").value("cross-chain-settlement"))
            .andExpect(jsonPath("$.timestamp").value("2026-03-01T12:00:00Z"))
            .andExpect(jsonPath("$.target_network").value("base-sepolia"))
            .andExpect(jsonPath("$.rpc_client_version").value("Geth/v1.13.0"))
            .andExpect(jsonPath("$.settlement_key_present").value(true))
            .andExpect(jsonPath("$.database_up").value(true));
    }

    @Test
    @DisplayName("Should degrade when the RPC is unreachable")
    void shouldDegradeWhenRpcDown() throws Exception {
        when(rpcProvider.web3j()).thenThrow(new IllegalStateException("All 1 target chain RPC endpoints failed"));
        databaseAnswers();

        mockMvc.perform(get("/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("DEGRADED"))
            .andExpect(jsonPath("$.rpc_up").value(false))
            .andExpect(jsonPath("$.rpc_client_version").value("unavailable"));
    }

    @Test
    @DisplayName("Should degrade without a settlement key")
    void shouldDegradeWithoutKey() throws Exception {
        targetChainProperties.setSettlementPrivateKey("");
        rpcAnswers("Geth/v1.13.0");
        databaseAnswers();

        mockMvc.perform(get("/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.settlement_key_present").value(false));
    }

    @Test
    @DisplayName("Should degrade when the database query fails")
    void shouldDegradeWhenDatabaseDown() throws Exception {
        rpcAnswers("Geth/v1.13.0");
        when(jdbcTemplateProvider.getIfAvailable()).thenReturn(jdbcTemplate);
        when(jdbcTemplate.queryForObject(eq("SELECT 1"), eq(Integer.class)))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        mockMvc.perform(get("/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.database_up").value(false));
    }

    @Test
    @DisplayName("Should skip the database check for the in-memory store")
    void shouldSkipDatabaseForMemoryStore() throws Exception {
        intentProperties.setStore("memory");
        rpcAnswers("Geth/v1.13.0");

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.intent_store").value("memory"))
            .andExpect(jsonPath("$.database_up").value(true));
    }
}
