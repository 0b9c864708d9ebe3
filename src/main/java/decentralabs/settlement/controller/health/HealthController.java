package decentralabs.settlement.controller.health;

import decentralabs.settlement.config.IntentProperties;
import decentralabs.settlement.config.TargetChainProperties;
import decentralabs.settlement.service.settlement.TargetChainRpcProvider;
import decentralabs.settlement.util.LogSanitizer;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final TargetChainRpcProvider rpcProvider;
    private final TargetChainProperties targetChainProperties;
    private final IntentProperties intentProperties;
    private final ObjectProvider<JdbcTemplate> jdbcTemplateProvider;
    private final Clock clock;

    @GetMapping
    @CrossOrigin(origins = "*")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthStatus = new HashMap<>();
        healthStatus.put("status", "UP");
        healthStatus.put("timestamp", clock.instant().toString());
        healthStatus.put("service", "cross-chain-settlement");
        healthStatus.put("version", "1.0.0");
        healthStatus.put("target_network", targetChainProperties.getNetwork());
        healthStatus.put("intent_store", intentProperties.getStore());

        String rpcVersion = resolveRpcClientVersion();
        healthStatus.put("rpc_client_version", rpcVersion != null ? rpcVersion : "unavailable");
        healthStatus.put("rpc_up", rpcVersion != null);
        healthStatus.put("settlement_key_present", targetChainProperties.hasSettlementKey());
        healthStatus.put("database_up", isDatabaseUp());

        return buildResponse(healthStatus);
    }

    private ResponseEntity<Map<String, Object>> buildResponse(Map<String, Object> status) {
        boolean rpcUp = Boolean.TRUE.equals(status.get("rpc_up"));
        boolean keyPresent = Boolean.TRUE.equals(status.get("settlement_key_present"));
        boolean dbUp = Boolean.TRUE.equals(status.get("database_up"));

        if (!rpcUp || !keyPresent || !dbUp) {
            status.put("status", "DEGRADED");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(status);
        }
        return ResponseEntity.ok(status);
    }

    private String resolveRpcClientVersion() {
        try {
            return rpcProvider.web3j()
                .web3ClientVersion()
                .send()
                .getWeb3ClientVersion();
        } catch (Exception e) {
            log.warn("RPC connectivity check failed: {}", LogSanitizer.sanitize(e.getMessage()));
            return null;
        }
    }

    private boolean isDatabaseUp() {
        if (!"jdbc".equalsIgnoreCase(intentProperties.getStore())) {
            return true;
        }
        try {
            JdbcTemplate jdbcTemplate = jdbcTemplateProvider.getIfAvailable();
            if (jdbcTemplate == null) {
                log.warn("No JdbcTemplate available for database health check");
                return false;
            }
            Integer result = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return result != null && result == 1;
        } catch (Exception e) {
            log.warn("Database connectivity check failed: {}", LogSanitizer.sanitize(e.getMessage()));
            return false;
        }
    }
}
