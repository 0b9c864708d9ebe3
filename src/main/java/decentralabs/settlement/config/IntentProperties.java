package decentralabs.settlement.config;

import java.time.Duration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "intent")
public class IntentProperties {

    /** Time a PENDING intent waits for its source proof before it expires. */
    private Duration ttl = Duration.ofMinutes(10);

    /** Ledger the payer settles on. */
    private String payerChain = "solana";

    /** Ledger the settlement wallet pays out on. */
    private String targetChain = "base";

    /** Intent store implementation: {@code jdbc} or {@code memory}. */
    private String store = "jdbc";

    private Dispatch dispatch = new Dispatch();

    private Reconciliation reconciliation = new Reconciliation();

    @Data
    public static class Dispatch {
        private int corePoolSize = 2;
        private int maxPoolSize = 8;
        private int queueCapacity = 100;
    }

    @Data
    public static class Reconciliation {
        private boolean enabled = true;

        /** Re-dispatch SOURCE_SETTLED intents whose target leg never ran. */
        private boolean redispatchEnabled = true;

        private Duration redispatchAfter = Duration.ofSeconds(60);

        /** Age after which a TARGET_SETTLING intent is considered stuck. Must exceed the confirmation timeout. */
        private Duration settlingStaleAfter = Duration.ofMinutes(10);

        private int batchSize = 100;
    }
}
