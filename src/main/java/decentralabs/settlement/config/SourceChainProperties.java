package decentralabs.settlement.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "source-chain")
public class SourceChainProperties {

    /** {@code solana-devnet} or {@code solana-mainnet-beta}. */
    @NotNull
    @Pattern(regexp = "(?i)\\s*(solana-devnet|solana-mainnet-beta)\\s*",
        message = "must be solana-devnet or solana-mainnet-beta")
    private String network = "solana-devnet";

    public SourceNetwork resolveNetwork() {
        return SourceNetwork.fromId(network)
            .orElseThrow(() -> new IllegalStateException("Unsupported source network: " + network));
    }
}
