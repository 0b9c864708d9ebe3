package decentralabs.settlement.config;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import org.web3j.utils.Convert;

@Data
@Validated
@ConfigurationProperties(prefix = "target-chain")
public class TargetChainProperties {

    /** {@code base} or {@code base-sepolia}. */
    @NotNull
    @Pattern(regexp = "(?i)\\s*(base|base-sepolia)\\s*", message = "must be base or base-sepolia")
    private String network = "base-sepolia";

    /** Comma-separated RPC endpoints, tried in order. Empty means the network's public endpoint. */
    private String rpcUrls;

    /** Token contract override. Empty means USDC on the selected network. */
    @Pattern(regexp = "\\s*(0x[0-9a-fA-F]{40})?\\s*", message = "must be an EVM address (0x + 40 hex chars)")
    private String tokenAddress;

    @Min(0)
    @Max(36)
    private int tokenDecimals = 6;

    /** Hex private key of the settlement wallet (0x + 64 hex chars). Empty disables settlement. */
    @Pattern(regexp = "\\s*(0x[0-9a-fA-F]{64})?\\s*",
        message = "must be a hex private key (0x + 64 hex chars)")
    private String settlementPrivateKey;

    @NotNull
    @Min(21_000)
    private BigInteger gasLimit = BigInteger.valueOf(100_000);

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal gasPriceGwei = new BigDecimal("0.1");

    @NotNull
    private Duration confirmationTimeout = Duration.ofMinutes(2);

    @NotNull
    private Duration pollInterval = Duration.ofSeconds(2);

    public TargetNetwork resolveNetwork() {
        return TargetNetwork.fromId(network)
            .orElseThrow(() -> new IllegalStateException("Unsupported target network: " + network));
    }

    public String resolveTokenAddress() {
        if (tokenAddress != null && !tokenAddress.isBlank()) {
            return tokenAddress.trim();
        }
        return resolveNetwork().getUsdcAddress();
    }

    public List<String> resolveRpcUrls() {
        if (rpcUrls == null || rpcUrls.isBlank()) {
            return List.of(resolveNetwork().getDefaultRpcUrl());
        }
        return Arrays.stream(rpcUrls.split(","))
            .map(String::trim)
            .filter(url -> !url.isEmpty())
            .toList();
    }

    public boolean hasSettlementKey() {
        return settlementPrivateKey != null && !settlementPrivateKey.isBlank();
    }

    public BigInteger gasPriceWei() {
        return Convert.toWei(gasPriceGwei, Convert.Unit.GWEI).toBigInteger();
    }
}
