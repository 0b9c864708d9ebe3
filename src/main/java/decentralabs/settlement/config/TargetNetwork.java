package decentralabs.settlement.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * EVM networks the settlement wallet can pay out on, with their USDC deployment.
 */
public enum TargetNetwork {
    BASE(
        "base",
        8453L,
        "0x833589fcd6edb6e08f4c7c32d4f71b54bda02913",
        "https://mainnet.base.org",
        "https://basescan.org"
    ),
    BASE_SEPOLIA(
        "base-sepolia",
        84532L,
        "0x036CbD53842c5426634e7929541eC2318f3dCF7e",
        "https://sepolia.base.org",
        "https://sepolia.basescan.org"
    );

    private final String id;
    private final long chainId;
    private final String usdcAddress;
    private final String defaultRpcUrl;
    private final String explorerUrl;

    TargetNetwork(String id, long chainId, String usdcAddress, String defaultRpcUrl, String explorerUrl) {
        this.id = id;
        this.chainId = chainId;
        this.usdcAddress = usdcAddress;
        this.defaultRpcUrl = defaultRpcUrl;
        this.explorerUrl = explorerUrl;
    }

    public String getId() {
        return id;
    }

    public long getChainId() {
        return chainId;
    }

    public String getUsdcAddress() {
        return usdcAddress;
    }

    public String getDefaultRpcUrl() {
        return defaultRpcUrl;
    }

    public String transactionUrl(String txHash) {
        return explorerUrl + "/tx/" + txHash;
    }

    public static Optional<TargetNetwork> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(network -> network.id.equals(normalized))
            .findFirst();
    }
}
