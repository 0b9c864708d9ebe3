package decentralabs.settlement.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Solana clusters the payer settles on. Only used to build explorer links.
 */
public enum SourceNetwork {
    SOLANA_DEVNET("solana-devnet", "?cluster=devnet"),
    SOLANA_MAINNET_BETA("solana-mainnet-beta", "");

    private static final String SOLSCAN_TX_URL = "https://solscan.io/tx/";

    private final String id;
    private final String clusterQuery;

    SourceNetwork(String id, String clusterQuery) {
        this.id = id;
        this.clusterQuery = clusterQuery;
    }

    public String getId() {
        return id;
    }

    public String transactionUrl(String txHash) {
        return SOLSCAN_TX_URL + txHash + clusterQuery;
    }

    public static Optional<SourceNetwork> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(network -> network.id.equals(normalized))
            .findFirst();
    }
}
