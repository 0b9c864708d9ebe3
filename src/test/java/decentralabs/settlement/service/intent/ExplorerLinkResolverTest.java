package decentralabs.settlement.service.intent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import decentralabs.settlement.config.SourceChainProperties;
import decentralabs.settlement.config.TargetChainProperties;

class ExplorerLinkResolverTest {

    @Test
    void defaultsToDevnetAndBaseSepolia() {
        ExplorerLinkResolver resolver = new ExplorerLinkResolver(new SourceChainProperties(), new TargetChainProperties());

        assertThat(resolver.sourceTransactionUrl("sig123")).isEqualTo("https://solscan.io/tx/sig123?cluster=devnet");
        assertThat(resolver.targetTransactionUrl("0xabc")).isEqualTo("https://sepolia.basescan.org/tx/0xabc");
    }

    @Test
    void mainnetLinksHaveNoClusterQuery() {
        SourceChainProperties source = new SourceChainProperties();
        source.setNetwork("solana-mainnet-beta");
        TargetChainProperties target = new TargetChainProperties();
        target.setNetwork("base");

        ExplorerLinkResolver resolver = new ExplorerLinkResolver(source, target);

        assertThat(resolver.sourceTransactionUrl("sig123")).isEqualTo("https://solscan.io/tx/sig123");
        assertThat(resolver.targetTransactionUrl("0xabc")).isEqualTo("https://basescan.org/tx/0xabc");
    }

    @Test
    void missingReferencesHaveNoLink() {
        ExplorerLinkResolver resolver = new ExplorerLinkResolver(new SourceChainProperties(), new TargetChainProperties());

        assertThat(resolver.sourceTransactionUrl(null)).isNull();
        assertThat(resolver.targetTransactionUrl(null)).isNull();
    }

    @Test
    void unknownNetworkFailsAtStartup() {
        TargetChainProperties target = new TargetChainProperties();
        target.setNetwork("polygon");

        assertThatThrownBy(() -> new ExplorerLinkResolver(new SourceChainProperties(), target))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("polygon");
    }
}
