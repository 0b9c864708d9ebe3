package decentralabs.settlement.service.intent;

import org.springframework.stereotype.Component;

import decentralabs.settlement.config.SourceChainProperties;
import decentralabs.settlement.config.SourceNetwork;
import decentralabs.settlement.config.TargetChainProperties;
import decentralabs.settlement.config.TargetNetwork;

/**
 * Block explorer URLs for both legs on the configured networks.
 */
@Component
public class ExplorerLinkResolver {

    private final SourceNetwork sourceNetwork;
    private final TargetNetwork targetNetwork;

    public ExplorerLinkResolver(SourceChainProperties sourceChainProperties, TargetChainProperties targetChainProperties) {
        this.sourceNetwork = sourceChainProperties.resolveNetwork();
        this.targetNetwork = targetChainProperties.resolveNetwork();
    }

    public String sourceTransactionUrl(String txRef) {
        return txRef == null ? null : sourceNetwork.transactionUrl(txRef);
    }

    public String targetTransactionUrl(String txRef) {
        return txRef == null ? null : targetNetwork.transactionUrl(txRef);
    }
}
