package decentralabs.settlement.service.settlement;

/**
 * Confirmed target transfer.
 *
 * @param txRef target transaction hash
 * @param proof settlement proof recorded on the intent, {@code <chain>_settlement_<txHash>}
 */
public record SettlementResult(String txRef, String proof) {

    public static SettlementResult of(String targetChain, String txHash) {
        return new SettlementResult(txHash, targetChain + "_settlement_" + txHash);
    }
}
