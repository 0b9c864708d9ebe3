package decentralabs.settlement.service.settlement;

/**
 * On-chain fate of a previously submitted transfer.
 */
public enum TransferStatus {
    CONFIRMED,
    REVERTED,
    /** No receipt yet, or the chain could not be queried. */
    UNKNOWN
}
