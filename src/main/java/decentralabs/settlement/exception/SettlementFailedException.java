package decentralabs.settlement.exception;

/**
 * Target leg failure. {@code txRef} is the hash of the submitted transaction, when one was
 * submitted before the failure.
 */
public class SettlementFailedException extends RuntimeException {

    private final SettlementFailureReason reason;
    private final String txRef;

    public SettlementFailedException(SettlementFailureReason reason, String message) {
        this(reason, message, null, null);
    }

    public SettlementFailedException(SettlementFailureReason reason, String message, Throwable cause) {
        this(reason, message, null, cause);
    }

    public SettlementFailedException(SettlementFailureReason reason, String message, String txRef, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.txRef = txRef;
    }

    public SettlementFailureReason getReason() {
        return reason;
    }

    public String getTxRef() {
        return txRef;
    }

    /**
     * True when a transaction may have reached the chain and no receipt settled its fate.
     */
    public boolean isOutcomeUnknown() {
        return txRef != null && reason != SettlementFailureReason.TRANSACTION_REVERTED;
    }
}
