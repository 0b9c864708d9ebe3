package decentralabs.settlement.exception;

public enum SettlementFailureReason {
    /** Settlement wallet holds less than the intent amount. Nothing was submitted. */
    INSUFFICIENT_FUNDS,
    /** Transaction submitted but no receipt within the wait window. Outcome unknown. */
    CONFIRMATION_TIMEOUT,
    /** Transaction mined with a failed status. */
    TRANSACTION_REVERTED,
    /** The node refused the signed transaction. */
    SUBMISSION_REJECTED,
    NETWORK_ERROR,
    /** Amount cannot be expressed in token base units. */
    INVALID_AMOUNT,
    /** Settlement key, network or token is not usable. */
    CONFIGURATION,
    /** Another worker took over the intent before this attempt submitted anything. */
    ATTEMPT_SUPERSEDED
}
