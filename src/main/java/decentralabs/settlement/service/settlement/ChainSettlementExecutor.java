package decentralabs.settlement.service.settlement;

import java.math.BigDecimal;

import decentralabs.settlement.exception.SettlementFailedException;

/**
 * Pays an amount out of the settlement wallet on the target chain.
 */
public interface ChainSettlementExecutor {

    /**
     * Checks the wallet balance, submits one token transfer and waits for its receipt.
     * No retries.
     *
     * @throws SettlementFailedException with the failure reason; carries the tx hash when a
     *         transaction was signed and handed to the listener
     */
    SettlementResult execute(String intentId, BigDecimal amount, String recipient, SubmissionListener listener);

    /**
     * Single receipt lookup for a transfer submitted earlier.
     */
    TransferStatus checkTransfer(String txRef);
}
