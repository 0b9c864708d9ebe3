package decentralabs.settlement.service.settlement;

import java.math.BigInteger;

/**
 * Signed transfer that has not been broadcast yet. The hash is final at signing time.
 */
public record PreparedTransfer(String txHash, String signedTransaction, BigInteger nonce) {
}
