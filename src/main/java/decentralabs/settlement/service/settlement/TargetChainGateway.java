package decentralabs.settlement.service.settlement;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Optional;

import org.web3j.crypto.Credentials;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import decentralabs.settlement.exception.SettlementFailedException;

/**
 * JSON-RPC calls the settlement executor needs on the target chain. IOExceptions signal a
 * transport problem whose effect on the chain is unknown.
 */
public interface TargetChainGateway {

    /**
     * {@code balanceOf(owner)} on the configured token contract, in base units.
     */
    BigInteger tokenBalance(String owner) throws IOException;

    /**
     * Signs {@code transfer(recipient, units)} with the pending-pool nonce of the sender.
     */
    PreparedTransfer prepareTransfer(Credentials credentials, String recipient, BigInteger units) throws IOException;

    /**
     * @throws SettlementFailedException with {@code SUBMISSION_REJECTED} when the node refuses it
     */
    void broadcast(PreparedTransfer transfer) throws IOException;

    Optional<TransactionReceipt> findReceipt(String txHash) throws IOException;
}
