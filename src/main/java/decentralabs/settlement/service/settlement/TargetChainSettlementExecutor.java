package decentralabs.settlement.service.settlement;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import decentralabs.settlement.config.IntentProperties;
import decentralabs.settlement.config.TargetChainProperties;
import decentralabs.settlement.exception.SettlementFailedException;
import decentralabs.settlement.exception.SettlementFailureReason;
import decentralabs.settlement.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class TargetChainSettlementExecutor implements ChainSettlementExecutor {

    private static final Pattern PRIVATE_KEY = Pattern.compile("^(0x)?[0-9a-fA-F]{64}$");

    private final TargetChainGateway gateway;
    private final TargetChainProperties targetChainProperties;
    private final String targetChain;
    // balance check, nonce read and broadcast of one wallet must not interleave
    private final ReentrantLock walletLock = new ReentrantLock(true);

    public TargetChainSettlementExecutor(
        TargetChainGateway gateway,
        TargetChainProperties targetChainProperties,
        IntentProperties intentProperties
    ) {
        this.gateway = gateway;
        this.targetChainProperties = targetChainProperties;
        this.targetChain = intentProperties.getTargetChain();
    }

    @Override
    public SettlementResult execute(String intentId, BigDecimal amount, String recipient, SubmissionListener listener) {
        Credentials credentials = resolveCredentials();
        BigInteger units = toBaseUnits(amount);
        String safeIntentId = LogSanitizer.sanitize(intentId);

        PreparedTransfer transfer;
        walletLock.lock();
        try {
            BigInteger balance = queryBalance(credentials.getAddress());
            if (balance.compareTo(units) < 0) {
                log.warn("Settlement wallet balance {} below {} for intent {}", balance, units, safeIntentId);
                throw new SettlementFailedException(
                    SettlementFailureReason.INSUFFICIENT_FUNDS,
                    "Settlement wallet balance is below the intent amount"
                );
            }
            transfer = prepare(credentials, recipient, units);
            listener.beforeBroadcast(transfer.txHash());
            broadcast(transfer);
        } finally {
            walletLock.unlock();
        }

        log.info("Submitted target transfer {} for intent {} to {}",
            transfer.txHash(), safeIntentId, LogSanitizer.maskIdentifier(recipient));
        TransactionReceipt receipt = awaitReceipt(transfer.txHash());
        if (!receipt.isStatusOK()) {
            throw new SettlementFailedException(
                SettlementFailureReason.TRANSACTION_REVERTED,
                "Target transfer reverted with status " + receipt.getStatus(),
                transfer.txHash(),
                null
            );
        }
        log.info("Target transfer {} confirmed in block {} for intent {}",
            transfer.txHash(), receipt.getBlockNumberRaw(), safeIntentId);
        return SettlementResult.of(targetChain, transfer.txHash());
    }

    @Override
    public TransferStatus checkTransfer(String txRef) {
        try {
            Optional<TransactionReceipt> receipt = gateway.findReceipt(txRef);
            if (receipt.isEmpty()) {
                return TransferStatus.UNKNOWN;
            }
            return receipt.get().isStatusOK() ? TransferStatus.CONFIRMED : TransferStatus.REVERTED;
        } catch (IOException e) {
            log.warn("Receipt lookup for {} failed: {}", LogSanitizer.sanitize(txRef), LogSanitizer.sanitize(e.getMessage()));
            return TransferStatus.UNKNOWN;
        }
    }

    BigInteger toBaseUnits(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new SettlementFailedException(SettlementFailureReason.INVALID_AMOUNT, "Amount must be positive");
        }
        try {
            return amount.movePointRight(targetChainProperties.getTokenDecimals()).toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new SettlementFailedException(
                SettlementFailureReason.INVALID_AMOUNT,
                "Amount " + amount.toPlainString() + " exceeds " + targetChainProperties.getTokenDecimals() + " decimals",
                e
            );
        }
    }

    private Credentials resolveCredentials() {
        String key = targetChainProperties.getSettlementPrivateKey();
        if (key == null || !PRIVATE_KEY.matcher(key.trim()).matches()) {
            throw new SettlementFailedException(
                SettlementFailureReason.CONFIGURATION,
                "Settlement private key is missing or malformed"
            );
        }
        return Credentials.create(key.trim());
    }

    private BigInteger queryBalance(String address) {
        try {
            return gateway.tokenBalance(address);
        } catch (IOException e) {
            throw new SettlementFailedException(
                SettlementFailureReason.NETWORK_ERROR, "Balance query failed: " + e.getMessage(), e);
        }
    }

    private PreparedTransfer prepare(Credentials credentials, String recipient, BigInteger units) {
        try {
            return gateway.prepareTransfer(credentials, recipient, units);
        } catch (IOException e) {
            throw new SettlementFailedException(
                SettlementFailureReason.NETWORK_ERROR, "Transfer preparation failed: " + e.getMessage(), e);
        }
    }

    private void broadcast(PreparedTransfer transfer) {
        try {
            gateway.broadcast(transfer);
        } catch (IOException e) {
            // the node may have accepted it before the connection dropped
            throw new SettlementFailedException(
                SettlementFailureReason.NETWORK_ERROR,
                "Broadcast of " + transfer.txHash() + " interrupted: " + e.getMessage(),
                transfer.txHash(),
                e
            );
        }
    }

    private TransactionReceipt awaitReceipt(String txHash) {
        Duration timeout = targetChainProperties.getConfirmationTimeout();
        long pollMillis = Math.max(1L, targetChainProperties.getPollInterval().toMillis());
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            try {
                Optional<TransactionReceipt> receipt = gateway.findReceipt(txHash);
                if (receipt.isPresent()) {
                    return receipt.get();
                }
            } catch (IOException e) {
                log.debug("Receipt poll for {} failed: {}", txHash, LogSanitizer.sanitize(e.getMessage()));
            }
            if (System.nanoTime() - deadline >= 0) {
                break;
            }
            try {
                Thread.sleep(pollMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.warn("No receipt for {} within {}", txHash, timeout);
        throw new SettlementFailedException(
            SettlementFailureReason.CONFIRMATION_TIMEOUT,
            "Transfer " + txHash + " not confirmed within " + timeout.toSeconds() + "s",
            txHash,
            null
        );
    }
}
