package decentralabs.settlement.service.intent;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import decentralabs.settlement.config.IntentProperties;
import decentralabs.settlement.config.SettlementConfig;
import decentralabs.settlement.config.TargetChainProperties;
import decentralabs.settlement.dto.intent.IntentStatus;
import decentralabs.settlement.dto.intent.ReceiptResponse;
import decentralabs.settlement.exception.IntentNotFoundException;
import decentralabs.settlement.exception.InvalidInputException;
import decentralabs.settlement.exception.InvalidIntentStateException;
import decentralabs.settlement.exception.InvalidProofException;
import decentralabs.settlement.exception.SettlementFailedException;
import decentralabs.settlement.exception.SettlementFailureReason;
import decentralabs.settlement.exception.VerifierUnavailableException;
import decentralabs.settlement.service.persistence.ConditionalUpdateResult;
import decentralabs.settlement.service.persistence.IntentRepository;
import decentralabs.settlement.service.settlement.ChainSettlementExecutor;
import decentralabs.settlement.service.settlement.SettlementResult;
import decentralabs.settlement.service.settlement.TransferStatus;
import decentralabs.settlement.service.verification.ProofVerification;
import decentralabs.settlement.service.verification.ProofVerificationClient;
import decentralabs.settlement.util.LogSanitizer;
import decentralabs.settlement.util.RecipientAddressValidator;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives payment intents through their lifecycle. Every transition is a status
 * compare-and-swap on the repository, so concurrent callers race on the store and exactly one
 * of them performs the side effect that follows.
 */
@Service
@Slf4j
public class PaymentIntentService {

    static final String FORCED_ROLLBACK = "FORCED_ROLLBACK";
    private static final int MAX_INTEGER_DIGITS = 20;

    private final IntentRepository repository;
    private final ProofVerificationClient verificationClient;
    private final ChainSettlementExecutor settlementExecutor;
    private final TaskExecutor dispatchExecutor;
    private final Clock clock;
    private final IntentProperties intentProperties;
    private final TargetChainProperties targetChainProperties;
    private final ExplorerLinkResolver explorerLinks;
    private final IntentWebhookService webhookService;

    public PaymentIntentService(
        IntentRepository repository,
        ProofVerificationClient verificationClient,
        ChainSettlementExecutor settlementExecutor,
        @Qualifier(SettlementConfig.DISPATCH_EXECUTOR) TaskExecutor dispatchExecutor,
        Clock clock,
        IntentProperties intentProperties,
        TargetChainProperties targetChainProperties,
        ExplorerLinkResolver explorerLinks,
        IntentWebhookService webhookService
    ) {
        this.repository = repository;
        this.verificationClient = verificationClient;
        this.settlementExecutor = settlementExecutor;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
        this.intentProperties = intentProperties;
        this.targetChainProperties = targetChainProperties;
        this.explorerLinks = explorerLinks;
        this.webhookService = webhookService;
    }

    public PaymentIntent createIntent(BigDecimal amount, String merchantRecipient) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidInputException("amount must be greater than zero");
        }
        BigDecimal normalized = amount.stripTrailingZeros();
        int decimals = targetChainProperties.getTokenDecimals();
        if (normalized.scale() > decimals) {
            throw new InvalidInputException("amount supports at most " + decimals + " decimal places");
        }
        if (normalized.precision() - normalized.scale() > MAX_INTEGER_DIGITS) {
            throw new InvalidInputException("amount is too large");
        }
        String recipient = merchantRecipient == null ? null : merchantRecipient.trim();
        if (!RecipientAddressValidator.isValid(recipient)) {
            throw new InvalidInputException("merchant_recipient must be an EVM address (0x + 40 hex characters)");
        }

        Instant now = clock.instant();
        PaymentIntent intent = new PaymentIntent(
            UUID.randomUUID().toString(),
            normalized,
            RecipientAddressValidator.toChecksumAddress(recipient),
            intentProperties.getPayerChain(),
            intentProperties.getTargetChain(),
            now,
            now.plus(intentProperties.getTtl())
        );
        repository.create(intent);
        log.info("Created intent {} for {} to {}", intent.getIntentId(), normalized.toPlainString(),
            LogSanitizer.maskIdentifier(intent.getMerchantRecipient()));
        return intent;
    }

    /**
     * Returns the intent, expiring it first when it is PENDING past its deadline.
     */
    public PaymentIntent getIntent(String intentId) {
        PaymentIntent intent = repository.findById(intentId)
            .orElseThrow(() -> new IntentNotFoundException(intentId));
        return expireIfDue(intent);
    }

    public PaymentIntent submitSourceProof(String intentId, String proof, String txRef, String payerWallet) {
        PaymentIntent intent = getIntent(intentId);
        if (isBlank(proof)) {
            throw new InvalidInputException("settle_proof is required");
        }
        if (isBlank(txRef)) {
            throw new InvalidInputException("tx_hash is required");
        }
        requireStatus(intent, IntentStatus.PENDING);

        ProofVerification verification = verificationClient.verify(proof);
        switch (verification.outcome()) {
            case INVALID -> {
                log.warn("Source proof rejected for intent {}: {}", LogSanitizer.sanitize(intentId),
                    LogSanitizer.sanitize(verification.reason()));
                throw new InvalidProofException("Source settlement proof rejected: " + verification.reason());
            }
            case UNAVAILABLE -> throw new VerifierUnavailableException(
                "Proof verification unavailable: " + verification.reason());
            case VALID -> log.debug("Source proof verified for intent {}", LogSanitizer.sanitize(intentId));
        }

        Instant now = clock.instant();
        String wallet = isBlank(payerWallet) ? null : payerWallet.trim();
        AtomicBoolean expired = new AtomicBoolean();
        ConditionalUpdateResult result = repository.conditionalUpdate(intentId, IntentStatus.PENDING, current -> {
            if (current.isExpiredAt(now)) {
                expired.set(true);
                current.transitionTo(IntentStatus.EXPIRED, now);
                return;
            }
            current.recordSourceLeg(proof, txRef.trim(), wallet, now);
            current.transitionTo(IntentStatus.SOURCE_SETTLED, now);
        });

        PaymentIntent stored = requireApplied(intentId, result, IntentStatus.PENDING);
        if (expired.get()) {
            log.info("Intent {} expired while its source proof was verified", stored.getIntentId());
            webhookService.notify(IntentWebhookService.EVENT_EXPIRED, stored);
            throw new InvalidIntentStateException(intentId, IntentStatus.EXPIRED, "Intent expired before the source proof was recorded");
        }

        log.info("Intent {} source leg settled (tx {})", stored.getIntentId(), LogSanitizer.sanitize(stored.getSourceTxRef()));
        webhookService.notify(IntentWebhookService.EVENT_SOURCE_SETTLED, stored);
        scheduleTargetSettlement(stored.getIntentId());
        return stored;
    }

    /**
     * Runs the target leg for a SOURCE_SETTLED intent. Only the caller that wins the
     * SOURCE_SETTLED to TARGET_SETTLING swap reaches the executor.
     */
    public PaymentIntent triggerTargetPayment(String intentId) {
        Instant claimedAt = clock.instant();
        ConditionalUpdateResult claim = repository.conditionalUpdate(intentId, IntentStatus.SOURCE_SETTLED, current -> {
            current.transitionTo(IntentStatus.TARGET_SETTLING, claimedAt);
            current.beginSettlementAttempt();
            current.setPendingTargetTxRef(null);
        });
        PaymentIntent claimed = requireApplied(intentId, claim, IntentStatus.SOURCE_SETTLED);
        int attempt = claimed.getSettlementAttempts();
        log.info("Intent {} claimed for target settlement (attempt {})", intentId, attempt);

        SettlementResult settlement;
        try {
            settlement = settlementExecutor.execute(
                intentId,
                claimed.getAmount(),
                claimed.getMerchantRecipient(),
                txHash -> recordPendingTransfer(intentId, attempt, txHash)
            );
        } catch (SettlementFailedException e) {
            throw handleSettlementFailure(intentId, e);
        } catch (RuntimeException e) {
            String pending = repository.findById(intentId).map(PaymentIntent::getPendingTargetTxRef).orElse(null);
            throw handleSettlementFailure(intentId, new SettlementFailedException(
                SettlementFailureReason.NETWORK_ERROR, "Unexpected settlement error: " + e.getMessage(), pending, e));
        }
        return completeSettlement(intentId, settlement);
    }

    public ReceiptResponse getReceipt(String intentId) {
        PaymentIntent intent = repository.findById(intentId)
            .orElseThrow(() -> new IntentNotFoundException(intentId));

        ReceiptResponse.Leg sourceLeg = intent.getSourceTxRef() == null ? null : ReceiptResponse.Leg.builder()
            .chain(intent.getPayerChain())
            .txRef(intent.getSourceTxRef())
            .proof(intent.getSourceProof())
            .wallet(intent.getPayerWallet())
            .settledAt(format(intent.getSourceSettledAt()))
            .explorerUrl(explorerLinks.sourceTransactionUrl(intent.getSourceTxRef()))
            .build();
        ReceiptResponse.Leg targetLeg = intent.getTargetTxRef() == null ? null : ReceiptResponse.Leg.builder()
            .chain(intent.getTargetChain())
            .txRef(intent.getTargetTxRef())
            .proof(intent.getTargetProof())
            .wallet(intent.getMerchantRecipient())
            .settledAt(format(intent.getTargetSettledAt()))
            .explorerUrl(explorerLinks.targetTransactionUrl(intent.getTargetTxRef()))
            .build();

        return ReceiptResponse.builder()
            .intentId(intent.getIntentId())
            .status(intent.getStatus())
            .amount(intent.getAmount().toPlainString())
            .merchantRecipient(intent.getMerchantRecipient())
            .sourceLeg(sourceLeg)
            .targetLeg(targetLeg)
            .completedAt(format(intent.getCompletedAt()))
            .build();
    }

    /**
     * Re-derives the next step for one intent: expires an overdue PENDING intent, re-dispatches
     * a SOURCE_SETTLED one and settles a TARGET_SETTLING one from its recorded transfer.
     * {@code forceRollback} returns a TARGET_SETTLING intent whose transfer is not confirmed to
     * SOURCE_SETTLED.
     */
    public PaymentIntent reconcile(String intentId, boolean forceRollback) {
        PaymentIntent intent = repository.findById(intentId)
            .orElseThrow(() -> new IntentNotFoundException(intentId));
        return switch (intent.getStatus()) {
            case PENDING -> expireIfDue(intent);
            case SOURCE_SETTLED -> {
                scheduleTargetSettlement(intentId);
                yield intent;
            }
            case TARGET_SETTLING -> resolveSettling(intent, forceRollback);
            case COMPLETED, EXPIRED -> intent;
        };
    }

    void scheduleTargetSettlement(String intentId) {
        try {
            dispatchExecutor.execute(() -> runTargetSettlement(intentId));
        } catch (TaskRejectedException e) {
            log.warn("Target settlement dispatch for intent {} rejected ({}); left for reconciliation",
                intentId, LogSanitizer.sanitize(e.getMessage()));
        }
    }

    private void runTargetSettlement(String intentId) {
        try {
            PaymentIntent completed = triggerTargetPayment(intentId);
            log.debug("Background settlement of intent {} finished as {}", intentId, completed.getStatus());
        } catch (InvalidIntentStateException e) {
            log.info("Background settlement of intent {} skipped: {}", intentId, e.getMessage());
        } catch (SettlementFailedException e) {
            log.warn("Background settlement of intent {} failed [{}]: {}", intentId, e.getReason(),
                LogSanitizer.sanitize(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Background settlement of intent {} failed unexpectedly", intentId, e);
        }
    }

    private PaymentIntent expireIfDue(PaymentIntent intent) {
        Instant now = clock.instant();
        if (intent.getStatus() != IntentStatus.PENDING || !intent.isExpiredAt(now)) {
            return intent;
        }
        ConditionalUpdateResult result = repository.conditionalUpdate(intent.getIntentId(), IntentStatus.PENDING,
            current -> current.transitionTo(IntentStatus.EXPIRED, now));
        return switch (result.outcome()) {
            case UPDATED -> {
                log.info("Intent {} expired at {}", intent.getIntentId(), intent.getExpiresAt());
                webhookService.notify(IntentWebhookService.EVENT_EXPIRED, result.intent());
                yield result.intent();
            }
            case CONFLICT -> result.intent();
            case NOT_FOUND -> throw new IntentNotFoundException(intent.getIntentId());
        };
    }

    private void recordPendingTransfer(String intentId, int attempt, String txHash) {
        Instant now = clock.instant();
        ConditionalUpdateResult result = repository.conditionalUpdate(intentId, IntentStatus.TARGET_SETTLING, current -> {
            if (current.getSettlementAttempts() != attempt) {
                throw superseded(intentId);
            }
            current.setPendingTargetTxRef(txHash);
            current.touch(now);
        });
        if (!result.isUpdated()) {
            throw superseded(intentId);
        }
        log.debug("Intent {} recorded pending transfer {}", intentId, txHash);
    }

    private SettlementFailedException handleSettlementFailure(String intentId, SettlementFailedException failure) {
        if (failure.getReason() == SettlementFailureReason.ATTEMPT_SUPERSEDED) {
            log.warn("Target settlement of intent {} abandoned: {}", intentId, failure.getMessage());
            return failure;
        }
        Instant now = clock.instant();
        if (failure.isOutcomeUnknown()) {
            ConditionalUpdateResult result = repository.conditionalUpdate(intentId, IntentStatus.TARGET_SETTLING, current -> {
                current.setPendingTargetTxRef(failure.getTxRef());
                current.setLastError(failure.getReason().name());
                current.touch(now);
            });
            if (!result.isUpdated()) {
                log.error("Intent {} left TARGET_SETTLING while transfer {} was unconfirmed", intentId, failure.getTxRef());
            }
            log.warn("Target transfer {} for intent {} has no final outcome [{}]; left for reconciliation",
                failure.getTxRef(), intentId, failure.getReason());
            return failure;
        }

        ConditionalUpdateResult result = repository.conditionalUpdate(intentId, IntentStatus.TARGET_SETTLING,
            current -> rollback(current, failure.getReason().name(), now));
        if (result.isUpdated()) {
            log.warn("Intent {} rolled back to SOURCE_SETTLED after [{}]: {}", intentId, failure.getReason(),
                LogSanitizer.sanitize(failure.getMessage()));
            webhookService.notify(IntentWebhookService.EVENT_ROLLED_BACK, result.intent());
        } else {
            log.error("Intent {} could not be rolled back after [{}]; stored outcome {}", intentId,
                failure.getReason(), result.outcome());
        }
        return failure;
    }

    private PaymentIntent completeSettlement(String intentId, SettlementResult settlement) {
        Instant now = clock.instant();
        ConditionalUpdateResult result = repository.conditionalUpdate(intentId, IntentStatus.TARGET_SETTLING, current -> {
            current.recordTargetLeg(settlement.txRef(), settlement.proof(), now);
            current.transitionTo(IntentStatus.COMPLETED, now);
        });
        if (!result.isUpdated()) {
            IntentStatus status = result.intent() != null ? result.intent().getStatus() : null;
            log.error("Target transfer {} confirmed but intent {} is {}; manual review required",
                settlement.txRef(), intentId, status);
            throw new InvalidIntentStateException(intentId, status,
                "Target transfer " + settlement.txRef() + " confirmed but the intent is no longer TARGET_SETTLING");
        }
        log.info("Intent {} completed with target transfer {}", intentId, settlement.txRef());
        webhookService.notify(IntentWebhookService.EVENT_COMPLETED, result.intent());
        return result.intent();
    }

    private PaymentIntent resolveSettling(PaymentIntent intent, boolean forceRollback) {
        String intentId = intent.getIntentId();
        String pending = intent.getPendingTargetTxRef();
        if (pending != null) {
            TransferStatus status = settlementExecutor.checkTransfer(pending);
            return switch (status) {
                case CONFIRMED -> {
                    log.info("Reconciled intent {}: transfer {} is confirmed", intentId, pending);
                    yield completeSettlement(intentId, SettlementResult.of(intent.getTargetChain(), pending));
                }
                case REVERTED -> {
                    log.warn("Reconciled intent {}: transfer {} reverted", intentId, pending);
                    yield rollbackSettling(intent, SettlementFailureReason.TRANSACTION_REVERTED.name());
                }
                case UNKNOWN -> {
                    if (!forceRollback) {
                        log.warn("Intent {} transfer {} still unconfirmed; left in TARGET_SETTLING", intentId, pending);
                        yield intent;
                    }
                    log.warn("Forcing rollback of intent {} with unconfirmed transfer {}", intentId, pending);
                    yield rollbackSettling(intent, FORCED_ROLLBACK);
                }
            };
        }
        if (forceRollback) {
            log.warn("Forcing rollback of intent {} with no recorded transfer", intentId);
            return rollbackSettling(intent, FORCED_ROLLBACK);
        }
        log.error("Intent {} is stuck in TARGET_SETTLING with no recorded transfer; operator review required", intentId);
        return intent;
    }

    private PaymentIntent rollbackSettling(PaymentIntent observed, String error) {
        Instant now = clock.instant();
        String intentId = observed.getIntentId();
        ConditionalUpdateResult result = repository.conditionalUpdate(intentId, IntentStatus.TARGET_SETTLING, current -> {
            if (!Objects.equals(current.getPendingTargetTxRef(), observed.getPendingTargetTxRef())
                || current.getSettlementAttempts() != observed.getSettlementAttempts()) {
                throw new InvalidIntentStateException(intentId, IntentStatus.TARGET_SETTLING,
                    "Intent changed while it was being reconciled");
            }
            rollback(current, error, now);
        });
        PaymentIntent stored = requireApplied(intentId, result, IntentStatus.TARGET_SETTLING);
        webhookService.notify(IntentWebhookService.EVENT_ROLLED_BACK, stored);
        return stored;
    }

    private static void rollback(PaymentIntent intent, String error, Instant at) {
        intent.setPendingTargetTxRef(null);
        intent.setLastError(error);
        intent.transitionTo(IntentStatus.SOURCE_SETTLED, at);
    }

    private static PaymentIntent requireApplied(String intentId, ConditionalUpdateResult result, IntentStatus expected) {
        return switch (result.outcome()) {
            case UPDATED -> result.intent();
            case NOT_FOUND -> throw new IntentNotFoundException(intentId);
            case CONFLICT -> throw new InvalidIntentStateException(intentId, result.intent().getStatus(),
                "Intent is " + result.intent().getStatus() + ", expected " + expected);
        };
    }

    private static void requireStatus(PaymentIntent intent, IntentStatus expected) {
        if (intent.getStatus() != expected) {
            throw new InvalidIntentStateException(intent.getIntentId(), intent.getStatus(),
                "Intent is " + intent.getStatus() + ", expected " + expected);
        }
    }

    private static SettlementFailedException superseded(String intentId) {
        return new SettlementFailedException(SettlementFailureReason.ATTEMPT_SUPERSEDED,
            "Intent " + intentId + " was taken over by another settlement attempt");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
