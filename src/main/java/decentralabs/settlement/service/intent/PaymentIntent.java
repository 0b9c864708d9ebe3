package decentralabs.settlement.service.intent;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

import decentralabs.settlement.dto.intent.IntentStatus;

/**
 * Durable record of one cross-chain payment. Leg fields and lifecycle timestamps are
 * write-once: a second write throws {@link IllegalStateException}.
 */
public class PaymentIntent {
    private final String intentId;
    private final BigDecimal amount;
    private final String merchantRecipient;
    private final String payerChain;
    private final String targetChain;
    private final Instant createdAt;
    private final Instant expiresAt;

    private IntentStatus status;
    private String sourceProof;
    private String sourceTxRef;
    private String payerWallet;
    private String targetTxRef;
    private String targetProof;
    private String pendingTargetTxRef;
    private String lastError;
    private int settlementAttempts;
    private long version;
    private Instant sourceSettledAt;
    private Instant targetSettledAt;
    private Instant completedAt;
    private Instant updatedAt;

    public PaymentIntent(
        String intentId,
        BigDecimal amount,
        String merchantRecipient,
        String payerChain,
        String targetChain,
        Instant createdAt,
        Instant expiresAt
    ) {
        this.intentId = Objects.requireNonNull(intentId, "intentId");
        this.amount = Objects.requireNonNull(amount, "amount");
        this.merchantRecipient = Objects.requireNonNull(merchantRecipient, "merchantRecipient");
        this.payerChain = payerChain;
        this.targetChain = targetChain;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        this.status = IntentStatus.PENDING;
        this.updatedAt = createdAt;
    }

    public PaymentIntent copy() {
        PaymentIntent copy = new PaymentIntent(
            intentId, amount, merchantRecipient, payerChain, targetChain, createdAt, expiresAt
        );
        copy.status = status;
        copy.sourceProof = sourceProof;
        copy.sourceTxRef = sourceTxRef;
        copy.payerWallet = payerWallet;
        copy.targetTxRef = targetTxRef;
        copy.targetProof = targetProof;
        copy.pendingTargetTxRef = pendingTargetTxRef;
        copy.lastError = lastError;
        copy.settlementAttempts = settlementAttempts;
        copy.version = version;
        copy.sourceSettledAt = sourceSettledAt;
        copy.targetSettledAt = targetSettledAt;
        copy.completedAt = completedAt;
        copy.updatedAt = updatedAt;
        return copy;
    }

    /**
     * Moves to {@code next} if the lifecycle graph allows it.
     */
    public void transitionTo(IntentStatus next, Instant at) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Illegal transition " + status + " -> " + next + " for intent " + intentId);
        }
        this.status = next;
        this.updatedAt = at;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public void recordSourceLeg(String proof, String txRef, String wallet, Instant settledAt) {
        requireUnset(sourceTxRef, "sourceTxRef");
        requireUnset(sourceSettledAt, "sourceSettledAt");
        this.sourceProof = proof;
        this.sourceTxRef = txRef;
        this.payerWallet = wallet;
        this.sourceSettledAt = settledAt;
    }

    public void recordTargetLeg(String txRef, String proof, Instant settledAt) {
        requireUnset(targetTxRef, "targetTxRef");
        requireUnset(targetSettledAt, "targetSettledAt");
        requireUnset(completedAt, "completedAt");
        this.targetTxRef = txRef;
        this.targetProof = proof;
        this.targetSettledAt = settledAt;
        this.completedAt = settledAt;
        this.pendingTargetTxRef = null;
        this.lastError = null;
    }

    public void beginSettlementAttempt() {
        this.settlementAttempts++;
    }

    public void touch(Instant at) {
        this.updatedAt = at;
    }

    private static void requireUnset(Object current, String field) {
        if (current != null) {
            throw new IllegalStateException(field + " is already recorded");
        }
    }

    public String getIntentId() {
        return intentId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getMerchantRecipient() {
        return merchantRecipient;
    }

    public String getPayerChain() {
        return payerChain;
    }

    public String getTargetChain() {
        return targetChain;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public IntentStatus getStatus() {
        return status;
    }

    /**
     * Restores a stored status. Transitions go through {@link #transitionTo}.
     */
    public void setStatus(IntentStatus status) {
        this.status = status;
    }

    public String getSourceProof() {
        return sourceProof;
    }

    public String getSourceTxRef() {
        return sourceTxRef;
    }

    public String getPayerWallet() {
        return payerWallet;
    }

    public String getTargetTxRef() {
        return targetTxRef;
    }

    public String getTargetProof() {
        return targetProof;
    }

    public String getPendingTargetTxRef() {
        return pendingTargetTxRef;
    }

    public void setPendingTargetTxRef(String pendingTargetTxRef) {
        this.pendingTargetTxRef = pendingTargetTxRef;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public int getSettlementAttempts() {
        return settlementAttempts;
    }

    public void setSettlementAttempts(int settlementAttempts) {
        this.settlementAttempts = settlementAttempts;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    public Instant getSourceSettledAt() {
        return sourceSettledAt;
    }

    public Instant getTargetSettledAt() {
        return targetSettledAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
