package decentralabs.settlement.service.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import decentralabs.settlement.dto.intent.IntentStatus;
import decentralabs.settlement.service.intent.PaymentIntent;
import decentralabs.settlement.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Intent store over the {@code payment_intents} table. The status compare-and-swap is a
 * single {@code UPDATE ... WHERE status = ? AND row_version = ?}; the row version catches
 * same-status writes that landed between the read and the update.
 */
@Repository
@ConditionalOnProperty(name = "intent.store", havingValue = "jdbc", matchIfMissing = true)
@Slf4j
public class JdbcIntentRepository implements IntentRepository {

    private static final int MAX_CAS_ATTEMPTS = 5;

    private final JdbcTemplate jdbcTemplate;

    public JdbcIntentRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void create(PaymentIntent intent) {
        try {
            jdbcTemplate.update(
                """
                INSERT INTO payment_intents (
                    intent_id, amount, merchant_recipient, payer_chain, target_chain, status,
                    source_proof, source_tx_ref, payer_wallet, target_tx_ref, target_proof,
                    pending_target_tx_ref, last_error, settlement_attempts, row_version,
                    created_at, expires_at, source_settled_at, target_settled_at, completed_at, updated_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                intent.getIntentId(),
                intent.getAmount(),
                intent.getMerchantRecipient(),
                intent.getPayerChain(),
                intent.getTargetChain(),
                intent.getStatus().name(),
                intent.getSourceProof(),
                intent.getSourceTxRef(),
                intent.getPayerWallet(),
                intent.getTargetTxRef(),
                intent.getTargetProof(),
                intent.getPendingTargetTxRef(),
                intent.getLastError(),
                intent.getSettlementAttempts(),
                intent.getVersion(),
                toTimestamp(intent.getCreatedAt()),
                toTimestamp(intent.getExpiresAt()),
                toTimestamp(intent.getSourceSettledAt()),
                toTimestamp(intent.getTargetSettledAt()),
                toTimestamp(intent.getCompletedAt()),
                toTimestamp(intent.getUpdatedAt())
            );
        } catch (DuplicateKeyException e) {
            throw new IllegalStateException("Intent already exists: " + intent.getIntentId(), e);
        }
    }

    @Override
    public Optional<PaymentIntent> findById(String intentId) {
        if (intentId == null) {
            return Optional.empty();
        }
        return jdbcTemplate.query(
            "SELECT * FROM payment_intents WHERE intent_id = ?",
            this::mapRow,
            intentId
        ).stream().findFirst();
    }

    @Override
    public ConditionalUpdateResult conditionalUpdate(
        String intentId,
        IntentStatus expectedStatus,
        Consumer<PaymentIntent> mutation
    ) {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Optional<PaymentIntent> stored = findById(intentId);
            if (stored.isEmpty()) {
                return ConditionalUpdateResult.notFound();
            }
            PaymentIntent current = stored.get();
            if (current.getStatus() != expectedStatus) {
                return ConditionalUpdateResult.conflict(current);
            }

            PaymentIntent next = current.copy();
            mutation.accept(next);
            next.setVersion(current.getVersion() + 1);

            if (writeIfUnchanged(next, expectedStatus, current.getVersion()) == 1) {
                return ConditionalUpdateResult.updated(next);
            }
            log.debug("Concurrent write on intent {} (attempt {})", LogSanitizer.sanitize(intentId), attempt);
        }
        return findById(intentId)
            .map(ConditionalUpdateResult::conflict)
            .orElseGet(ConditionalUpdateResult::notFound);
    }

    @Override
    public List<PaymentIntent> findByStatus(IntentStatus status, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return jdbcTemplate.query(
            "SELECT * FROM payment_intents WHERE status = ? ORDER BY updated_at ASC LIMIT ?",
            this::mapRow,
            status.name(),
            limit
        );
    }

    private int writeIfUnchanged(PaymentIntent next, IntentStatus expectedStatus, long expectedVersion) {
        return jdbcTemplate.update(
            """
            UPDATE payment_intents SET
                status = ?,
                source_proof = ?,
                source_tx_ref = ?,
                payer_wallet = ?,
                target_tx_ref = ?,
                target_proof = ?,
                pending_target_tx_ref = ?,
                last_error = ?,
                settlement_attempts = ?,
                row_version = ?,
                source_settled_at = ?,
                target_settled_at = ?,
                completed_at = ?,
                updated_at = ?
            WHERE intent_id = ? AND status = ? AND row_version = ?
            """,
            next.getStatus().name(),
            next.getSourceProof(),
            next.getSourceTxRef(),
            next.getPayerWallet(),
            next.getTargetTxRef(),
            next.getTargetProof(),
            next.getPendingTargetTxRef(),
            next.getLastError(),
            next.getSettlementAttempts(),
            next.getVersion(),
            toTimestamp(next.getSourceSettledAt()),
            toTimestamp(next.getTargetSettledAt()),
            toTimestamp(next.getCompletedAt()),
            toTimestamp(next.getUpdatedAt()),
            next.getIntentId(),
            expectedStatus.name(),
            expectedVersion
        );
    }

    private PaymentIntent mapRow(ResultSet rs, int rowNum) throws SQLException {
        PaymentIntent intent = new PaymentIntent(
            rs.getString("intent_id"),
            rs.getBigDecimal("amount").stripTrailingZeros(),
            rs.getString("merchant_recipient"),
            rs.getString("payer_chain"),
            rs.getString("target_chain"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("expires_at"))
        );
        intent.setStatus(IntentStatus.valueOf(rs.getString("status")));

        Instant sourceSettledAt = toInstant(rs.getTimestamp("source_settled_at"));
        if (sourceSettledAt != null) {
            intent.recordSourceLeg(
                rs.getString("source_proof"),
                rs.getString("source_tx_ref"),
                rs.getString("payer_wallet"),
                sourceSettledAt
            );
        }
        Instant targetSettledAt = toInstant(rs.getTimestamp("target_settled_at"));
        if (targetSettledAt != null) {
            intent.recordTargetLeg(rs.getString("target_tx_ref"), rs.getString("target_proof"), targetSettledAt);
        }

        intent.setPendingTargetTxRef(rs.getString("pending_target_tx_ref"));
        intent.setLastError(rs.getString("last_error"));
        intent.setSettlementAttempts(rs.getInt("settlement_attempts"));
        intent.setVersion(rs.getLong("row_version"));
        Instant updatedAt = toInstant(rs.getTimestamp("updated_at"));
        intent.setUpdatedAt(updatedAt != null ? updatedAt : intent.getCreatedAt());
        return intent;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
