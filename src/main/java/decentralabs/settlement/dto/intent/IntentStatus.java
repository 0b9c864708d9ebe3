package decentralabs.settlement.dto.intent;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a payment intent.
 *
 * <pre>
 * PENDING -> SOURCE_SETTLED -> TARGET_SETTLING -> COMPLETED
 * PENDING -> EXPIRED
 * TARGET_SETTLING -> SOURCE_SETTLED   (rollback after a failed transfer)
 * </pre>
 */
public enum IntentStatus {
    PENDING,
    SOURCE_SETTLED,
    TARGET_SETTLING,
    COMPLETED,
    EXPIRED;

    public Set<IntentStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(SOURCE_SETTLED, EXPIRED);
            case SOURCE_SETTLED -> EnumSet.of(TARGET_SETTLING);
            case TARGET_SETTLING -> EnumSet.of(COMPLETED, SOURCE_SETTLED);
            case COMPLETED, EXPIRED -> EnumSet.noneOf(IntentStatus.class);
        };
    }

    public boolean canTransitionTo(IntentStatus next) {
        return next != null && successors().contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == EXPIRED;
    }
}
