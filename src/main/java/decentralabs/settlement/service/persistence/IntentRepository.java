package decentralabs.settlement.service.persistence;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import decentralabs.settlement.dto.intent.IntentStatus;
import decentralabs.settlement.service.intent.PaymentIntent;

/**
 * Keyed storage for payment intents. Every state transition goes through
 * {@link #conditionalUpdate}, which applies the mutation only if the stored status still
 * equals the expected one.
 */
public interface IntentRepository {

    /**
     * Stores a new intent.
     *
     * @throws IllegalStateException if an intent with the same id exists
     */
    void create(PaymentIntent intent);

    Optional<PaymentIntent> findById(String intentId);

    /**
     * Atomically applies {@code mutation} to the stored intent when its status equals
     * {@code expectedStatus}. The mutation receives a private copy; if it throws, nothing is
     * written and the exception propagates.
     */
    ConditionalUpdateResult conditionalUpdate(
        String intentId,
        IntentStatus expectedStatus,
        Consumer<PaymentIntent> mutation
    );

    /**
     * Intents in {@code status}, least recently updated first.
     */
    List<PaymentIntent> findByStatus(IntentStatus status, int limit);
}
