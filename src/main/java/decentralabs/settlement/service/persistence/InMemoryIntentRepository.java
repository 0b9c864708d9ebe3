package decentralabs.settlement.service.persistence;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import decentralabs.settlement.dto.intent.IntentStatus;
import decentralabs.settlement.service.intent.PaymentIntent;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-local intent store. Intents are lost on restart, so the durable
 * "needs target settlement" marker only survives with the JDBC store.
 */
@Repository
@ConditionalOnProperty(name = "intent.store", havingValue = "memory")
@Slf4j
public class InMemoryIntentRepository implements IntentRepository {

    private final Map<String, PaymentIntent> intents = new ConcurrentHashMap<>();

    @Override
    public void create(PaymentIntent intent) {
        PaymentIntent previous = intents.putIfAbsent(intent.getIntentId(), intent.copy());
        if (previous != null) {
            throw new IllegalStateException("Intent already exists: " + intent.getIntentId());
        }
    }

    @Override
    public Optional<PaymentIntent> findById(String intentId) {
        if (intentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(intents.get(intentId)).map(PaymentIntent::copy);
    }

    @Override
    public ConditionalUpdateResult conditionalUpdate(
        String intentId,
        IntentStatus expectedStatus,
        Consumer<PaymentIntent> mutation
    ) {
        if (intentId == null) {
            return ConditionalUpdateResult.notFound();
        }
        AtomicReference<ConditionalUpdateResult> result = new AtomicReference<>();
        intents.computeIfPresent(intentId, (id, current) -> {
            if (current.getStatus() != expectedStatus) {
                result.set(ConditionalUpdateResult.conflict(current.copy()));
                return current;
            }
            PaymentIntent next = current.copy();
            mutation.accept(next);
            next.setVersion(current.getVersion() + 1);
            result.set(ConditionalUpdateResult.updated(next.copy()));
            return next;
        });
        return result.get() != null ? result.get() : ConditionalUpdateResult.notFound();
    }

    @Override
    public List<PaymentIntent> findByStatus(IntentStatus status, int limit) {
        return intents.values().stream()
            .filter(intent -> intent.getStatus() == status)
            .sorted(Comparator.comparing(PaymentIntent::getUpdatedAt))
            .limit(Math.max(limit, 0))
            .map(PaymentIntent::copy)
            .toList();
    }
}
