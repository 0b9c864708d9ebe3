package decentralabs.settlement.service.intent;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import decentralabs.settlement.config.IntentProperties;
import decentralabs.settlement.dto.intent.IntentStatus;
import decentralabs.settlement.service.persistence.IntentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodic sweep over non-terminal intents: expires overdue PENDING ones, re-dispatches
 * SOURCE_SETTLED ones whose target leg never ran and resolves stale TARGET_SETTLING ones.
 */
@Service
@ConditionalOnProperty(value = "intent.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class IntentReconciliationService {

    private final IntentRepository repository;
    private final PaymentIntentService paymentIntentService;
    private final IntentProperties intentProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${intent.reconciliation.interval-ms:10000}")
    public void reconcile() {
        IntentProperties.Reconciliation settings = intentProperties.getReconciliation();
        Instant now = clock.instant();

        int expired = sweepExpired(now, settings.getBatchSize());
        int redispatched = settings.isRedispatchEnabled()
            ? sweep(IntentStatus.SOURCE_SETTLED, now.minus(settings.getRedispatchAfter()), settings.getBatchSize())
            : 0;
        int settling = sweep(IntentStatus.TARGET_SETTLING, now.minus(settings.getSettlingStaleAfter()), settings.getBatchSize());

        if (expired + redispatched + settling > 0) {
            log.info("Reconciliation pass: {} expiry checks, {} re-dispatched, {} stale settling", expired, redispatched, settling);
        }
    }

    private int sweepExpired(Instant now, int batchSize) {
        int processed = 0;
        for (PaymentIntent intent : repository.findByStatus(IntentStatus.PENDING, batchSize)) {
            // oldest first with a uniform ttl, so the first live intent ends the sweep
            if (!intent.isExpiredAt(now)) {
                break;
            }
            if (reconcileOne(intent)) {
                processed++;
            }
        }
        return processed;
    }

    private int sweep(IntentStatus status, Instant updatedBefore, int batchSize) {
        List<PaymentIntent> candidates = repository.findByStatus(status, batchSize);
        int processed = 0;
        for (PaymentIntent intent : candidates) {
            if (intent.getUpdatedAt().isAfter(updatedBefore)) {
                break;
            }
            if (reconcileOne(intent)) {
                processed++;
            }
        }
        return processed;
    }

    private boolean reconcileOne(PaymentIntent intent) {
        try {
            paymentIntentService.reconcile(intent.getIntentId(), false);
            return true;
        } catch (RuntimeException e) {
            log.warn("Reconciliation of intent {} ({}) failed: {}", intent.getIntentId(), intent.getStatus(), e.getMessage(), e);
            return false;
        }
    }
}
