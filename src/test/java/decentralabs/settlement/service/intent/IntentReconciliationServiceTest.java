package decentralabs.settlement.service.intent;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import decentralabs.settlement.config.IntentProperties;
import decentralabs.settlement.dto.intent.IntentStatus;
import decentralabs.settlement.exception.IntentNotFoundException;
import decentralabs.settlement.service.persistence.IntentRepository;

@ExtendWith(MockitoExtension.class)
class IntentReconciliationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String RECIPIENT = "0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913";

    @Mock
    private IntentRepository repository;

    @Mock
    private PaymentIntentService paymentIntentService;

    private IntentProperties intentProperties;
    private IntentReconciliationService reconciliationService;

    @BeforeEach
    void setUp() {
        intentProperties = new IntentProperties();
        reconciliationService = new IntentReconciliationService(
            repository, paymentIntentService, intentProperties, new MutableClock(NOW));
    }

    private static PaymentIntent intent(String id, IntentStatus status, Instant createdAt, Instant updatedAt) {
        PaymentIntent intent = new PaymentIntent(id, BigDecimal.ONE, RECIPIENT, "solana", "base",
            createdAt, createdAt.plus(Duration.ofMinutes(10)));
        intent.setStatus(status);
        intent.setUpdatedAt(updatedAt);
        return intent;
    }

    @Test
    @DisplayName("Should reconcile overdue PENDING intents and stop at the first live one")
    void shouldExpireOverduePending() {
        PaymentIntent overdue = intent("overdue", IntentStatus.PENDING, NOW.minus(Duration.ofMinutes(15)), NOW.minus(Duration.ofMinutes(15)));
        PaymentIntent live = intent("live", IntentStatus.PENDING, NOW.minus(Duration.ofMinutes(2)), NOW.minus(Duration.ofMinutes(2)));
        PaymentIntent later = intent("later", IntentStatus.PENDING, NOW.minus(Duration.ofMinutes(1)), NOW.minus(Duration.ofMinutes(1)));
        when(repository.findByStatus(eq(IntentStatus.PENDING), anyInt())).thenReturn(List.of(overdue, live, later));
        when(repository.findByStatus(eq(IntentStatus.SOURCE_SETTLED), anyInt())).thenReturn(List.of());
        when(repository.findByStatus(eq(IntentStatus.TARGET_SETTLING), anyInt())).thenReturn(List.of());

        reconciliationService.reconcile();

        verify(paymentIntentService).reconcile("overdue", false);
        verify(paymentIntentService, never()).reconcile("live", false);
        verify(paymentIntentService, never()).reconcile("later", false);
    }

    @Test
    @DisplayName("Should re-dispatch SOURCE_SETTLED intents idle past the threshold")
    void shouldRedispatchIdleSourceSettled() {
        PaymentIntent idle = intent("idle", IntentStatus.SOURCE_SETTLED, NOW.minus(Duration.ofMinutes(5)), NOW.minus(Duration.ofMinutes(2)));
        PaymentIntent fresh = intent("fresh", IntentStatus.SOURCE_SETTLED, NOW.minus(Duration.ofMinutes(5)), NOW.minusSeconds(10));
        when(repository.findByStatus(eq(IntentStatus.PENDING), anyInt())).thenReturn(List.of());
        when(repository.findByStatus(eq(IntentStatus.SOURCE_SETTLED), anyInt())).thenReturn(List.of(idle, fresh));
        when(repository.findByStatus(eq(IntentStatus.TARGET_SETTLING), anyInt())).thenReturn(List.of());

        reconciliationService.reconcile();

        verify(paymentIntentService).reconcile("idle", false);
        verify(paymentIntentService, never()).reconcile("fresh", false);
    }

    @Test
    @DisplayName("Should skip SOURCE_SETTLED intents when re-dispatch is disabled")
    void shouldSkipRedispatchWhenDisabled() {
        intentProperties.getReconciliation().setRedispatchEnabled(false);
        when(repository.findByStatus(eq(IntentStatus.PENDING), anyInt())).thenReturn(List.of());
        when(repository.findByStatus(eq(IntentStatus.TARGET_SETTLING), anyInt())).thenReturn(List.of());

        reconciliationService.reconcile();

        verify(repository, never()).findByStatus(eq(IntentStatus.SOURCE_SETTLED), anyInt());
        verify(paymentIntentService, never()).reconcile(anyString(), anyBoolean());
    }

    @Test
    @DisplayName("Should resolve stale TARGET_SETTLING intents without forcing a rollback")
    void shouldResolveStaleSettling() {
        PaymentIntent stale = intent("stale", IntentStatus.TARGET_SETTLING, NOW.minus(Duration.ofHours(1)), NOW.minus(Duration.ofMinutes(30)));
        PaymentIntent active = intent("active", IntentStatus.TARGET_SETTLING, NOW.minus(Duration.ofHours(1)), NOW.minus(Duration.ofMinutes(1)));
        when(repository.findByStatus(eq(IntentStatus.PENDING), anyInt())).thenReturn(List.of());
        when(repository.findByStatus(eq(IntentStatus.SOURCE_SETTLED), anyInt())).thenReturn(List.of());
        when(repository.findByStatus(eq(IntentStatus.TARGET_SETTLING), anyInt())).thenReturn(List.of(stale, active));

        reconciliationService.reconcile();

        verify(paymentIntentService).reconcile("stale", false);
        verify(paymentIntentService, never()).reconcile("active", false);
        verify(paymentIntentService, never()).reconcile(anyString(), eq(true));
    }

    @Test
    @DisplayName("Should keep sweeping after one intent fails")
    void shouldContinueAfterFailure() {
        PaymentIntent first = intent("first", IntentStatus.TARGET_SETTLING, NOW.minus(Duration.ofHours(2)), NOW.minus(Duration.ofHours(1)));
        PaymentIntent second = intent("second", IntentStatus.TARGET_SETTLING, NOW.minus(Duration.ofHours(2)), NOW.minus(Duration.ofMinutes(30)));
        when(repository.findByStatus(eq(IntentStatus.PENDING), anyInt())).thenReturn(List.of());
        when(repository.findByStatus(eq(IntentStatus.SOURCE_SETTLED), anyInt())).thenReturn(List.of());
        when(repository.findByStatus(eq(IntentStatus.TARGET_SETTLING), anyInt())).thenReturn(List.of(first, second));
        when(paymentIntentService.reconcile("first", false)).thenThrow(new IntentNotFoundException("first"));

        reconciliationService.reconcile();

        verify(paymentIntentService).reconcile("second", false);
    }
}
