package decentralabs.settlement.service.persistence;

import decentralabs.settlement.service.intent.PaymentIntent;

/**
 * Outcome of a status compare-and-swap. {@code intent} is the written state on
 * {@link Outcome#UPDATED}, the state that blocked the write on {@link Outcome#CONFLICT},
 * and null on {@link Outcome#NOT_FOUND}.
 */
public record ConditionalUpdateResult(Outcome outcome, PaymentIntent intent) {

    public enum Outcome {
        UPDATED,
        CONFLICT,
        NOT_FOUND
    }

    public static ConditionalUpdateResult updated(PaymentIntent intent) {
        return new ConditionalUpdateResult(Outcome.UPDATED, intent);
    }

    public static ConditionalUpdateResult conflict(PaymentIntent current) {
        return new ConditionalUpdateResult(Outcome.CONFLICT, current);
    }

    public static ConditionalUpdateResult notFound() {
        return new ConditionalUpdateResult(Outcome.NOT_FOUND, null);
    }

    public boolean isUpdated() {
        return outcome == Outcome.UPDATED;
    }
}
