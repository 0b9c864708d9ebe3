package decentralabs.settlement.exception;

import decentralabs.settlement.dto.intent.IntentStatus;

/**
 * The intent is not in the state the operation requires, or a concurrent caller won the
 * transition. {@link #getCurrentStatus()} is the status observed when the operation gave up.
 */
public class InvalidIntentStateException extends RuntimeException {

    private final String intentId;
    private final IntentStatus currentStatus;

    public InvalidIntentStateException(String intentId, IntentStatus currentStatus, String message) {
        super(message);
        this.intentId = intentId;
        this.currentStatus = currentStatus;
    }

    public String getIntentId() {
        return intentId;
    }

    public IntentStatus getCurrentStatus() {
        return currentStatus;
    }
}
