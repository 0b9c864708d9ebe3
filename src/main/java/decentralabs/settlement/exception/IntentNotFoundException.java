package decentralabs.settlement.exception;

public class IntentNotFoundException extends RuntimeException {

    private final String intentId;

    public IntentNotFoundException(String intentId) {
        super("Payment intent not found: " + intentId);
        this.intentId = intentId;
    }

    public String getIntentId() {
        return intentId;
    }
}
