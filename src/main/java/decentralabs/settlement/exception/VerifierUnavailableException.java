package decentralabs.settlement.exception;

/**
 * The facilitator could not be reached or answered with something other than a verdict.
 * The intent is left untouched, so the caller may retry.
 */
public class VerifierUnavailableException extends RuntimeException {

    public VerifierUnavailableException(String message) {
        super(message);
    }
}
