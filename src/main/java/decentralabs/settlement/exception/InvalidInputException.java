package decentralabs.settlement.exception;

/**
 * Request data that can never succeed: bad amount, malformed recipient, blank proof.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
