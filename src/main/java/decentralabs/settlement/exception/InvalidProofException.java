package decentralabs.settlement.exception;

/**
 * The facilitator rejected the source settlement proof.
 */
public class InvalidProofException extends RuntimeException {

    public InvalidProofException(String message) {
        super(message);
    }
}
