package decentralabs.settlement.service.settlement;

/**
 * Callback invoked with the hash of a signed transfer before it is broadcast. Throwing
 * aborts the attempt with nothing sent.
 */
@FunctionalInterface
public interface SubmissionListener {

    SubmissionListener NONE = txHash -> { };

    void beforeBroadcast(String txHash);
}
