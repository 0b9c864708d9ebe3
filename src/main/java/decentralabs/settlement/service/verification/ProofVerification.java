package decentralabs.settlement.service.verification;

/**
 * Facilitator verdict on a source settlement proof.
 */
public record ProofVerification(Outcome outcome, String reason) {

    public enum Outcome {
        VALID,
        INVALID,
        /** No verdict: transport failure, non-2xx answer or unreadable body. */
        UNAVAILABLE
    }

    public static ProofVerification valid() {
        return new ProofVerification(Outcome.VALID, null);
    }

    public static ProofVerification invalid(String reason) {
        return new ProofVerification(Outcome.INVALID, reason);
    }

    public static ProofVerification unavailable(String reason) {
        return new ProofVerification(Outcome.UNAVAILABLE, reason);
    }

    public boolean isValid() {
        return outcome == Outcome.VALID;
    }
}
