package decentralabs.settlement.service.verification;

public interface ProofVerificationClient {

    /**
     * Asks the facilitator whether {@code proof} attests a settled source payment.
     * Never throws for remote failures; those come back as {@code UNAVAILABLE}.
     */
    ProofVerification verify(String proof);
}
