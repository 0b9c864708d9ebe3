package decentralabs.settlement.dto.intent;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Proof that the payer settled on the source chain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SourceProofRequest {

    @NotBlank(message = "settle_proof is required")
    @Size(max = 4096, message = "settle_proof is too long")
    private String settleProof;

    @NotBlank(message = "tx_hash is required")
    @Size(max = 128, message = "tx_hash is too long")
    private String txHash;

    @Size(max = 128, message = "payer_wallet is too long")
    private String payerWallet;
}
