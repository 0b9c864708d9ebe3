package decentralabs.settlement.dto.intent;

import java.time.Instant;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import decentralabs.settlement.service.intent.PaymentIntent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IntentResponse {
    private String intentId;
    private IntentStatus status;
    private String amount;
    private String merchantRecipient;
    private String payerChain;
    private String targetChain;
    private String sourceProof;
    private String sourceTxRef;
    private String payerWallet;
    private String targetTxRef;
    private String targetProof;
    private String pendingTargetTxRef;
    private String lastError;
    private int settlementAttempts;
    private String createdAt;
    private String expiresAt;
    private String sourceSettledAt;
    private String targetSettledAt;
    private String completedAt;
    private String updatedAt;

    public static IntentResponse from(PaymentIntent intent) {
        return IntentResponse.builder()
            .intentId(intent.getIntentId())
            .status(intent.getStatus())
            .amount(intent.getAmount().toPlainString())
            .merchantRecipient(intent.getMerchantRecipient())
            .payerChain(intent.getPayerChain())
            .targetChain(intent.getTargetChain())
            .sourceProof(intent.getSourceProof())
            .sourceTxRef(intent.getSourceTxRef())
            .payerWallet(intent.getPayerWallet())
            .targetTxRef(intent.getTargetTxRef())
            .targetProof(intent.getTargetProof())
            .pendingTargetTxRef(intent.getPendingTargetTxRef())
            .lastError(intent.getLastError())
            .settlementAttempts(intent.getSettlementAttempts())
            .createdAt(format(intent.getCreatedAt()))
            .expiresAt(format(intent.getExpiresAt()))
            .sourceSettledAt(format(intent.getSourceSettledAt()))
            .targetSettledAt(format(intent.getTargetSettledAt()))
            .completedAt(format(intent.getCompletedAt()))
            .updatedAt(format(intent.getUpdatedAt()))
            .build();
    }

    static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
