package decentralabs.settlement.dto.intent;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settlement receipt for both legs. A leg is null until its transaction reference exists.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReceiptResponse {
    private String intentId;
    private IntentStatus status;
    private String amount;
    private String merchantRecipient;
    private Leg sourceLeg;
    private Leg targetLeg;
    private String completedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Leg {
        private String chain;
        private String txRef;
        private String proof;
        private String wallet;
        private String settledAt;
        private String explorerUrl;
    }
}
