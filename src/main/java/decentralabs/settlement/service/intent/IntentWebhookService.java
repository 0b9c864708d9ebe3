package decentralabs.settlement.service.intent;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import decentralabs.settlement.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Posts lifecycle events to {@code intent.webhook.url}, signed with HMAC-SHA256 in
 * {@code X-Signature} when a secret is set. Delivery is best effort.
 */
@Service
@Slf4j
public class IntentWebhookService {

    public static final String EVENT_COMPLETED = "intent.completed";
    public static final String EVENT_EXPIRED = "intent.expired";
    public static final String EVENT_ROLLED_BACK = "intent.rolled_back";
    public static final String EVENT_SOURCE_SETTLED = "intent.source_settled";

    private final OkHttpClient client = new OkHttpClient.Builder()
        .connectTimeout(5, TimeUnit.SECONDS)
        .readTimeout(10, TimeUnit.SECONDS)
        .build();
    private final ObjectMapper mapper = new ObjectMapper();
    private final String webhookUrl;
    private final String webhookSecret;

    public IntentWebhookService(
        @Value("${intent.webhook.url:}") String webhookUrl,
        @Value("${intent.webhook.secret:}") String webhookSecret
    ) {
        this.webhookUrl = webhookUrl;
        this.webhookSecret = webhookSecret;
    }

    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    public void notify(String event, PaymentIntent intent) {
        if (!isEnabled()) {
            return;
        }
        try {
            String payload = mapper.writeValueAsString(WebhookPayload.from(event, intent));
            RequestBody body = RequestBody.create(payload, MediaType.parse("application/json"));
            Request.Builder builder = new Request.Builder().url(webhookUrl).post(body);
            if (webhookSecret != null && !webhookSecret.isBlank()) {
                builder.addHeader("X-Signature", sign(payload, webhookSecret));
            }
            try (Response response = client.newCall(builder.build()).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("Webhook {} for intent {} responded with {}", event, intent.getIntentId(), response.code());
                }
            }
        } catch (Exception e) {
            log.warn("Unable to send webhook {} for {}: {}", event, intent.getIntentId(), LogSanitizer.sanitize(e.getMessage()));
        }
    }

    static String sign(String payload, String secret) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        byte[] signature = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        StringBuilder sb = new StringBuilder("sha256=");
        for (byte b : signature) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record WebhookPayload(
        String event,
        String intentId,
        String status,
        String amount,
        String sourceTxRef,
        String targetTxRef,
        String pendingTargetTxRef,
        String lastError
    ) {
        static WebhookPayload from(String event, PaymentIntent intent) {
            return new WebhookPayload(
                event,
                intent.getIntentId(),
                intent.getStatus().name(),
                intent.getAmount().toPlainString(),
                intent.getSourceTxRef(),
                intent.getTargetTxRef(),
                intent.getPendingTargetTxRef(),
                intent.getLastError()
            );
        }
    }
}
