package decentralabs.settlement.service.verification;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import decentralabs.settlement.config.FacilitatorProperties;
import decentralabs.settlement.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * x402 facilitator client: {@code POST {url}/verify} with {@code {"proof": ...}}, answered by
 * {@code {"valid": bool}} (or {@code isValid}) and an optional {@code invalidReason}.
 */
@Service
@Slf4j
public class HttpProofVerificationClient implements ProofVerificationClient {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String verifyUrl;

    public HttpProofVerificationClient(FacilitatorProperties properties) {
        this.client = new OkHttpClient.Builder()
            .connectTimeout(properties.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .readTimeout(properties.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .build();
        this.verifyUrl = stripTrailingSlash(properties.getUrl()) + "/verify";
    }

    @Override
    public ProofVerification verify(String proof) {
        if (proof == null || proof.isBlank()) {
            return ProofVerification.invalid("empty proof");
        }
        String payload = mapper.createObjectNode().put("proof", proof).toString();
        Request request = new Request.Builder()
            .url(verifyUrl)
            .post(RequestBody.create(payload, JSON))
            .build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.warn("Facilitator verify responded with {}", response.code());
                return ProofVerification.unavailable("facilitator responded with " + response.code());
            }
            ResponseBody body = response.body();
            JsonNode json = mapper.readTree(body != null ? body.string() : "");
            JsonNode valid = json.has("valid") ? json.get("valid") : json.get("isValid");
            if (valid == null || !valid.isBoolean()) {
                log.warn("Facilitator verify response carries no verdict");
                return ProofVerification.unavailable("facilitator response carries no verdict");
            }
            if (valid.asBoolean()) {
                return ProofVerification.valid();
            }
            String reason = json.hasNonNull("invalidReason")
                ? json.get("invalidReason").asText()
                : json.path("message").asText("proof rejected");
            log.info("Facilitator rejected proof: {}", LogSanitizer.sanitize(reason));
            return ProofVerification.invalid(reason);
        } catch (IOException e) {
            log.warn("Facilitator verify call failed: {}", LogSanitizer.sanitize(e.getMessage()));
            return ProofVerification.unavailable(e.getMessage());
        }
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url == null ? "" : url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
