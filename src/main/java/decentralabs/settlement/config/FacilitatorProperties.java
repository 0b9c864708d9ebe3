package decentralabs.settlement.config;

import java.time.Duration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "facilitator")
public class FacilitatorProperties {

    /** Base URL of the x402 facilitator; {@code /verify} is appended. */
    @NotBlank
    @Pattern(regexp = "\\s*https?://[^\\s/?#]+[^\\s]*", message = "must be an http(s) URL")
    private String url = "https://x402.org/facilitator";

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(30);
}
