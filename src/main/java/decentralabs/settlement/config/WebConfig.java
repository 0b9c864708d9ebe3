package decentralabs.settlement.config;

import java.util.Arrays;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC Configuration
 * Opens the intent API to the configured browser origins
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${cors.origins:http://localhost:3000}")
    private String corsOrigins;

    @Value("${endpoint.intents:/intents}")
    private String intentsPath;

    @Override
    public void addCorsMappings(@NonNull CorsRegistry registry) {
        String[] origins = Arrays.stream(corsOrigins.split(","))
            .map(String::trim)
            .filter(origin -> !origin.isEmpty())
            .toArray(String[]::new);
        registry.addMapping(intentsPath + "/**")
            .allowedOrigins(origins)
            .allowedMethods("GET", "POST", "OPTIONS");
    }
}
