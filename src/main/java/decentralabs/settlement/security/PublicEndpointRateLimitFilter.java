package decentralabs.settlement.security;

import decentralabs.settlement.util.LogSanitizer;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Token bucket per client IP on the public intent API.
 */
@Component
@Order(1)
@Slf4j
public class PublicEndpointRateLimitFilter extends OncePerRequestFilter {

    @Value("${rate.limit.enabled:true}")
    private boolean rateLimitEnabled = true;

    @Value("${rate.limit.intents.requests:10}")
    private int requestsPerWindow = 10;

    @Value("${rate.limit.intents.window-seconds:60}")
    private long windowSeconds = 60;

    /** Comma-separated proxy addresses whose forwarding headers are believed. */
    @Value("${rate.limit.trusted-proxies:}")
    private String trustedProxies = "";

    @Value("${endpoint.intents:/intents}")
    private String intentsPath = "/intents";

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    // bounds memory under address-spraying
    private static final int MAX_BUCKETS = 50000;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {

        if (!rateLimitEnabled) {
            filterChain.doFilter(request, response);
            return;
        }

        String path = RequestPaths.pathWithinApplication(request);
        String clientIp = getClientIp(request);
        if (isIntentEndpoint(path) && !tryConsume(clientIp)) {
            log.warn("Rate limit exceeded: path={}, ip={}", LogSanitizer.sanitize(path), maskIp(clientIp));
            sendRateLimitResponse(response);
            return;
        }

        filterChain.doFilter(request, response);
    }

    private boolean isIntentEndpoint(String path) {
        return path.equals(intentsPath) || path.startsWith(intentsPath + "/");
    }

    private boolean tryConsume(String clientIp) {
        if (buckets.size() > MAX_BUCKETS) {
            log.info("Cleaning up rate limit buckets, current size: {}", buckets.size());
            buckets.clear();
        }
        return buckets.computeIfAbsent(clientIp, k -> createBucket()).tryConsume(1);
    }

    private Bucket createBucket() {
        return Bucket.builder()
                .addLimit(Bandwidth.builder()
                        .capacity(requestsPerWindow)
                        .refillGreedy(requestsPerWindow, Duration.ofSeconds(windowSeconds))
                        .build())
                .build();
    }

    private void sendRateLimitResponse(HttpServletResponse response) throws IOException {
        response.setStatus(429);
        response.setContentType("application/json");
        response.setHeader("Retry-After", String.valueOf(windowSeconds));
        response.getWriter().write("{\"success\":false,\"error\":\"RATE_LIMITED\",\"message\":\"Too many requests. Please try again later.\"}");
    }

    /**
     * Remote address, or the forwarded client address when the request comes through one of
     * {@code rate.limit.trusted-proxies}. X-Forwarded-For is walked from the right and the first
     * hop that is not a trusted proxy wins.
     */
    private String getClientIp(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr() != null ? request.getRemoteAddr().trim() : "unknown";
        Set<String> proxies = trustedProxies();
        if (!proxies.contains(remoteAddr)) {
            return remoteAddr;
        }
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            String[] hops = xForwardedFor.split(",");
            for (int i = hops.length - 1; i >= 0; i--) {
                String hop = hops[i].trim();
                if (!hop.isEmpty() && !proxies.contains(hop)) {
                    return hop;
                }
            }
        }
        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.isBlank()) {
            return xRealIp.trim();
        }
        return remoteAddr;
    }

    private Set<String> trustedProxies() {
        if (trustedProxies == null || trustedProxies.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(trustedProxies.split(","))
            .map(String::trim)
            .filter(proxy -> !proxy.isEmpty())
            .collect(Collectors.toSet());
    }

    private String maskIp(String ip) {
        if (ip == null) {
            return "unknown";
        }
        int lastDot = ip.lastIndexOf('.');
        if (lastDot > 0) {
            return ip.substring(0, lastDot) + ".***";
        }
        if (ip.length() > 8) {
            return ip.substring(0, ip.length() - 4) + "****";
        }
        return ip;
    }
}
