package decentralabs.settlement.security;

import decentralabs.settlement.util.LogSanitizer;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Keeps the operator reconcile endpoint ({@code /intents/{id}/reconcile}) reachable from
 * localhost only. Any path whose decoded last segment is {@code reconcile} is covered.
 */
@Component
@Order(0)
@Slf4j
public class LocalhostOnlyFilter extends OncePerRequestFilter {

    @Value("${security.allow-private-networks:false}")
    private boolean allowPrivateNetworks;

    private static final String RECONCILE_SEGMENT = "reconcile";

    private static final List<String> LOCALHOST_ADDRESSES = List.of(
        "127.0.0.1",
        "0:0:0:0:0:0:0:1",
        "::1",
        "::ffff:127.0.0.1"
    );

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {

        String path = RequestPaths.pathWithinApplication(request);
        if (requiresLocalhost(path) && !isLocalhost(request)) {
            log.warn("Blocked non-localhost request: path={}, clientIp={}",
                LogSanitizer.sanitize(path), LogSanitizer.sanitize(request.getRemoteAddr()));
            response.sendError(HttpServletResponse.SC_FORBIDDEN, "Endpoint is available from localhost only");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private boolean requiresLocalhost(String path) {
        return RECONCILE_SEGMENT.equalsIgnoreCase(RequestPaths.lastSegment(path));
    }

    private boolean isLocalhost(HttpServletRequest request) {
        String clientIp = request.getRemoteAddr();
        if (clientIp == null) {
            return false;
        }

        String normalized = clientIp.trim();
        if (LOCALHOST_ADDRESSES.contains(normalized)) {
            return true;
        }

        // docker bridge addresses (172.x/10.x) only when explicitly enabled
        return allowPrivateNetworks && isPrivateAddress(normalized);
    }

    private boolean isPrivateAddress(String ip) {
        try {
            return InetAddress.getByName(ip).isSiteLocalAddress();
        } catch (UnknownHostException e) {
            return false;
        }
    }
}
