package decentralabs.settlement.security;

import decentralabs.settlement.util.LogSanitizer;
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
import java.util.concurrent.TimeUnit;

/**
 * Access log for the HTTP API: method, path, status and duration of every request, including
 * those rejected by the other filters.
 */
@Component
@Order(-1)
@Slf4j
public class RequestLoggingFilter extends OncePerRequestFilter {

    @Value("${logging.requests.enabled:true}")
    private boolean enabled = true;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {

        if (!enabled) {
            filterChain.doFilter(request, response);
            return;
        }

        long started = System.nanoTime();
        String method = LogSanitizer.sanitize(request.getMethod());
        String path = LogSanitizer.sanitize(RequestPaths.pathWithinApplication(request));
        try {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException e) {
            log.error("{} {} failed after {} ms: {}", method, path, elapsedMillis(started),
                LogSanitizer.sanitize(e.getMessage()));
            throw e;
        }

        int status = response.getStatus();
        if (status >= 500) {
            log.warn("{} {} -> {} ({} ms)", method, path, status, elapsedMillis(started));
        } else {
            log.info("{} {} -> {} ({} ms)", method, path, status, elapsedMillis(started));
        }
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
