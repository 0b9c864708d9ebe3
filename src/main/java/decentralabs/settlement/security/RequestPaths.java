package decentralabs.settlement.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.util.UrlPathHelper;

final class RequestPaths {

    private static final UrlPathHelper PATH_HELPER = createPathHelper();

    private RequestPaths() {
    }

    /**
     * Path within the application as handler mapping sees it: decoded, without {@code ;} path
     * parameters and with duplicate slashes collapsed.
     */
    static String pathWithinApplication(HttpServletRequest request) {
        return PATH_HELPER.getPathWithinApplication(request);
    }

    /**
     * Last non-empty segment of {@code path}, ignoring trailing slashes.
     */
    static String lastSegment(String path) {
        String trimmed = path;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    private static UrlPathHelper createPathHelper() {
        UrlPathHelper helper = new UrlPathHelper();
        helper.setUrlDecode(true);
        helper.setRemoveSemicolonContent(true);
        return helper;
    }
}
