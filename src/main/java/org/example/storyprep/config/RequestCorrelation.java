package org.example.storyprep.config;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Names shared by the correlation filter, the exception advice and the pipeline workers so that a
 * request id or story id shows up the same way in responses and log lines.
 */
public final class RequestCorrelation {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String ATTRIBUTE_NAME = "requestId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_STORY_ID = "storyId";
    public static final String UNKNOWN = "unknown";

    private static final Pattern STORY_PATH = Pattern.compile("^/api/stories/([^/]+)(?:/.*)?$");

    private RequestCorrelation() {
    }

    public static String resolveRequestId(HttpServletRequest request) {
        Object value = request == null ? null : request.getAttribute(ATTRIBUTE_NAME);
        return value instanceof String id && !id.isBlank() ? id : UNKNOWN;
    }

    /**
     * Story id addressed by a {@code /api/stories/{id}/...} path, if any.
     */
    public static Optional<String> storyIdFromPath(String path) {
        if (path == null) {
            return Optional.empty();
        }
        Matcher matcher = STORY_PATH.matcher(path);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
