package org.example.storyprep.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Requires {@code Authorization: Bearer <api.secret>} on the API when a secret is configured.
 * With no secret the API is open, which suits a single-user local deployment.
 */
@Component
public class ApiSecretInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(ApiSecretInterceptor.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final String apiSecret;

    public ApiSecretInterceptor(@Value("${api.secret:}") String apiSecret) {
        this.apiSecret = apiSecret;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (apiSecret == null || apiSecret.isBlank()) {
            return true;
        }
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        String provided = header != null && header.startsWith(BEARER_PREFIX)
                ? header.substring(BEARER_PREFIX.length()).trim()
                : null;
        if (constantTimeEquals(apiSecret, provided)) {
            return true;
        }
        log.warn("Rejected unauthenticated {} {} (requestId={})",
                request.getMethod(), request.getRequestURI(), RequestCorrelation.resolveRequestId(request));
        writeJson(response, HttpServletResponse.SC_UNAUTHORIZED, "{\"error\":\"Unauthorized\"}");
        return false;
    }

    private boolean constantTimeEquals(String expected, String provided) {
        if (expected == null || provided == null) {
            return false;
        }
        byte[] expectedBytes = expected.getBytes(StandardCharsets.UTF_8);
        byte[] providedBytes = provided.getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expectedBytes, providedBytes);
    }

    private void writeJson(HttpServletResponse response, int statusCode, String payload) throws Exception {
        response.setStatus(statusCode);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(payload);
    }
}
