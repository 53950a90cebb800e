package org.example.storyprep.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Gives every request an {@code X-Request-Id} (the caller's, when it sends one) and puts it in the MDC.
 * Calls on a single story also carry that story's id in the MDC, matching the processing workers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    private static final int MAX_REQUEST_ID_LENGTH = 80;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String requestId = Optional.ofNullable(normalizeHeader(request.getHeader(RequestCorrelation.HEADER_NAME)))
                .orElseGet(() -> UUID.randomUUID().toString());
        Optional<String> storyId = RequestCorrelation.storyIdFromPath(request.getRequestURI());

        request.setAttribute(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        response.setHeader(RequestCorrelation.HEADER_NAME, requestId);
        MDC.put(RequestCorrelation.MDC_REQUEST_ID, requestId);
        storyId.ifPresent(id -> MDC.put(RequestCorrelation.MDC_STORY_ID, id));
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestCorrelation.MDC_REQUEST_ID);
            storyId.ifPresent(id -> MDC.remove(RequestCorrelation.MDC_STORY_ID));
        }
    }

    static String normalizeHeader(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.substring(0, Math.min(trimmed.length(), MAX_REQUEST_ID_LENGTH));
    }
}
