package org.example.storybook.config;

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
import java.util.UUID;

/**
 * Puts the request id, and the workflow execution when the caller sends one, into the MDC.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    private static final int MAX_HEADER_LENGTH = 80;
    private static final int MAX_EXECUTION_LENGTH = 255;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String requestId = normalizeHeader(request.getHeader(RequestCorrelation.HEADER_NAME), MAX_HEADER_LENGTH);
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        String execution = normalizeHeader(
                request.getHeader(RequestCorrelation.EXECUTION_HEADER_NAME), MAX_EXECUTION_LENGTH);

        request.setAttribute(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        response.setHeader(RequestCorrelation.HEADER_NAME, requestId);
        MDC.put(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        if (execution != null) {
            request.setAttribute(RequestCorrelation.EXECUTION_ATTRIBUTE_NAME, execution);
            MDC.put(RequestCorrelation.EXECUTION_ATTRIBUTE_NAME, execution);
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestCorrelation.ATTRIBUTE_NAME);
            MDC.remove(RequestCorrelation.EXECUTION_ATTRIBUTE_NAME);
        }
    }

    private String normalizeHeader(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > maxLength) {
            trimmed = trimmed.substring(0, maxLength);
        }
        return trimmed;
    }
}
