package org.example.storybook.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Requires the shared workflow key in {@code X-API-Key} on every API call. With no key configured
 * every request is rejected.
 */
@Component
public class WorkflowApiKeyInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(WorkflowApiKeyInterceptor.class);
    static final String HEADER_NAME = "X-API-Key";

    private final String apiKey;

    public WorkflowApiKeyInterceptor(@Value("${workflow.api-key:}") String apiKey) {
        this.apiKey = apiKey;
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("workflow.api-key is not configured; all /api requests will be rejected");
        }
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (apiKey == null || apiKey.isBlank()) {
            writeJson(response, HttpServletResponse.SC_UNAUTHORIZED,
                    "{\"success\":false,\"error\":\"API key authentication is not configured\"}");
            return false;
        }

        String providedApiKey = request.getHeader(HEADER_NAME);
        if (!constantTimeEquals(apiKey, providedApiKey)) {
            log.warn("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(),
                    providedApiKey == null ? "missing API key" : "invalid API key");
            writeJson(response, HttpServletResponse.SC_UNAUTHORIZED,
                    "{\"success\":false,\"error\":\"Invalid or missing API key\"}");
            return false;
        }
        return true;
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
