package org.example.storybook.config;

import jakarta.servlet.http.HttpServletRequest;

public final class RequestCorrelation {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String ATTRIBUTE_NAME = "requestId";
    public static final String EXECUTION_HEADER_NAME = "X-Workflow-Execution";
    public static final String EXECUTION_ATTRIBUTE_NAME = "workflowExecution";
    public static final String UNKNOWN = "unknown";

    private RequestCorrelation() {
    }

    public static String resolveRequestId(HttpServletRequest request) {
        return resolveAttribute(request, ATTRIBUTE_NAME, UNKNOWN);
    }

    /**
     * External workflow execution handle sent with the request, or null.
     */
    public static String resolveWorkflowExecution(HttpServletRequest request) {
        return resolveAttribute(request, EXECUTION_ATTRIBUTE_NAME, null);
    }

    private static String resolveAttribute(HttpServletRequest request, String name, String fallback) {
        if (request == null) {
            return fallback;
        }
        Object value = request.getAttribute(name);
        if (value instanceof String text && !text.isBlank()) {
            return text;
        }
        return fallback;
    }
}
