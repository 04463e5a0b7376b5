package com.paycycle.obligation.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;

/**
 * Logs API requests with their duration and tags the thread's log lines with a correlation ID
 */
@Slf4j
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    private static final String TRACE_ID = "traceId";
    private static final String START_ATTRIBUTE = RequestLoggingInterceptor.class.getName() + ".start";

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        MDC.put(TRACE_ID, correlationId);
        request.setAttribute(START_ATTRIBUTE, System.currentTimeMillis());
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        log.debug("Incoming request: {} {}", request.getMethod(), request.getRequestURI());
        return true;
    }

    @Override
    public void afterCompletion(@NonNull HttpServletRequest request,
                                @NonNull HttpServletResponse response,
                                @NonNull Object handler,
                                Exception ex) {
        Object start = request.getAttribute(START_ATTRIBUTE);
        if (start instanceof Long) {
            long duration = System.currentTimeMillis() - (Long) start;
            int status = response.getStatus();
            if (status >= 500) {
                log.error("Request completed: {} {} - Status: {} - Duration: {}ms",
                        request.getMethod(), request.getRequestURI(), status, duration);
            } else if (status >= 400) {
                log.warn("Request completed: {} {} - Status: {} - Duration: {}ms",
                        request.getMethod(), request.getRequestURI(), status, duration);
            } else {
                log.info("Request completed: {} {} - Status: {} - Duration: {}ms",
                        request.getMethod(), request.getRequestURI(), status, duration);
            }
        }
        MDC.remove(TRACE_ID);
    }
}
