package com.example.webhookrelay.filter;

import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with a request id (MDC key {@code requestId}, echoed in
 * {@code X-Request-Id}) and logs its outcome once the response is complete.
 */
@Component
@Slf4j
public class RequestLoggingFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String REQUEST_ID_MDC_KEY = "requestId";

    static final long SLOW_REQUEST_THRESHOLD_MS = 5000;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (!StringUtils.hasText(requestId)) {
            requestId = UUID.randomUUID().toString();
        }
        long startTime = System.currentTimeMillis();

        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        log.info("{} {}", request.getMethod(), request.getRequestURI());

        try {
            chain.doFilter(request, response);
        } finally {
            if (request.isAsyncStarted()) {
                request.getAsyncContext().addListener(new CompletionListener(request, response, requestId, startTime));
            } else {
                logCompletion(request, response.getStatus(), requestId, startTime);
            }
            MDC.clear();
        }
    }

    private static void logCompletion(HttpServletRequest request, int status, String requestId, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        try {
            if (duration > SLOW_REQUEST_THRESHOLD_MS) {
                log.warn("SLOW REQUEST: {} {} - {} - {}ms - {}",
                        request.getMethod(), request.getRequestURI(), status, duration, requestId);
            } else {
                log.info("{} {} - {} - {}ms - {}",
                        request.getMethod(), request.getRequestURI(), status, duration, requestId);
            }
        } finally {
            MDC.remove(REQUEST_ID_MDC_KEY);
        }
    }

    private static final class CompletionListener implements AsyncListener {

        private final HttpServletRequest request;
        private final HttpServletResponse response;
        private final String requestId;
        private final long startTime;

        private CompletionListener(HttpServletRequest request, HttpServletResponse response,
                String requestId, long startTime) {
            this.request = request;
            this.response = response;
            this.requestId = requestId;
            this.startTime = startTime;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            logCompletion(request, response.getStatus(), requestId, startTime);
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            log.warn("Request timed out: {} {} - {}", request.getMethod(), request.getRequestURI(), requestId);
        }

        @Override
        public void onError(AsyncEvent event) {
            log.error("Request failed: {} {} - {}", request.getMethod(), request.getRequestURI(), requestId,
                    event.getThrowable());
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            // listener is registered after the async start
        }
    }
}
