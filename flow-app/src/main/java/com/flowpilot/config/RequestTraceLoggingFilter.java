package com.flowpilot.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * 统一 HTTP 链路日志过滤器。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    private static final String HEADER_TRACE_ID = "X-Trace-Id";
    private static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final String MDC_HTTP_PATH = "httpPath";
    private static final String MDC_HTTP_METHOD = "httpMethod";

    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final long slowRequestThresholdMs;

    public RequestTraceLoggingFilter(ObjectMapper objectMapper,
                                     @Value("${observability.http-log.enabled:true}") boolean enabled,
                                     @Value("${observability.http-log.slow-request-threshold-ms:3000}") long slowRequestThresholdMs) {
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.slowRequestThresholdMs = slowRequestThresholdMs;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request == null || !enabled;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreateHeader(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreateHeader(request.getHeader(HEADER_REQUEST_ID));
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/").trim();
        String method = request.getMethod();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);

        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put(MDC_HTTP_PATH, path);
        MDC.put(MDC_HTTP_METHOD, method);

        long startNs = System.nanoTime();
        ContentCachingResponseWrapper responseWrapper = response instanceof ContentCachingResponseWrapper
                ? (ContentCachingResponseWrapper) response
                : new ContentCachingResponseWrapper(response);

        log.info("HTTP_IN method={}, path={}, query={}", method, path,
                StringUtils.defaultIfBlank(truncate(request.getQueryString(), 200), "-"));
        Throwable error = null;
        try {
            filterChain.doFilter(request, responseWrapper);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            String responseCode = StringUtils.defaultIfBlank(extractResponseCode(responseWrapper), "-");
            if (error != null) {
                log.warn("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, outcome=error, errorType={}, errorMessage={}",
                        method, path, responseWrapper.getStatus(), responseCode, costMs,
                        error.getClass().getSimpleName(), truncate(error.getMessage(), 200));
            } else if (costMs >= slowRequestThresholdMs) {
                log.warn("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, outcome=slow",
                        method, path, responseWrapper.getStatus(), responseCode, costMs);
            } else {
                log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, outcome=success",
                        method, path, responseWrapper.getStatus(), responseCode, costMs);
            }
            responseWrapper.copyBodyToResponse();
            MDC.remove(MDC_HTTP_METHOD);
            MDC.remove(MDC_HTTP_PATH);
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String resolveOrCreateHeader(String value) {
        if (StringUtils.isNotBlank(value)) {
            return value.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private String extractResponseCode(ContentCachingResponseWrapper responseWrapper) {
        byte[] body = responseWrapper.getContentAsByteArray();
        if (body == null || body.length == 0) {
            return null;
        }
        String contentType = responseWrapper.getContentType();
        if (StringUtils.isBlank(contentType)
                || !contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE)) {
            return null;
        }
        try {
            Map<String, Object> responseMap = objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {
            });
            Object code = responseMap.get("code");
            return code == null ? null : String.valueOf(code);
        } catch (IOException ex) {
            log.debug("Response body is not a JSON object. error={}", ex.getMessage());
            return null;
        }
    }

    private String truncate(String text, int maxLength) {
        if (StringUtils.isBlank(text) || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
