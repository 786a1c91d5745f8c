package com.contractmind.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP 链路日志过滤器：生成 traceId / requestId 写入 MDC 与响应头，记录入口与出口日志。
 * <p>
 * 出口日志中的 responseCode 取自响应体 {@code Response.code}，因为 HTTP 状态恒为 200。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final HttpTraceLogProperties properties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RequestTraceLoggingFilter(ObjectMapper objectMapper, HttpTraceLogProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.isEnabled()) {
            return true;
        }
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/");
        return properties.getIncludePathPatterns().stream().noneMatch(pattern -> pathMatcher.match(pattern, path));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreate(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreate(request.getHeader(HEADER_REQUEST_ID));
        String path = request.getRequestURI();
        String method = request.getMethod();
        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);
        long start = System.currentTimeMillis();
        log.info("HTTP_IN method={}, path={}, query={}", method, path, StringUtils.defaultIfBlank(request.getQueryString(), "-"));
        try {
            filterChain.doFilter(requestWrapper, responseWrapper);
        } catch (IOException | ServletException | RuntimeException ex) {
            log.warn("HTTP_OUT method={}, path={}, costMs={}, outcome=error, errorType={}, errorMessage={}",
                    method, path, System.currentTimeMillis() - start, ex.getClass().getSimpleName(), ex.getMessage());
            throw ex;
        } finally {
            long costMs = System.currentTimeMillis() - start;
            if (costMs >= properties.getSlowRequestThresholdMs()) {
                log.warn("HTTP_SLOW method={}, path={}, costMs={}", method, path, costMs);
            }
            log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, requestBodySummary={}",
                    method,
                    path,
                    responseWrapper.getStatus(),
                    StringUtils.defaultIfBlank(extractResponseCode(responseWrapper), "-"),
                    costMs,
                    summarizeBody(requestWrapper));
            responseWrapper.copyBodyToResponse();
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String resolveOrCreate(String value) {
        return StringUtils.isNotBlank(value) ? value.trim() : UUID.randomUUID().toString().replace("-", "");
    }

    private String extractResponseCode(ContentCachingResponseWrapper responseWrapper) {
        byte[] body = responseWrapper.getContentAsByteArray();
        if (body.length == 0 || !isJson(responseWrapper.getContentType())) {
            return null;
        }
        try {
            Object code = objectMapper.readValue(body, MAP_TYPE).get("code");
            return code == null ? null : String.valueOf(code);
        } catch (IOException ex) {
            log.debug("HTTP_RESPONSE_UNPARSEABLE error={}", ex.getMessage());
            return null;
        }
    }

    private String summarizeBody(ContentCachingRequestWrapper requestWrapper) {
        byte[] body = requestWrapper.getContentAsByteArray();
        if (body.length == 0 || !isJson(requestWrapper.getContentType())) {
            return "-";
        }
        try {
            Map<String, Object> source = objectMapper.readValue(body, MAP_TYPE);
            Map<String, Object> summary = new LinkedHashMap<>();
            for (String key : properties.getRequestBodyWhitelist()) {
                if (source.containsKey(key)) {
                    summary.put(key, source.get(key));
                }
            }
            return summary.isEmpty() ? "-" : StringUtils.truncate(objectMapper.writeValueAsString(summary), properties.getMaxBodyLength());
        } catch (IOException ex) {
            return "-";
        }
    }

    private boolean isJson(String contentType) {
        return StringUtils.isNotBlank(contentType)
                && contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE);
    }
}
