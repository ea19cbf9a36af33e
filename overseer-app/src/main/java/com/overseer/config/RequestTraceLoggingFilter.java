package com.overseer.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * HTTP 链路日志过滤器：透传或生成 X-Trace-Id 写入 MDC，请求结束输出一行 HTTP_OUT。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    private static final String HEADER_TRACE_ID = "X-Trace-Id";
    private static final String MDC_TRACE_ID = "traceId";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = StringUtils.isNotBlank(request.getHeader(HEADER_TRACE_ID))
                ? request.getHeader(HEADER_TRACE_ID).trim()
                : UUID.randomUUID().toString().replace("-", "");
        response.setHeader(HEADER_TRACE_ID, traceId);
        MDC.put(MDC_TRACE_ID, traceId);
        long startNs = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            log.info("HTTP_OUT method={}, path={}, status={}, costMs={}",
                    request.getMethod(), request.getRequestURI(), response.getStatus(), costMs);
            MDC.remove(MDC_TRACE_ID);
        }
    }
}
