package com.tripflow.server.filter;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;

/**
 * 请求级别的统一日志过滤器：
 * - 为每次 HTTP 请求生成或透传 traceId，写入 MDC 与响应头；
 * - 编排线程池会复制 MDC，所以同一请求触发的异步任务日志也能串起来；
 * - 记录请求方法、URI、会话 key、HTTP 状态码与耗时。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class TraceLoggingFilter extends OncePerRequestFilter {

    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String TRACE_ID_KEY = "traceId";
    public static final String CONVERSATION_KEY = "conversationKey";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long start = System.currentTimeMillis();

        String incomingTraceId = request.getHeader(TRACE_ID_HEADER);
        String traceId = StringUtils.hasText(incomingTraceId) ? incomingTraceId : generateTraceId();
        MDC.put(TRACE_ID_KEY, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        try {
            // 不记录 Body，避免日志过大
            log.info("HTTP 请求开始: traceId={}, method={}, uri={}, remoteIp={}",
                    traceId, request.getMethod(), request.getRequestURI(), request.getRemoteAddr());

            filterChain.doFilter(request, response);
        } finally {
            long duration = System.currentTimeMillis() - start;
            String conversationKey = MDC.get(CONVERSATION_KEY);
            log.info("HTTP 请求结束: traceId={}, conversationKey={}, method={}, uri={}, status={}, durationMs={}",
                    traceId, conversationKey, request.getMethod(), request.getRequestURI(),
                    response.getStatus(), duration);

            // 线程复用，必须清理
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(CONVERSATION_KEY);
        }
    }

    private String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
