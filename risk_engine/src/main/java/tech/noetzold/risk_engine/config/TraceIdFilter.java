package tech.noetzold.risk_engine.config;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a trace id in the MDC for the lifetime of a request and echoes it back in the response.
 */
@Slf4j
@Component
@Order(1)
public class TraceIdFilter implements Filter {

    public static final String TRACE_ID = "trace_id";
    public static final String TRACE_HEADER = "X-Trace-Id";

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) req;
        HttpServletResponse httpResponse = (HttpServletResponse) res;

        String traceId = httpRequest.getHeader(TRACE_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
        }

        long startTime = System.currentTimeMillis();
        MDC.put(TRACE_ID, traceId);
        httpResponse.setHeader(TRACE_HEADER, traceId);
        try {
            chain.doFilter(req, res);
        } finally {
            log.info("{} {} -> {} in {}ms", httpRequest.getMethod(), httpRequest.getRequestURI(),
                    httpResponse.getStatus(), System.currentTimeMillis() - startTime);
            MDC.remove(TRACE_ID);
        }
    }
}
