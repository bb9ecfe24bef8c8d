package com.phillippitts.genesis.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every operator API call with a correlation id before it reaches the dialogue pipeline.
 *
 * <p>An utterance injected over REST becomes a turn that runs on the dialogue and hardware
 * pools. Those pools copy the context through {@link MdcTaskDecorator}, so the planner and
 * robot log lines of that turn carry the same {@code requestId} (and {@code operator}, when the
 * console identifies itself) next to their own {@code turnId}. The id is echoed back in the
 * response so an operator can grep for it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String OPERATOR_HEADER = "X-Operator-ID";

    static final String REQUEST_ID_KEY = "requestId";
    static final String OPERATOR_KEY = "operator";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = correlationId(http);
                ThreadContext.put(REQUEST_ID_KEY, requestId);
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
                tagOperator(http.getHeader(OPERATOR_HEADER));
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String correlationId(HttpServletRequest http) {
        String supplied = http.getHeader(REQUEST_ID_HEADER);
        return supplied != null && !supplied.isBlank() ? supplied.trim() : UUID.randomUUID().toString();
    }

    // Anonymous calls (scripts, health probes) leave the key unset rather than blank
    private static void tagOperator(String operator) {
        if (operator != null && !operator.isBlank()) {
            ThreadContext.put(OPERATOR_KEY, operator.trim());
        }
    }
}
