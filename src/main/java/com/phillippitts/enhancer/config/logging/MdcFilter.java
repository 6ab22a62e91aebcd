package com.phillippitts.enhancer.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every HTTP call with a {@code requestId} and, when the collaborator layer names its
 * user, a {@code requester} in Log4j2's ThreadContext. Both appear in the log pattern and
 * follow the call onto the enhancement workers.
 *
 * <p>{@link #REQUESTER_HEADER} is also the default requester of an enhancement request whose
 * body names none.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUESTER_HEADER = "X-User-ID";

    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_REQUESTER = "requester";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = http.getHeader(REQUEST_ID_HEADER);
                ThreadContext.put(MDC_REQUEST_ID, isBlank(requestId) ? UUID.randomUUID().toString() : requestId);
                String requester = http.getHeader(REQUESTER_HEADER);
                if (!isBlank(requester)) {
                    ThreadContext.put(MDC_REQUESTER, requester);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }
}
