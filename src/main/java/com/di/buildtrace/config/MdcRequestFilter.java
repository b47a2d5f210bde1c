package com.di.buildtrace.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every HTTP request with a correlation id so that the log lines of one report or
 * ingestion call can be pulled out of concurrent traffic.
 *
 * <p>An {@code X-Request-Id} sent by the caller (load balancer, CI runner) is reused when it is
 * a plain token of at most 64 characters; otherwise a {@code req-xxxxxxxx} id is generated. The
 * id is echoed back in the response header.
 *
 * <p>MDC keys: {@code requestId}, {@code requestPath}. {@link com.di.buildtrace.report.ChangeReportService}
 * adds {@code jobId} while a report is built. All keys are scoped to the request thread.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcRequestFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_KEY   = "requestId";
    static final String REQUEST_PATH_KEY = "requestPath";
    static final String HEADER           = "X-Request-Id";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain chain) throws ServletException, IOException {
        String requestId = resolveRequestId(request.getHeader(HEADER));
        response.setHeader(HEADER, requestId);

        try (MDC.MDCCloseable id = MDC.putCloseable(REQUEST_ID_KEY, requestId);
             MDC.MDCCloseable path = MDC.putCloseable(REQUEST_PATH_KEY, String.valueOf(request.getRequestURI()))) {
            chain.doFilter(request, response);
        }
    }

    static String resolveRequestId(String inbound) {
        if (inbound != null && ACCEPTED_ID.matcher(inbound).matches()) {
            return inbound;
        }
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
