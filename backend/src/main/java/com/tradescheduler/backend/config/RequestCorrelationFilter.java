package com.tradescheduler.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts the request id, correlation id and, under {@code /api/jobs/{name}}, the
 * job name into the MDC for the duration of an API call. Trigger fires set the
 * same keys in {@code TradeExecutionJob}, so one log pattern covers both.
 */
@Component
public class RequestCorrelationFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_JOB_NAME = "jobName";

    // Caller ids end up in log lines; anything else is replaced.
    private static final Pattern USABLE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,100}");
    private static final Pattern JOB_PATH = Pattern.compile("^/api/jobs/([^/]+)(?:/.*)?$");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = usableOrNew(request.getHeader(REQUEST_ID_HEADER));
        String correlationHeader = request.getHeader(CORRELATION_ID_HEADER);
        String correlationId = isUsable(correlationHeader) ? correlationHeader : requestId;
        String jobName = jobNameOf(request.getRequestURI().substring(request.getContextPath().length()));

        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put(MDC_CORRELATION_ID, correlationId);
        if (jobName != null) {
            MDC.put(MDC_JOB_NAME, jobName);
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_CORRELATION_ID);
            MDC.remove(MDC_JOB_NAME);
        }
    }

    static String jobNameOf(String path) {
        Matcher matcher = JOB_PATH.matcher(path);
        if (!matcher.matches() || !isUsable(matcher.group(1))) {
            return null;
        }
        return matcher.group(1);
    }

    private static String usableOrNew(String value) {
        return isUsable(value) ? value : UUID.randomUUID().toString();
    }

    private static boolean isUsable(String value) {
        return value != null && USABLE_ID.matcher(value).matches();
    }
}
