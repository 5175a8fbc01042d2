package com.example.bugretention.http;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Echoes or assigns {@code X-Request-Id} and exposes it, with the calling user, to log lines
 * through the MDC.
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        String rid = req.getHeader(REQUEST_ID_HEADER);
        if (rid == null || rid.isBlank()) {
            rid = UUID.randomUUID().toString();
        }
        MDC.put("requestId", rid);
        String userId = req.getHeader(CallerHeaders.USER_ID);
        if (userId != null && !userId.isBlank()) {
            MDC.put("userId", userId);
        }
        res.setHeader(REQUEST_ID_HEADER, rid);
        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove("requestId");
            MDC.remove("userId");
        }
    }
}
