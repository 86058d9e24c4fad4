package com.nutrisnap.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation id for one request.
 * <p>
 * A client / gateway supplied {@code X-Request-Id} is reused only when it looks like an id
 * (letters, digits, {@code . _ : -}, at most 128 chars); anything else is replaced, so a
 * header value never lands raw in logs or error bodies.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = resolve(req.getHeader(HEADER));
        req.setAttribute(ATTR, rid);
        res.setHeader(HEADER, rid);

        // async / nested dispatch 可能已經有 rid，結束時還原
        String previous = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, rid);
        try {
            chain.doFilter(req, res);
        } finally {
            if (previous == null) MDC.remove(MDC_KEY);
            else MDC.put(MDC_KEY, previous);
        }
    }

    static String resolve(String inbound) {
        if (inbound != null) {
            String t = inbound.trim();
            if (SAFE_ID.matcher(t).matches()) return t;
        }
        return UUID.randomUUID().toString();
    }

    /**
     * For advice / handlers: the id of this request, minted and remembered when the
     * filter did not run (e.g. standalone MockMvc).
     */
    public static String getOrCreate(HttpServletRequest req) {
        Object v = req.getAttribute(ATTR);
        if (v != null) return String.valueOf(v);
        String rid = UUID.randomUUID().toString();
        req.setAttribute(ATTR, rid);
        return rid;
    }
}
