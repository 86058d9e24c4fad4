package com.nutrisnap.backend.auth.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.server.ResponseStatusException;

/**
 * Acting user id as placed on the request by the identity provider in front of us.
 * 1) request attribute "userId"（gateway / filter 放的）
 * 2) header X-User-Id
 */
@Component
public class AuthContext {

    public static final String ATTR = "userId";
    public static final String HEADER = "X-User-Id";

    public Long requireUserId() {
        var attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs != null) {
            HttpServletRequest req = attrs.getRequest();

            Long fromAttr = parse(req.getAttribute(ATTR));
            if (fromAttr != null) return fromAttr;

            Long fromHeader = parse(req.getHeader(HEADER));
            if (fromHeader != null) return fromHeader;
        }
        throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED");
    }

    private static Long parse(Object v) {
        if (v instanceof Long l) return l > 0 ? l : null;
        if (v instanceof String s && !s.isBlank()) {
            try {
                long id = Long.parseLong(s.trim());
                return id > 0 ? id : null;
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }
}
