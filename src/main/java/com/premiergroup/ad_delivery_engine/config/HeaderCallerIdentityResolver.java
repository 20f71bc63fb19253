package com.premiergroup.ad_delivery_engine.config;

import com.premiergroup.ad_delivery_engine.dto.Caller;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Reads the identity the gateway forwards after authenticating the caller.
 */
@Component
public class HeaderCallerIdentityResolver implements CallerIdentityResolver {

    public static final String CALLER_ID_HEADER = "X-Caller-Id";
    public static final String CALLER_STAFF_HEADER = "X-Caller-Staff";

    @Override
    public Caller resolve(HttpServletRequest request) {
        String id = request.getHeader(CALLER_ID_HEADER);
        if (id == null || id.isBlank()) {
            return Caller.anonymous();
        }
        boolean staff = Boolean.parseBoolean(request.getHeader(CALLER_STAFF_HEADER));
        return new Caller(id.trim(), staff);
    }
}
