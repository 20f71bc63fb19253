package com.premiergroup.ad_delivery_engine.config;

import com.premiergroup.ad_delivery_engine.dto.Caller;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Seam to the identity service: turns an inbound request into a {@link Caller}.
 */
public interface CallerIdentityResolver {

    Caller resolve(HttpServletRequest request);
}
