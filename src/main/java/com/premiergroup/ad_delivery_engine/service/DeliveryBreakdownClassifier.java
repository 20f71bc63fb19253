package com.premiergroup.ad_delivery_engine.service;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Buckets delivery events by audience dimension from their free-form metadata. Anything missing or
 * unreadable lands in {@link #UNKNOWN}.
 */
public final class DeliveryBreakdownClassifier {

    public static final String UNKNOWN = "unknown";
    public static final String COUNTRY_KEY = "country";
    public static final String USER_AGENT_KEY = "user_agent";

    private static final Pattern COUNTRY_CODE = Pattern.compile("[A-Za-z]{2,3}");

    private DeliveryBreakdownClassifier() {
    }

    public static String country(Map<String, String> metadata) {
        String value = value(metadata, COUNTRY_KEY);
        if (value == null || !COUNTRY_CODE.matcher(value).matches()) {
            return UNKNOWN;
        }
        return value.toUpperCase(Locale.ROOT);
    }

    /**
     * Device class from a user-agent style string: {@code mobile}, {@code tablet} or {@code desktop}.
     */
    public static String deviceClass(Map<String, String> metadata) {
        String agent = value(metadata, USER_AGENT_KEY);
        if (agent == null) {
            return UNKNOWN;
        }
        String ua = agent.toLowerCase(Locale.ROOT);
        if (ua.contains("ipad") || ua.contains("tablet") || (ua.contains("android") && !ua.contains("mobile"))) {
            return "tablet";
        }
        if (ua.contains("mobi") || ua.contains("iphone") || ua.contains("android")) {
            return "mobile";
        }
        return "desktop";
    }

    private static String value(Map<String, String> metadata, String key) {
        if (metadata == null) {
            return null;
        }
        String value = metadata.get(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
