package com.premiergroup.ad_delivery_engine.dto;

/**
 * Identity of the party making a request, as supplied by the identity service.
 *
 * @param id    advertiser / user id, {@code null} when anonymous
 * @param staff whether the caller may act on other advertisers' data
 */
public record Caller(String id, boolean staff) {

    public static Caller anonymous() {
        return new Caller(null, false);
    }

    public static Caller staff(String id) {
        return new Caller(id, true);
    }

    public static Caller advertiser(String id) {
        return new Caller(id, false);
    }

    public boolean isIdentified() {
        return id != null && !id.isBlank();
    }
}
