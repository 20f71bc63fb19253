package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.enums.ErrorType;

import java.util.UUID;

public record BulkItemResult(
        UUID advertisementId,
        boolean success,
        ErrorType error,
        String message
) {

    public static BulkItemResult ok(UUID advertisementId) {
        return new BulkItemResult(advertisementId, true, null, null);
    }

    public static BulkItemResult failed(UUID advertisementId, ErrorType error, String message) {
        return new BulkItemResult(advertisementId, false, error, message);
    }
}
