package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.enums.ErrorType;

import java.time.Instant;

public record ApiError(
        ErrorType error,
        String message,
        Instant timestamp
) {
}
