package com.premiergroup.ad_delivery_engine.enums;

import org.springframework.http.HttpStatus;

public enum ErrorType {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    INVALID_STATE(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    BUDGET_EXCEEDED(HttpStatus.CONFLICT),
    AGGREGATION_CONFLICT(HttpStatus.SERVICE_UNAVAILABLE),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    CONFLICT(HttpStatus.CONFLICT),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorType(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
