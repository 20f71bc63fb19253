package com.premiergroup.ad_delivery_engine.exception;

import com.premiergroup.ad_delivery_engine.enums.ErrorType;
import lombok.Getter;

/**
 * Base of every error this engine surfaces to callers. Each subtype carries its {@link ErrorType}
 * and a human-readable reason.
 */
@Getter
public abstract class AdEngineException extends RuntimeException {

    private final ErrorType errorType;

    protected AdEngineException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected AdEngineException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }
}
