package com.premiergroup.ad_delivery_engine.exception;

import com.premiergroup.ad_delivery_engine.enums.ErrorType;

public class ValidationException extends AdEngineException {

    public ValidationException(String message) {
        super(ErrorType.VALIDATION_ERROR, message);
    }
}
