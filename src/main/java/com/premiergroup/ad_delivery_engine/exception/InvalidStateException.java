package com.premiergroup.ad_delivery_engine.exception;

import com.premiergroup.ad_delivery_engine.enums.ErrorType;

public class InvalidStateException extends AdEngineException {

    public InvalidStateException(String message) {
        super(ErrorType.INVALID_STATE, message);
    }
}
