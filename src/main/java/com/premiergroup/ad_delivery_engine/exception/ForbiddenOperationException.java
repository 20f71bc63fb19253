package com.premiergroup.ad_delivery_engine.exception;

import com.premiergroup.ad_delivery_engine.enums.ErrorType;

public class ForbiddenOperationException extends AdEngineException {

    public ForbiddenOperationException(String message) {
        super(ErrorType.FORBIDDEN, message);
    }
}
