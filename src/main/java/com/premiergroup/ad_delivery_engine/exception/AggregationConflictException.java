package com.premiergroup.ad_delivery_engine.exception;

import com.premiergroup.ad_delivery_engine.enums.ErrorType;

/**
 * Transient failure while writing a daily rollup. Callers retry by recomputing the whole window.
 */
public class AggregationConflictException extends AdEngineException {

    public AggregationConflictException(String message, Throwable cause) {
        super(ErrorType.AGGREGATION_CONFLICT, message, cause);
    }
}
