package com.premiergroup.ad_delivery_engine.exception;

import com.premiergroup.ad_delivery_engine.enums.ErrorType;

/**
 * Raised inside the ledger when an advertisement has no budget left to charge. Event recording treats it
 * as a signal to stop serving, not as a failure of the report.
 */
public class BudgetExceededException extends AdEngineException {

    public BudgetExceededException(String message) {
        super(ErrorType.BUDGET_EXCEEDED, message);
    }
}
