package com.premiergroup.ad_delivery_engine.enums;

public enum BulkAction {
    APPROVE,
    PAUSE,
    RESUME
}
