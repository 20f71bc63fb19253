package com.premiergroup.ad_delivery_engine.enums;

public enum AdvertisementStatus {
    DRAFT,
    PENDING_APPROVAL,
    ACTIVE,
    PAUSED,
    COMPLETED,
    REJECTED,
    // derived only, never persisted
    EXPIRED;

    public boolean isTerminal() {
        return this == COMPLETED || this == REJECTED;
    }
}
