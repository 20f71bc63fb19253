package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.enums.OrphanReason;

import java.math.BigDecimal;
import java.util.UUID;

public record RecordedEvent(
        UUID eventId,
        boolean orphaned,
        OrphanReason orphanReason,
        BigDecimal cost
) {
}
