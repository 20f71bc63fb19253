package com.premiergroup.ad_delivery_engine.dto;

import lombok.Builder;

import java.util.UUID;

@Builder
public record LedgerReconciliation(
        UUID advertisementId,
        long counterImpressions,
        long loggedImpressions,
        long counterClicks,
        long loggedClicks,
        long counterConversions,
        long loggedConversions,
        long counterSpentMicros,
        long loggedSpentMicros,
        boolean drift,
        boolean repaired
) {
}
