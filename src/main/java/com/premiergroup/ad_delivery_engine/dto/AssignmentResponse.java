package com.premiergroup.ad_delivery_engine.dto;

import java.time.Instant;
import java.util.UUID;

public record AssignmentResponse(
        UUID advertisementId,
        Long placementId,
        String placementName,
        int priority,
        Long maxImpressions,
        Instant assignedAt
) {
}
