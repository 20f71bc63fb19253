package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.enums.CampaignType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record CampaignResponse(
        UUID id,
        String name,
        String description,
        CampaignType campaignType,
        String managerId,
        BigDecimal totalBudget,
        Instant scheduleStart,
        Instant scheduleEnd,
        Long targetImpressions,
        Long targetClicks,
        Long targetConversions,
        BigDecimal targetCtr,
        boolean active,
        Instant createdAt
) {
}
