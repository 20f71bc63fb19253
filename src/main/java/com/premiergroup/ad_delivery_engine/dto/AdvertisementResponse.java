package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.entity.CreativeAssets;
import com.premiergroup.ad_delivery_engine.entity.Targeting;
import com.premiergroup.ad_delivery_engine.enums.AdType;
import com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus;
import com.premiergroup.ad_delivery_engine.enums.PricingModel;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Builder
public record AdvertisementResponse(
        UUID id,
        String advertiserId,
        String title,
        String description,
        AdType adType,
        UUID campaignId,
        Targeting targeting,
        CreativeAssets creative,
        BigDecimal budget,
        BigDecimal dailyBudget,
        BigDecimal bidAmount,
        PricingModel pricingModel,
        String currency,
        Instant scheduleStart,
        Instant scheduleEnd,
        AdvertisementStatus status,
        AdvertisementStatus effectiveStatus,
        boolean active,
        String approvedBy,
        Instant approvedAt,
        String approvalNotes,
        String rejectionReason,
        long impressions,
        long clicks,
        long conversions,
        BigDecimal amountSpent,
        BigDecimal clickThroughRate,
        BigDecimal conversionRate,
        BigDecimal costPerClick,
        BigDecimal costPerAcquisition,
        Instant createdAt,
        Instant updatedAt
) {
}
