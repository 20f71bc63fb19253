package com.premiergroup.ad_delivery_engine.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Campaign totals recomputed from member advertisements. Goal progress is uncapped; a {@code null}
 * progress means the campaign sets no goal for that metric.
 */
@Builder
public record CampaignPerformance(
        UUID campaignId,
        String campaignName,
        boolean active,
        int totalAdvertisements,
        long impressions,
        long clicks,
        long conversions,
        BigDecimal totalSpent,
        BigDecimal totalBudget,
        BigDecimal budgetRemaining,
        BigDecimal ctr,
        BigDecimal conversionRate,
        GoalProgress goalsProgress
) {

    public record GoalProgress(
            BigDecimal impressions,
            BigDecimal clicks,
            BigDecimal conversions,
            BigDecimal ctr
    ) {
    }
}
