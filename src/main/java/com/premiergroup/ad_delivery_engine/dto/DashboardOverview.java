package com.premiergroup.ad_delivery_engine.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Builder
public record DashboardOverview(
        Counts overview,
        Performance performanceMetrics,
        RecentActivity recentActivity,
        List<TopAd> topAdsByCtr,
        List<TopAd> topAdsByConversions,
        List<LocationPerformance> placementPerformance,
        List<CampaignPerformance> campaignPerformance,
        BudgetAnalysis budgetAnalysis,
        Instant generatedAt
) {

    public record Counts(
            long totalAdvertisements,
            long activeAdvertisements,
            long pausedAdvertisements,
            long totalCampaigns,
            long activeCampaigns
    ) {
    }

    public record Performance(
            long totalImpressions,
            long totalClicks,
            long totalConversions,
            BigDecimal totalSpent,
            BigDecimal overallCtr,
            BigDecimal overallConversionRate,
            BigDecimal averageCpc,
            BigDecimal roiPercentage
    ) {
    }

    public record RecentActivity(long impressions, long clicks, long conversions) {
    }

    public record TopAd(
            UUID id,
            String title,
            long impressions,
            long clicks,
            long conversions,
            BigDecimal ctr,
            BigDecimal conversionRate
    ) {
    }

    public record LocationPerformance(String location, long impressions, long clicks, BigDecimal ctr) {
    }

    public record BudgetAnalysis(
            BigDecimal totalBudget,
            BigDecimal totalSpent,
            BigDecimal utilizationPercentage,
            BigDecimal remainingBudget
    ) {
    }
}
