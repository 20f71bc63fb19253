package com.premiergroup.ad_delivery_engine.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Builder
public record AdvertisementPerformance(
        UUID advertisementId,
        LocalDate from,
        LocalDate to,
        List<DailyAnalyticsResponse> dailyMetrics,
        long totalImpressions,
        long totalClicks,
        long totalConversions,
        BigDecimal totalCost,
        BigDecimal ctr,
        BigDecimal conversionRate,
        BigDecimal cpc,
        BigDecimal cpa,
        BigDecimal roi,
        Map<String, Long> geographicBreakdown,
        Map<String, Long> deviceBreakdown,
        List<String> optimizationRecommendations
) {
}
