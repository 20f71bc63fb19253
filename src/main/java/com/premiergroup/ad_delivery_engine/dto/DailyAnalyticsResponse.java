package com.premiergroup.ad_delivery_engine.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

public record DailyAnalyticsResponse(
        UUID advertisementId,
        LocalDate date,
        long impressions,
        long clicks,
        long conversions,
        BigDecimal amountSpent,
        BigDecimal ctr,
        BigDecimal cpc,
        BigDecimal cpa,
        Map<String, Long> demographicBreakdown,
        Map<String, Long> geographicBreakdown
) {
}
