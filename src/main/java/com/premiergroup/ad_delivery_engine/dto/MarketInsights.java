package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.enums.AdType;

import java.math.BigDecimal;
import java.util.List;

public record MarketInsights(
        BigDecimal recentAverageCtr,
        BigDecimal previousAverageCtr,
        BigDecimal recentAverageCpc,
        BigDecimal previousAverageCpc,
        List<AdTypePerformance> adTypePerformance
) {

    public record AdTypePerformance(AdType adType, long count, BigDecimal averageCtr, BigDecimal totalSpent) {
    }
}
