package com.premiergroup.ad_delivery_engine.service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Produces optimization advice for an advertisement's performance over some period.
 */
public interface RecommendationStrategy {

    List<String> recommend(PerformanceSnapshot snapshot);

    /**
     * @param ctr            click-through rate in percent
     * @param cpc            cost per click in currency units
     * @param impressions    impressions in the period
     * @param conversionRate conversions per click in percent
     */
    record PerformanceSnapshot(BigDecimal ctr, BigDecimal cpc, long impressions, BigDecimal conversionRate) {
    }
}
