package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.enums.MetricFilter;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * One metric per advertisement aligned to shared period labels, plus the cost of one unit of that metric.
 */
public record AdvertisementTrendGraph(
        MetricFilter metric,
        List<String> labels,
        Map<String, List<Long>> advertisementValues,
        Map<String, BigDecimal> costPerMetric
) {
}
