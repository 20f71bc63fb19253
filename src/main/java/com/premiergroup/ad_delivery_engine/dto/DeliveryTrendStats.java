package com.premiergroup.ad_delivery_engine.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DeliveryTrendStats(
        LocalDate start,
        LocalDate end,
        MetricStats<Long> impressions,
        MetricStats<Long> clicks,
        MetricStats<Long> conversions,
        MetricStats<BigDecimal> cost,
        MetricStats<BigDecimal> costPerConversion,
        MetricStats<BigDecimal> conversionRate) {
}
