package com.premiergroup.ad_delivery_engine.enums;

public enum MetricFilter {
    IMPRESSIONS,
    CLICKS,
    CONVERSIONS
}
