package com.premiergroup.ad_delivery_engine.dto;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

/**
 * One trend widget series: a value per period label, the window total and its change against the
 * previous window in percent.
 */
public record MetricStats<T extends Number>(
        List<String> labels,
        List<T> values,
        T total,
        BigDecimal percentChange
) {

    public static <T extends Number> MetricStats<T> of(SortedMap<String, T> series, T total, BigDecimal percentChange) {
        return new MetricStats<>(new ArrayList<>(series.keySet()), new ArrayList<>(series.values()), total, percentChange);
    }
}
