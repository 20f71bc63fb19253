package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.entity.DailyAnalytics;
import com.premiergroup.ad_delivery_engine.entity.DeliveryEvent;
import com.premiergroup.ad_delivery_engine.util.Ratios;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Folds one day of delivery events into a rollup. Orphaned events are skipped so rollups reconcile with the
 * advertisement counters. The result depends only on the event set, never on its order.
 */
public final class DailyAnalyticsCalculator {

    private DailyAnalyticsCalculator() {
    }

    public static DailyAnalytics compute(UUID advertisementId, LocalDate date, Collection<DeliveryEvent> events) {
        long impressions = 0;
        long clicks = 0;
        long conversions = 0;
        long spentMicros = 0;
        Map<String, Long> devices = new TreeMap<>();
        Map<String, Long> countries = new TreeMap<>();

        for (DeliveryEvent event : events) {
            if (event.isOrphaned()) {
                continue;
            }
            switch (event.getEventType()) {
                case IMPRESSION -> impressions++;
                case CLICK -> clicks++;
                case CONVERSION -> conversions++;
                default -> {
                }
            }
            spentMicros += event.getCostMicros();
            devices.merge(DeliveryBreakdownClassifier.deviceClass(event.getMetadata()), 1L, Long::sum);
            countries.merge(DeliveryBreakdownClassifier.country(event.getMetadata()), 1L, Long::sum);
        }

        return DailyAnalytics.builder()
                .advertisementId(advertisementId)
                .statsDate(date)
                .impressions(impressions)
                .clicks(clicks)
                .conversions(conversions)
                .amountSpentMicros(spentMicros)
                .ctr(Ratios.percent(clicks, impressions))
                .cpc(Ratios.costPer(spentMicros, clicks))
                .cpa(Ratios.costPer(spentMicros, conversions))
                .demographicBreakdown(devices)
                .geographicBreakdown(countries)
                .build();
    }

    /**
     * Overwrites every derived column of {@code target} with {@code computed}, keeping its identity.
     */
    public static void copyMetrics(DailyAnalytics computed, DailyAnalytics target) {
        target.setImpressions(computed.getImpressions());
        target.setClicks(computed.getClicks());
        target.setConversions(computed.getConversions());
        target.setAmountSpentMicros(computed.getAmountSpentMicros());
        target.setCtr(computed.getCtr());
        target.setCpc(computed.getCpc());
        target.setCpa(computed.getCpa());
        target.setDemographicBreakdown(computed.getDemographicBreakdown());
        target.setGeographicBreakdown(computed.getGeographicBreakdown());
    }
}
