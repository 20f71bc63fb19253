package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.exception.AdEngineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Component
@Log4j2
@RequiredArgsConstructor
public class AnalyticsRollupScheduler {

    private final AnalyticsAggregationService aggregationService;
    private final Clock clock;
    private final ZoneId analyticsZone;

    /**
     * Refreshes yesterday's and today's rollups of every advertisement that logged events in those days.
     * Runs at minute 15 of every hour unless configured otherwise.
     */
    @Scheduled(cron = "${ad-engine.analytics.rollup-cron:0 15 * * * *}")
    public void rollUpRecentDays() {
        LocalDate today = LocalDate.ofInstant(clock.instant(), analyticsZone);
        LocalDate yesterday = today.minusDays(1);
        Set<UUID> advertisementIds = aggregationService.advertisementsWithEvents(yesterday, today);

        log.info("Starting scheduled analytics rollup for {} advertisement(s)", advertisementIds.size());
        int failures = 0;
        for (UUID advertisementId : advertisementIds) {
            for (LocalDate day : List.of(yesterday, today)) {
                try {
                    aggregationService.aggregate(advertisementId, day);
                } catch (AdEngineException | DataAccessException e) {
                    failures++;
                    log.error("Scheduled rollup failed for advertisement {} on {}", advertisementId, day, e);
                }
            }
        }
        log.info("Completed scheduled analytics rollup, {} window(s) failed", failures);
    }
}
