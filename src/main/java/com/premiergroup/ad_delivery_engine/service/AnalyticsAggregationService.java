package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.DailyAnalyticsResponse;
import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.entity.DailyAnalytics;
import com.premiergroup.ad_delivery_engine.exception.AggregationConflictException;
import com.premiergroup.ad_delivery_engine.exception.NotFoundException;
import com.premiergroup.ad_delivery_engine.exception.ValidationException;
import com.premiergroup.ad_delivery_engine.repository.AdvertisementRepository;
import com.premiergroup.ad_delivery_engine.repository.DailyAnalyticsRepository;
import com.premiergroup.ad_delivery_engine.repository.DeliveryEventRepository;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static java.time.temporal.ChronoUnit.DAYS;

/**
 * Materializes {@link DailyAnalytics} from the delivery log. Every write recomputes whole days from scratch, so
 * a conflicting writer is handled by running the same recomputation again.
 */
@Service
@Log4j2
public class AnalyticsAggregationService {

    private final DeliveryEventRepository eventRepository;
    private final DailyAnalyticsRepository analyticsRepository;
    private final AdvertisementRepository advertisementRepository;
    private final AccessPolicy accessPolicy;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final ZoneId analyticsZone;
    private final int maxAttempts;
    private final int maxRangeDays;

    public AnalyticsAggregationService(DeliveryEventRepository eventRepository,
                                       DailyAnalyticsRepository analyticsRepository,
                                       AdvertisementRepository advertisementRepository,
                                       AccessPolicy accessPolicy,
                                       PlatformTransactionManager transactionManager,
                                       Clock clock,
                                       ZoneId analyticsZone,
                                       @Value("${ad-engine.analytics.max-attempts:3}") int maxAttempts,
                                       @Value("${ad-engine.analytics.max-range-days:366}") int maxRangeDays) {
        this.eventRepository = eventRepository;
        this.analyticsRepository = analyticsRepository;
        this.advertisementRepository = advertisementRepository;
        this.accessPolicy = accessPolicy;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.analyticsZone = analyticsZone;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.maxRangeDays = maxRangeDays;
    }

    /**
     * Recomputes and upserts the rollup of one advertisement for one day.
     */
    public DailyAnalytics aggregate(UUID advertisementId, LocalDate date) {
        return withRetry("aggregate " + advertisementId + " on " + date,
                () -> transactionTemplate.execute(status -> upsert(advertisementId, date)));
    }

    /**
     * Drops the rollups of an advertisement over {@code [start, end]} and recomputes them in one transaction,
     * so the window is either left untouched or fully replaced.
     */
    public List<DailyAnalyticsResponse> rebuild(Caller caller, UUID advertisementId, LocalDate start, LocalDate end) {
        Advertisement ad = advertisementRepository.findById(advertisementId)
                .orElseThrow(() -> NotFoundException.of("Advertisement", advertisementId));
        accessPolicy.requireOwnerOrStaff(caller, ad.getAdvertiserId());
        checkRange(start, end);

        LocalDate today = LocalDate.ofInstant(clock.instant(), analyticsZone);
        LocalDate last = end.isAfter(today) ? today : end;

        log.info("Rebuilding analytics of advertisement {} from {} to {}", advertisementId, start, last);
        List<DailyAnalytics> rows = withRetry("rebuild " + advertisementId,
                () -> transactionTemplate.execute(status -> replaceWindow(advertisementId, start, last)));
        log.info("Rebuilt {} daily row(s) for advertisement {}", rows.size(), advertisementId);
        return rows.stream().map(DtoMapper::toResponse).toList();
    }

    /**
     * Daily rows over a date range. Days without a stored row and the current day are recomputed first; days
     * before the advertisement existed or after today are never materialized.
     */
    public List<DailyAnalyticsResponse> getAnalytics(Caller caller, UUID advertisementId, LocalDate start, LocalDate end) {
        Advertisement ad = advertisementRepository.findById(advertisementId)
                .orElseThrow(() -> NotFoundException.of("Advertisement", advertisementId));
        accessPolicy.requireOwnerOrStaff(caller, ad.getAdvertiserId());
        checkRange(start, end);

        LocalDate today = LocalDate.ofInstant(clock.instant(), analyticsZone);
        LocalDate first = max(start, LocalDate.ofInstant(ad.getCreatedAt(), analyticsZone));
        LocalDate last = end.isAfter(today) ? today : end;

        Map<LocalDate, DailyAnalytics> stored = analyticsRepository
                .findByAdvertisementIdAndStatsDateBetweenOrderByStatsDateAsc(advertisementId, start, end).stream()
                .collect(Collectors.toMap(DailyAnalytics::getStatsDate, Function.identity()));

        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            if (!stored.containsKey(day) || day.equals(today)) {
                stored.put(day, aggregate(advertisementId, day));
            }
        }

        return stored.values().stream()
                .sorted(Comparator.comparing(DailyAnalytics::getStatsDate))
                .map(DtoMapper::toResponse)
                .toList();
    }

    /**
     * Brings the rollups of {@code advertisementIds} over {@code [start, end]} up to date before a report reads
     * them. Today is always recomputed, earlier days only when they have events but no stored row.
     */
    public void refresh(Collection<UUID> advertisementIds, LocalDate start, LocalDate end) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), analyticsZone);
        LocalDate last = end.isAfter(today) ? today : end;
        if (advertisementIds.isEmpty() || last.isBefore(start)) {
            return;
        }

        Set<AdDay> stored = analyticsRepository.findByAdvertisementIdInAndStatsDateBetween(advertisementIds, start, last)
                .stream()
                .map(row -> new AdDay(row.getAdvertisementId(), row.getStatsDate()))
                .collect(Collectors.toSet());

        int refreshed = 0;
        for (Object[] row : eventRepository.findEventDaysBetween(advertisementIds, start, last)) {
            AdDay day = new AdDay((UUID) row[0], (LocalDate) row[1]);
            if (day.date().equals(today) || !stored.contains(day)) {
                aggregate(day.advertisementId(), day.date());
                refreshed++;
            }
        }
        log.debug("Refreshed {} daily row(s) between {} and {}", refreshed, start, last);
    }

    /**
     * Advertisements with at least one event in {@code [start, end]}.
     */
    public Set<UUID> advertisementsWithEvents(LocalDate start, LocalDate end) {
        return Set.copyOf(eventRepository.findAdvertisementIdsWithEventsBetween(start, end));
    }

    private DailyAnalytics upsert(UUID advertisementId, LocalDate date) {
        DailyAnalytics computed = DailyAnalyticsCalculator.compute(
                advertisementId, date, eventRepository.findByAdvertisementIdAndEventDate(advertisementId, date));
        DailyAnalytics row = analyticsRepository.findByAdvertisementIdAndStatsDate(advertisementId, date)
                .orElseGet(() -> DailyAnalytics.builder()
                        .advertisementId(advertisementId)
                        .statsDate(date)
                        .build());
        DailyAnalyticsCalculator.copyMetrics(computed, row);
        return analyticsRepository.saveAndFlush(row);
    }

    private List<DailyAnalytics> replaceWindow(UUID advertisementId, LocalDate start, LocalDate end) {
        analyticsRepository.deleteWindow(advertisementId, start, end);
        List<DailyAnalytics> rows = new ArrayList<>();
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            rows.add(DailyAnalyticsCalculator.compute(
                    advertisementId, day, eventRepository.findByAdvertisementIdAndEventDate(advertisementId, day)));
        }
        return analyticsRepository.saveAllAndFlush(rows);
    }

    private <T> T withRetry(String what, Supplier<T> work) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return work.get();
            } catch (DataIntegrityViolationException
                     | OptimisticLockingFailureException
                     | PessimisticLockingFailureException e) {
                last = e;
                log.warn("Conflict on attempt {}/{} to {}: {}", attempt, maxAttempts, what, e.getMessage());
            }
        }
        throw new AggregationConflictException("Could not " + what + " after " + maxAttempts + " attempts", last);
    }

    private void checkRange(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new ValidationException("Both start and end dates are required");
        }
        if (end.isBefore(start)) {
            throw new ValidationException("End date must not be before start date");
        }
        if (DAYS.between(start, end) + 1 > maxRangeDays) {
            throw new ValidationException("Date range cannot exceed " + maxRangeDays + " days");
        }
    }

    private static LocalDate max(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }

    private record AdDay(UUID advertisementId, LocalDate date) {
    }
}
