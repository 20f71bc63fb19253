package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.AdvertisementPerformance;
import com.premiergroup.ad_delivery_engine.dto.AdvertisementTrendGraph;
import com.premiergroup.ad_delivery_engine.dto.CampaignPerformance;
import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.DailyAnalyticsResponse;
import com.premiergroup.ad_delivery_engine.dto.DashboardOverview;
import com.premiergroup.ad_delivery_engine.dto.DeliveryTrendStats;
import com.premiergroup.ad_delivery_engine.dto.MarketInsights;
import com.premiergroup.ad_delivery_engine.dto.MetricStats;
import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.entity.Campaign;
import com.premiergroup.ad_delivery_engine.entity.DailyAnalytics;
import com.premiergroup.ad_delivery_engine.enums.AdType;
import com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus;
import com.premiergroup.ad_delivery_engine.enums.DateFilter;
import com.premiergroup.ad_delivery_engine.enums.EventType;
import com.premiergroup.ad_delivery_engine.enums.MetricFilter;
import com.premiergroup.ad_delivery_engine.exception.ValidationException;
import com.premiergroup.ad_delivery_engine.repository.AdvertisementRepository;
import com.premiergroup.ad_delivery_engine.repository.CampaignRepository;
import com.premiergroup.ad_delivery_engine.repository.DailyAnalyticsRepository;
import com.premiergroup.ad_delivery_engine.repository.DeliveryEventRepository;
import com.premiergroup.ad_delivery_engine.util.Micros;
import com.premiergroup.ad_delivery_engine.util.Ratios;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.ToLongFunction;
import java.util.stream.Collectors;

import static java.time.temporal.ChronoUnit.DAYS;

/**
 * Reporting over advertisements, their counters, the delivery log and the daily rollups. Staff see
 * every advertisement and campaign, everyone else only their own.
 */
@Service
@Log4j2
public class ReportingService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int CAMPAIGNS_ON_DASHBOARD = 10;
    private static final int LOCATIONS_ON_DASHBOARD = 10;

    private final AdvertisementRepository advertisementRepository;
    private final CampaignRepository campaignRepository;
    private final DeliveryEventRepository eventRepository;
    private final DailyAnalyticsRepository analyticsRepository;
    private final AnalyticsAggregationService aggregationService;
    private final CampaignRollupService campaignRollupService;
    private final RecommendationStrategy recommendationStrategy;
    private final AccessPolicy accessPolicy;
    private final Clock clock;
    private final ZoneId analyticsZone;
    private final BigDecimal valuePerConversion;
    private final int topN;
    private final long minImpressionsForCtrRank;
    private final int maxRangeDays;

    public ReportingService(AdvertisementRepository advertisementRepository,
                            CampaignRepository campaignRepository,
                            DeliveryEventRepository eventRepository,
                            DailyAnalyticsRepository analyticsRepository,
                            AnalyticsAggregationService aggregationService,
                            CampaignRollupService campaignRollupService,
                            RecommendationStrategy recommendationStrategy,
                            AccessPolicy accessPolicy,
                            Clock clock,
                            ZoneId analyticsZone,
                            @Value("${ad-engine.reporting.value-per-conversion:50.00}") BigDecimal valuePerConversion,
                            @Value("${ad-engine.reporting.top-n:5}") int topN,
                            @Value("${ad-engine.reporting.min-impressions-for-ctr-rank:100}") long minImpressionsForCtrRank,
                            @Value("${ad-engine.analytics.max-range-days:366}") int maxRangeDays) {
        this.advertisementRepository = advertisementRepository;
        this.campaignRepository = campaignRepository;
        this.eventRepository = eventRepository;
        this.analyticsRepository = analyticsRepository;
        this.aggregationService = aggregationService;
        this.campaignRollupService = campaignRollupService;
        this.recommendationStrategy = recommendationStrategy;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
        this.analyticsZone = analyticsZone;
        this.valuePerConversion = valuePerConversion;
        this.topN = topN;
        this.minImpressionsForCtrRank = minImpressionsForCtrRank;
        this.maxRangeDays = maxRangeDays;
    }

    @Transactional(readOnly = true)
    public DashboardOverview overview(Caller caller, BigDecimal valuePerConversionOverride) {
        accessPolicy.requireIdentified(caller);
        BigDecimal conversionValue = resolveValuePerConversion(valuePerConversionOverride);
        Instant now = clock.instant();
        List<Advertisement> ads = scopedAdvertisements(caller);
        List<Campaign> campaigns = caller.staff()
                ? campaignRepository.findAllByOrderByCreatedAtDesc()
                : campaignRepository.findByManagerIdOrderByCreatedAtDesc(caller.id());
        List<UUID> adIds = ads.stream().map(Advertisement::getId).toList();

        // 1) counts
        DashboardOverview.Counts counts = new DashboardOverview.Counts(
                ads.size(),
                ads.stream().filter(ad -> AdvertisementLifecycle.isActive(ad, now)).count(),
                ads.stream().filter(ad -> ad.getStatus() == AdvertisementStatus.PAUSED).count(),
                campaigns.size(),
                campaigns.stream().filter(c -> c.isRunning(now)).count()
        );

        // 2) totals and KPIs from counters
        long impressions = sum(ads, Advertisement::getImpressions);
        long clicks = sum(ads, Advertisement::getClicks);
        long conversions = sum(ads, Advertisement::getConversions);
        long spentMicros = sum(ads, Advertisement::getAmountSpentMicros);
        DashboardOverview.Performance performance = new DashboardOverview.Performance(
                impressions,
                clicks,
                conversions,
                Micros.toUnits(spentMicros),
                Ratios.percent(clicks, impressions),
                Ratios.percent(conversions, clicks),
                Ratios.costPer(spentMicros, clicks),
                Ratios.roi(conversions, spentMicros, conversionValue)
        );

        // 3) last seven days from the delivery log
        Map<EventType, Long> recent = new EnumMap<>(EventType.class);
        if (!adIds.isEmpty()) {
            for (Object[] row : eventRepository.countByTypeSince(adIds, now.minus(7, DAYS))) {
                recent.put((EventType) row[0], (Long) row[1]);
            }
        }
        DashboardOverview.RecentActivity recentActivity = new DashboardOverview.RecentActivity(
                recent.getOrDefault(EventType.IMPRESSION, 0L),
                recent.getOrDefault(EventType.CLICK, 0L),
                recent.getOrDefault(EventType.CONVERSION, 0L)
        );

        // 4) top performers
        List<DashboardOverview.TopAd> topByCtr = ads.stream()
                .filter(ad -> ad.getImpressions() >= minImpressionsForCtrRank)
                .sorted(Comparator.comparing(
                                (Advertisement ad) -> Ratios.percent(ad.getClicks(), ad.getImpressions()))
                        .reversed()
                        .thenComparing(Advertisement::getCreatedAt))
                .limit(topN)
                .map(ReportingService::toTopAd)
                .toList();
        List<DashboardOverview.TopAd> topByConversions = ads.stream()
                .filter(ad -> ad.getConversions() > 0)
                .sorted(Comparator.comparingLong(Advertisement::getConversions)
                        .reversed()
                        .thenComparing(Advertisement::getCreatedAt))
                .limit(topN)
                .map(ReportingService::toTopAd)
                .toList();

        // 5) placement locations
        List<DashboardOverview.LocationPerformance> locations = adIds.isEmpty()
                ? List.of()
                : locationPerformance(eventRepository.countByPlacementLocation(adIds));

        // 6) running campaigns, goal progress capped for display
        List<CampaignPerformance> campaignPerformance = campaigns.stream()
                .filter(c -> c.isRunning(now))
                .limit(CAMPAIGNS_ON_DASHBOARD)
                .map(c -> capGoals(campaignRollupService.summarize(
                        c, advertisementRepository.findByCampaign_Id(c.getId()), now)))
                .toList();

        // 7) budget utilisation across campaigns, counting only the spend of their member advertisements
        Set<UUID> campaignIds = campaigns.stream().map(Campaign::getId).collect(Collectors.toSet());
        long totalBudgetMicros = campaigns.stream().mapToLong(Campaign::getTotalBudgetMicros).sum();
        long campaignSpentMicros = ads.stream()
                .filter(ad -> ad.getCampaign() != null && campaignIds.contains(ad.getCampaign().getId()))
                .mapToLong(Advertisement::getAmountSpentMicros)
                .sum();
        DashboardOverview.BudgetAnalysis budget = new DashboardOverview.BudgetAnalysis(
                Micros.toUnits(totalBudgetMicros),
                Micros.toUnits(campaignSpentMicros),
                Ratios.percent(campaignSpentMicros, totalBudgetMicros),
                Micros.toUnits(Math.max(0L, totalBudgetMicros - campaignSpentMicros))
        );

        return DashboardOverview.builder()
                .overview(counts)
                .performanceMetrics(performance)
                .recentActivity(recentActivity)
                .topAdsByCtr(topByCtr)
                .topAdsByConversions(topByConversions)
                .placementPerformance(locations)
                .campaignPerformance(campaignPerformance)
                .budgetAnalysis(budget)
                .generatedAt(now)
                .build();
    }

    /**
     * Date-ranged performance of one advertisement, defaulting to the last 30 days. Rollups are refreshed
     * through the aggregator before they are summed.
     */
    public AdvertisementPerformance advertisementPerformance(Caller caller,
                                                             UUID advertisementId,
                                                             LocalDate from,
                                                             LocalDate to,
                                                             BigDecimal valuePerConversionOverride) {
        BigDecimal conversionValue = resolveValuePerConversion(valuePerConversionOverride);
        LocalDate today = LocalDate.ofInstant(clock.instant(), analyticsZone);
        LocalDate end = to == null ? today : to;
        LocalDate start = from == null ? end.minusDays(30) : from;
        List<DailyAnalyticsResponse> daily = aggregationService.getAnalytics(caller, advertisementId, start, end);

        long impressions = daily.stream().mapToLong(DailyAnalyticsResponse::impressions).sum();
        long clicks = daily.stream().mapToLong(DailyAnalyticsResponse::clicks).sum();
        long conversions = daily.stream().mapToLong(DailyAnalyticsResponse::conversions).sum();
        long spentMicros = daily.stream().mapToLong(d -> Micros.fromUnits(d.amountSpent())).sum();

        Map<String, Long> geographic = new TreeMap<>();
        Map<String, Long> devices = new TreeMap<>();
        for (DailyAnalyticsResponse day : daily) {
            if (day.geographicBreakdown() != null) {
                day.geographicBreakdown().forEach((k, v) -> geographic.merge(k, v, Long::sum));
            }
            if (day.demographicBreakdown() != null) {
                day.demographicBreakdown().forEach((k, v) -> devices.merge(k, v, Long::sum));
            }
        }

        BigDecimal ctr = Ratios.percent(clicks, impressions);
        BigDecimal cpc = Ratios.costPer(spentMicros, clicks);
        BigDecimal conversionRate = Ratios.percent(conversions, clicks);
        List<String> recommendations = recommendationStrategy.recommend(
                new RecommendationStrategy.PerformanceSnapshot(ctr, cpc, impressions, conversionRate));

        return AdvertisementPerformance.builder()
                .advertisementId(advertisementId)
                .from(start)
                .to(end)
                .dailyMetrics(daily)
                .totalImpressions(impressions)
                .totalClicks(clicks)
                .totalConversions(conversions)
                .totalCost(Micros.toUnits(spentMicros))
                .ctr(ctr)
                .conversionRate(conversionRate)
                .cpc(cpc)
                .cpa(Ratios.costPer(spentMicros, conversions))
                .roi(Ratios.roi(conversions, spentMicros, conversionValue))
                .geographicBreakdown(geographic)
                .deviceBreakdown(devices)
                .optimizationRecommendations(recommendations)
                .build();
    }

    /**
     * Delivery totals over a {@link DateFilter} window with percent change against the preceding window.
     * Series are bucketed by day, or by month for year-long windows. Both windows are refreshed through the
     * aggregator first, so today and days the scheduled rollup missed are included.
     */
    public DeliveryTrendStats trends(Caller caller, DateFilter dateRange, String startDate, String endDate) {
        accessPolicy.requireIdentified(caller);
        Window window = resolveWindow(dateRange, startDate, endDate);
        Window previous = window.previous(dateRange.isMonthlyGrouped());
        List<UUID> adIds = scopedAdvertisements(caller).stream().map(Advertisement::getId).toList();
        aggregationService.refresh(adIds, previous.start(), previous.end());
        aggregationService.refresh(adIds, window.start(), window.end());

        // 1) fetch rollups in window and bucket them
        List<DailyAnalytics> current = rollups(adIds, window.start(), window.end());
        SortedMap<String, Long> imprByPeriod = new TreeMap<>();
        SortedMap<String, Long> clicksByPeriod = new TreeMap<>();
        SortedMap<String, Long> convByPeriod = new TreeMap<>();
        SortedMap<String, Long> costByPeriod = new TreeMap<>();
        for (DailyAnalytics row : current) {
            String period = window.label(row.getStatsDate());
            imprByPeriod.merge(period, row.getImpressions(), Long::sum);
            clicksByPeriod.merge(period, row.getClicks(), Long::sum);
            convByPeriod.merge(period, row.getConversions(), Long::sum);
            costByPeriod.merge(period, row.getAmountSpentMicros(), Long::sum);
        }

        long totalImpr = total(imprByPeriod);
        long totalClicks = total(clicksByPeriod);
        long totalConv = total(convByPeriod);
        long totalCost = total(costByPeriod);

        // 2) previous window totals
        List<DailyAnalytics> prevRows = rollups(adIds, previous.start(), previous.end());
        long prevImpr = prevRows.stream().mapToLong(DailyAnalytics::getImpressions).sum();
        long prevClicks = prevRows.stream().mapToLong(DailyAnalytics::getClicks).sum();
        long prevConv = prevRows.stream().mapToLong(DailyAnalytics::getConversions).sum();
        long prevCost = prevRows.stream().mapToLong(DailyAnalytics::getAmountSpentMicros).sum();

        // 3) cost per conversion and conversion rate per bucket
        SortedMap<String, BigDecimal> costPerConvByPeriod = new TreeMap<>();
        costByPeriod.forEach((period, cost) ->
                costPerConvByPeriod.put(period, Ratios.costPer(cost, convByPeriod.getOrDefault(period, 0L))));
        SortedMap<String, BigDecimal> convRateByPeriod = new TreeMap<>();
        clicksByPeriod.forEach((period, periodClicks) -> {
            if (periodClicks > 0) {
                convRateByPeriod.put(period, Ratios.percent(convByPeriod.getOrDefault(period, 0L), periodClicks));
            }
        });
        SortedMap<String, BigDecimal> costUnitsByPeriod = new TreeMap<>();
        costByPeriod.forEach((period, cost) -> costUnitsByPeriod.put(period, Micros.toUnits(cost)));

        return new DeliveryTrendStats(
                window.start(),
                window.end(),
                buildLongStats(imprByPeriod, totalImpr, prevImpr),
                buildLongStats(clicksByPeriod, totalClicks, prevClicks),
                buildLongStats(convByPeriod, totalConv, prevConv),
                buildDecStats(costUnitsByPeriod, Micros.toUnits(totalCost), Micros.toUnits(prevCost)),
                buildDecStats(costPerConvByPeriod,
                        Ratios.costPer(totalCost, totalConv), Ratios.costPer(prevCost, prevConv)),
                buildDecStats(convRateByPeriod,
                        Ratios.percent(totalConv, totalClicks), Ratios.percent(prevConv, prevClicks))
        );
    }

    /**
     * One metric per advertisement over a {@link DateFilter} window, aligned to common period labels. Rollups are
     * refreshed first, as for {@link #trends}.
     */
    public AdvertisementTrendGraph trendGraph(Caller caller,
                                              DateFilter dateRange,
                                              String startDate,
                                              String endDate,
                                              MetricFilter metric) {
        accessPolicy.requireIdentified(caller);
        Window window = resolveWindow(dateRange, startDate, endDate);
        List<UUID> adIds = scopedAdvertisements(caller).stream().map(Advertisement::getId).toList();
        aggregationService.refresh(adIds, window.start(), window.end());
        List<DailyAnalytics> rows = rollups(adIds, window.start(), window.end());

        // 1) shared labels
        List<String> labels = rows.stream()
                .map(row -> window.label(row.getStatsDate()))
                .distinct()
                .sorted()
                .toList();

        // 2) group by advertisement and period
        Map<UUID, Map<String, List<DailyAnalytics>>> grouped = rows.stream()
                .collect(Collectors.groupingBy(
                        DailyAnalytics::getAdvertisementId,
                        TreeMap::new,
                        Collectors.groupingBy(row -> window.label(row.getStatsDate()))));

        // 3) values aligned to labels, cost per unit of the metric
        Map<String, List<Long>> values = new LinkedHashMap<>();
        Map<String, BigDecimal> costPerMetric = new LinkedHashMap<>();
        grouped.forEach((adId, byPeriod) -> {
            values.put(adId.toString(), labels.stream()
                    .map(label -> byPeriod.getOrDefault(label, List.of()).stream()
                            .mapToLong(row -> metricValue(row, metric))
                            .sum())
                    .toList());

            List<DailyAnalytics> all = byPeriod.values().stream().flatMap(List::stream).toList();
            long totalMetric = all.stream().mapToLong(row -> metricValue(row, metric)).sum();
            long totalCost = all.stream().mapToLong(DailyAnalytics::getAmountSpentMicros).sum();
            costPerMetric.put(adId.toString(), Ratios.costPer(totalCost, totalMetric));
        });

        return new AdvertisementTrendGraph(metric, labels, values, costPerMetric);
    }

    /**
     * Average CTR and CPC of the last 30 days against the 30 days before, and per ad type performance.
     */
    public MarketInsights marketInsights(Caller caller) {
        accessPolicy.requireIdentified(caller);
        LocalDate today = LocalDate.ofInstant(clock.instant(), analyticsZone);
        List<Advertisement> ads = scopedAdvertisements(caller);
        List<UUID> adIds = ads.stream().map(Advertisement::getId).toList();

        aggregationService.refresh(adIds, today.minusDays(60), today);
        List<DailyAnalytics> recent = rollups(adIds, today.minusDays(30), today);
        List<DailyAnalytics> previous = rollups(adIds, today.minusDays(60), today.minusDays(31));

        Map<AdType, List<Advertisement>> byType = ads.stream()
                .collect(Collectors.groupingBy(Advertisement::getAdType, () -> new EnumMap<>(AdType.class),
                        Collectors.toList()));
        List<MarketInsights.AdTypePerformance> adTypes = byType.entrySet().stream()
                .map(e -> new MarketInsights.AdTypePerformance(
                        e.getKey(),
                        e.getValue().size(),
                        average(e.getValue().stream()
                                .filter(ad -> ad.getImpressions() > 0)
                                .map(ad -> Ratios.percent(ad.getClicks(), ad.getImpressions()))
                                .toList()),
                        Micros.toUnits(sum(e.getValue(), Advertisement::getAmountSpentMicros))))
                .sorted(Comparator.comparingLong(MarketInsights.AdTypePerformance::count).reversed()
                        .thenComparing(MarketInsights.AdTypePerformance::adType))
                .toList();

        return new MarketInsights(
                average(recent.stream().map(DailyAnalytics::getCtr).toList()),
                average(previous.stream().map(DailyAnalytics::getCtr).toList()),
                average(recent.stream().map(DailyAnalytics::getCpc).toList()),
                average(previous.stream().map(DailyAnalytics::getCpc).toList()),
                adTypes
        );
    }

    // helpers

    private List<Advertisement> scopedAdvertisements(Caller caller) {
        return caller.staff()
                ? advertisementRepository.findAll()
                : advertisementRepository.findByAdvertiserId(caller.id());
    }

    private List<DailyAnalytics> rollups(Collection<UUID> adIds, LocalDate start, LocalDate end) {
        if (adIds.isEmpty()) {
            return List.of();
        }
        return analyticsRepository.findByAdvertisementIdInAndStatsDateBetween(adIds, start, end);
    }

    private BigDecimal resolveValuePerConversion(BigDecimal override) {
        if (override == null) {
            return valuePerConversion;
        }
        if (override.signum() < 0) {
            throw new ValidationException("Value per conversion cannot be negative");
        }
        return override;
    }

    private Window resolveWindow(DateFilter dateRange, String startDate, String endDate) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), analyticsZone);
        if (dateRange != DateFilter.CUSTOM) {
            return new Window(dateRange.getStartDate(today), dateRange.getEndDate(today), dateRange.isMonthlyGrouped());
        }

        if (startDate == null || endDate == null) {
            throw new ValidationException("Custom date range requires both startDate and endDate");
        }
        LocalDate start;
        LocalDate end;
        try {
            start = LocalDate.parse(startDate);
            end = LocalDate.parse(endDate);
        } catch (DateTimeParseException e) {
            log.error("Invalid date format for custom date range: {} to {}", startDate, endDate, e);
            throw new ValidationException("Invalid date format for custom date range");
        }
        if (end.isBefore(start)) {
            throw new ValidationException("End date must not be before start date");
        }
        if (DAYS.between(start, end) + 1 > maxRangeDays) {
            throw new ValidationException("Date range cannot exceed " + maxRangeDays + " days");
        }
        return new Window(start, end, DAYS.between(start, end) > 60);
    }

    private static long metricValue(DailyAnalytics row, MetricFilter metric) {
        return switch (metric) {
            case IMPRESSIONS -> row.getImpressions();
            case CLICKS -> row.getClicks();
            case CONVERSIONS -> row.getConversions();
        };
    }

    private static List<DashboardOverview.LocationPerformance> locationPerformance(List<Object[]> rows) {
        Map<String, long[]> byLocation = new TreeMap<>();
        for (Object[] row : rows) {
            long[] counts = byLocation.computeIfAbsent(String.valueOf(row[0]), k -> new long[2]);
            EventType type = (EventType) row[1];
            long count = (Long) row[2];
            if (type == EventType.IMPRESSION) {
                counts[0] += count;
            } else if (type == EventType.CLICK) {
                counts[1] += count;
            }
        }
        return byLocation.entrySet().stream()
                .map(e -> new DashboardOverview.LocationPerformance(
                        e.getKey(), e.getValue()[0], e.getValue()[1], Ratios.percent(e.getValue()[1], e.getValue()[0])))
                .sorted(Comparator.comparingLong(DashboardOverview.LocationPerformance::impressions).reversed())
                .limit(LOCATIONS_ON_DASHBOARD)
                .toList();
    }

    private static CampaignPerformance capGoals(CampaignPerformance performance) {
        CampaignPerformance.GoalProgress goals = performance.goalsProgress();
        CampaignPerformance.GoalProgress capped = new CampaignPerformance.GoalProgress(
                capAtHundred(goals.impressions()),
                capAtHundred(goals.clicks()),
                capAtHundred(goals.conversions()),
                capAtHundred(goals.ctr()));
        return CampaignPerformance.builder()
                .campaignId(performance.campaignId())
                .campaignName(performance.campaignName())
                .active(performance.active())
                .totalAdvertisements(performance.totalAdvertisements())
                .impressions(performance.impressions())
                .clicks(performance.clicks())
                .conversions(performance.conversions())
                .totalSpent(performance.totalSpent())
                .totalBudget(performance.totalBudget())
                .budgetRemaining(performance.budgetRemaining())
                .ctr(performance.ctr())
                .conversionRate(performance.conversionRate())
                .goalsProgress(capped)
                .build();
    }

    private static BigDecimal capAtHundred(BigDecimal value) {
        return value == null ? null : Ratios.cap(value, HUNDRED);
    }

    private static DashboardOverview.TopAd toTopAd(Advertisement ad) {
        return new DashboardOverview.TopAd(
                ad.getId(),
                ad.getTitle(),
                ad.getImpressions(),
                ad.getClicks(),
                ad.getConversions(),
                Ratios.percent(ad.getClicks(), ad.getImpressions()),
                Ratios.percent(ad.getConversions(), ad.getClicks()));
    }

    private static long sum(List<Advertisement> ads, ToLongFunction<Advertisement> counter) {
        return ads.stream().mapToLong(counter).sum();
    }

    private static long total(Map<String, Long> series) {
        return series.values().stream().mapToLong(Long::longValue).sum();
    }

    private static BigDecimal average(List<BigDecimal> values) {
        List<BigDecimal> present = values.stream().filter(Objects::nonNull).toList();
        if (present.isEmpty()) {
            return BigDecimal.ZERO.setScale(Ratios.SCALE);
        }
        return present.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(present.size()), Ratios.SCALE, RoundingMode.HALF_UP);
    }

    private static MetricStats<Long> buildLongStats(SortedMap<String, Long> series, long total, long prevTotal) {
        return MetricStats.of(series, total,
                Ratios.percentChange(BigDecimal.valueOf(total), BigDecimal.valueOf(prevTotal)));
    }

    private static MetricStats<BigDecimal> buildDecStats(SortedMap<String, BigDecimal> series,
                                                         BigDecimal total,
                                                         BigDecimal prevTotal) {
        return MetricStats.of(series, total, Ratios.percentChange(total, prevTotal));
    }

    /**
     * A reporting window and its bucketing.
     */
    private record Window(LocalDate start, LocalDate end, boolean monthly) {

        String label(LocalDate date) {
            return monthly ? YearMonth.from(date).toString() : date.toString();
        }

        /**
         * The year before for year-long windows, otherwise the same number of days right before.
         */
        Window previous(boolean yearly) {
            if (yearly) {
                LocalDate prevStart = start.minusYears(1).withDayOfYear(1);
                return new Window(prevStart, prevStart.withDayOfYear(prevStart.lengthOfYear()), monthly);
            }
            long days = DAYS.between(start, end) + 1;
            LocalDate prevEnd = start.minusDays(1);
            return new Window(prevEnd.minusDays(days - 1), prevEnd, monthly);
        }
    }
}
