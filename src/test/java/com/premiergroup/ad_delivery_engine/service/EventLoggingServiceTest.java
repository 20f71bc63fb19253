package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.AssignPlacementRequest;
import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.RecordEventRequest;
import com.premiergroup.ad_delivery_engine.dto.RecordedEvent;
import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.entity.Placement;
import com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus;
import com.premiergroup.ad_delivery_engine.enums.EventType;
import com.premiergroup.ad_delivery_engine.enums.OrphanReason;
import com.premiergroup.ad_delivery_engine.enums.PricingModel;
import com.premiergroup.ad_delivery_engine.exception.NotFoundException;
import com.premiergroup.ad_delivery_engine.repository.AdvertisementRepository;
import com.premiergroup.ad_delivery_engine.repository.DeliveryEventRepository;
import com.premiergroup.ad_delivery_engine.repository.PlacementRepository;
import com.premiergroup.ad_delivery_engine.support.Fixtures;
import com.premiergroup.ad_delivery_engine.support.MutableClock;
import com.premiergroup.ad_delivery_engine.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public class EventLoggingServiceTest {

    private static final Caller STAFF = Caller.staff("staff-1");

    @Autowired
    private EventLoggingService eventLoggingService;
    @Autowired
    private AdvertisementService advertisementService;
    @Autowired
    private EligibilityService eligibilityService;
    @Autowired
    private AdvertisementRepository advertisementRepository;
    @Autowired
    private PlacementRepository placementRepository;
    @Autowired
    private DeliveryEventRepository eventRepository;
    @Autowired
    private MutableClock clock;

    private Instant now;
    private Placement placement;

    @BeforeEach
    public void setUp() {
        clock.setInstant(TestClockConfig.START);
        now = clock.instant();
        placement = placementRepository.save(Fixtures.placement(now).build());
    }

    @Test
    public void recordShouldChargeAndCountAcceptedEvent() {
        // given
        Advertisement ad = advertisementRepository.save(Fixtures.activeAd("adv-1", now).build());
        assign(ad, null);

        // when
        RecordedEvent result = eventLoggingService.record(request(ad.getId(), EventType.CLICK));

        // then
        assertThat(result.orphaned()).isFalse();
        assertThat(result.cost()).isEqualByComparingTo("5");
        Advertisement stored = advertisementRepository.findById(ad.getId()).orElseThrow();
        assertThat(stored.getClicks()).isEqualTo(1);
        assertThat(stored.getAmountSpentMicros()).isEqualTo(5_000_000L);
        assertThat(eventRepository.findByAdvertisementIdOrderByOccurredAtAsc(ad.getId()))
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getCostMicros()).isEqualTo(5_000_000L);
                    assertThat(event.getEventDate()).isEqualTo(LocalDate.of(2025, 3, 10));
                    assertThat(event.getMetadata()).containsEntry("country", "GH");
                });
    }

    @Test
    public void recordShouldCompleteAdvertisementOnceBudgetIsSpent() {
        // given
        Advertisement ad = advertisementRepository.save(Fixtures.activeAd("adv-1", now).build());
        assign(ad, null);

        // when
        List<RecordedEvent> results = new ArrayList<>();
        for (int i = 0; i < 21; i++) {
            results.add(eventLoggingService.record(request(ad.getId(), EventType.CLICK)));
        }

        // then
        assertThat(results.subList(0, 20)).allSatisfy(r -> assertThat(r.orphaned()).isFalse());
        assertThat(results.get(20).orphaned()).isTrue();
        assertThat(results.get(20).orphanReason()).isEqualTo(OrphanReason.NOT_ELIGIBLE);
        assertThat(results.get(20).cost()).isEqualByComparingTo(BigDecimal.ZERO);

        Advertisement stored = advertisementRepository.findById(ad.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(AdvertisementStatus.COMPLETED);
        assertThat(stored.getClicks()).isEqualTo(20);
        assertThat(stored.getAmountSpentMicros()).isEqualTo(100_000_000L);
        assertThat(eventRepository.sumCostByAdvertisementId(ad.getId())).isEqualTo(stored.getAmountSpentMicros());
        assertThat(eligibilityService.evaluate(placement.getId(), clock.instant())).isEmpty();
    }

    @Test
    public void recordShouldClipLastChargeToRemainingBudget() {
        // given
        Advertisement ad = advertisementRepository.save(Fixtures.activeAd("adv-1", now)
                .budgetMicros(12_000_000L)
                .build());
        assign(ad, null);

        // when
        eventLoggingService.record(request(ad.getId(), EventType.CLICK));
        eventLoggingService.record(request(ad.getId(), EventType.CLICK));
        RecordedEvent clipped = eventLoggingService.record(request(ad.getId(), EventType.CLICK));

        // then
        assertThat(clipped.orphaned()).isFalse();
        assertThat(clipped.cost()).isEqualByComparingTo("2");
        Advertisement stored = advertisementRepository.findById(ad.getId()).orElseThrow();
        assertThat(stored.getAmountSpentMicros()).isEqualTo(12_000_000L);
        assertThat(stored.getStatus()).isEqualTo(AdvertisementStatus.COMPLETED);
    }

    @Test
    public void recordShouldOrphanEventForUnknownAdvertisement() {
        // given
        UUID unknown = UUID.randomUUID();

        // when
        RecordedEvent result = eventLoggingService.record(request(unknown, EventType.IMPRESSION));

        // then
        assertThat(result.orphaned()).isTrue();
        assertThat(result.orphanReason()).isEqualTo(OrphanReason.ADVERTISEMENT_NOT_FOUND);
        assertThat(eventRepository.findByAdvertisementIdOrderByOccurredAtAsc(unknown)).hasSize(1);
    }

    @Test
    public void recordShouldOrphanEventForPausedAdvertisementWithoutTouchingCounters() {
        // given
        Advertisement ad = advertisementRepository.save(Fixtures.activeAd("adv-1", now)
                .status(AdvertisementStatus.PAUSED)
                .build());

        // when
        RecordedEvent result = eventLoggingService.record(request(ad.getId(), EventType.CLICK));

        // then
        assertThat(result.orphanReason()).isEqualTo(OrphanReason.NOT_ELIGIBLE);
        Advertisement stored = advertisementRepository.findById(ad.getId()).orElseThrow();
        assertThat(stored.getClicks()).isZero();
        assertThat(stored.getAmountSpentMicros()).isZero();
    }

    @Test
    public void recordShouldOrphanEventOnPlacementTheAdvertisementIsNotAssignedTo() {
        // given
        Advertisement ad = advertisementRepository.save(Fixtures.activeAd("adv-1", now).build());

        // when
        RecordedEvent result = eventLoggingService.record(request(ad.getId(), EventType.CLICK));

        // then
        assertThat(result.orphaned()).isTrue();
        assertThat(result.orphanReason()).isEqualTo(OrphanReason.NOT_ASSIGNED);
        assertThat(result.cost()).isEqualByComparingTo(BigDecimal.ZERO);
        Advertisement stored = advertisementRepository.findById(ad.getId()).orElseThrow();
        assertThat(stored.getClicks()).isZero();
        assertThat(stored.getAmountSpentMicros()).isZero();
        assertThat(eventRepository.findByAdvertisementIdOrderByOccurredAtAsc(ad.getId()))
                .singleElement()
                .satisfies(event -> assertThat(event.getCostMicros()).isZero());
    }

    @Test
    public void recordShouldOrphanImpressionsBeyondAssignmentCap() {
        // given
        Advertisement ad = advertisementRepository.save(Fixtures.activeAd("adv-1", now)
                .pricingModel(PricingModel.CPM)
                .build());
        assign(ad, 1L);

        // when
        RecordedEvent first = eventLoggingService.record(request(ad.getId(), EventType.IMPRESSION));
        RecordedEvent second = eventLoggingService.record(request(ad.getId(), EventType.IMPRESSION));

        // then
        assertThat(first.orphaned()).isFalse();
        assertThat(first.cost()).isEqualByComparingTo("0.005");
        assertThat(second.orphaned()).isTrue();
        assertThat(second.orphanReason()).isEqualTo(OrphanReason.NOT_ELIGIBLE);
        assertThat(second.cost()).isEqualByComparingTo(BigDecimal.ZERO);
        Advertisement stored = advertisementRepository.findById(ad.getId()).orElseThrow();
        assertThat(stored.getImpressions()).isEqualTo(1);
        assertThat(stored.getAmountSpentMicros()).isEqualTo(5_000L);
    }

    @Test
    public void recordShouldStillChargeClicksOnCappedPlacement() {
        // given
        Advertisement ad = advertisementRepository.save(Fixtures.activeAd("adv-1", now).build());
        assign(ad, 1L);
        eventLoggingService.record(request(ad.getId(), EventType.IMPRESSION));

        // when
        RecordedEvent click = eventLoggingService.record(request(ad.getId(), EventType.CLICK));

        // then
        assertThat(click.orphaned()).isFalse();
        assertThat(click.cost()).isEqualByComparingTo("5");
    }

    @Test
    public void recordShouldRejectUnknownPlacement() {
        // given
        Advertisement ad = advertisementRepository.save(Fixtures.activeAd("adv-1", now).build());
        RecordEventRequest request = RecordEventRequest.builder()
                .advertisementId(ad.getId())
                .placementId(Long.MAX_VALUE)
                .eventType(EventType.CLICK)
                .build();

        // when and then
        assertThatThrownBy(() -> eventLoggingService.record(request)).isInstanceOf(NotFoundException.class);
        assertThat(eventRepository.findByAdvertisementIdOrderByOccurredAtAsc(ad.getId())).isEmpty();
    }

    @Test
    public void recordShouldNeverOverspendUnderConcurrentReports() throws Exception {
        // given
        Advertisement ad = advertisementRepository.save(Fixtures.activeAd("adv-1", now).build());
        assign(ad, null);
        ExecutorService executor = Executors.newFixedThreadPool(8);

        // when
        List<Future<RecordedEvent>> futures = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            futures.add(executor.submit(() -> eventLoggingService.record(request(ad.getId(), EventType.CLICK))));
        }
        long accepted = 0;
        for (Future<RecordedEvent> future : futures) {
            if (!future.get(30, TimeUnit.SECONDS).orphaned()) {
                accepted++;
            }
        }
        executor.shutdown();

        // then
        Advertisement stored = advertisementRepository.findById(ad.getId()).orElseThrow();
        assertThat(accepted).isEqualTo(20);
        assertThat(stored.getClicks()).isEqualTo(20);
        assertThat(stored.getAmountSpentMicros()).isEqualTo(100_000_000L);
        assertThat(eventRepository.sumCostByAdvertisementId(ad.getId())).isEqualTo(100_000_000L);
        assertThat(eventRepository.findByAdvertisementIdOrderByOccurredAtAsc(ad.getId())).hasSize(30);
    }

    private void assign(Advertisement ad, Long maxImpressions) {
        advertisementService.assignPlacement(STAFF, ad.getId(),
                new AssignPlacementRequest(placement.getId(), 1, maxImpressions));
    }

    private RecordEventRequest request(UUID advertisementId, EventType type) {
        return RecordEventRequest.builder()
                .advertisementId(advertisementId)
                .placementId(placement.getId())
                .eventType(type)
                .sessionId("session-1")
                .metadata(Map.of("country", "GH", "user_agent", "Mozilla/5.0 (iPhone)"))
                .build();
    }
}
