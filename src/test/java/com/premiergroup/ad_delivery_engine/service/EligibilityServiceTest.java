package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.AssignPlacementRequest;
import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.EligibleAdvertisement;
import com.premiergroup.ad_delivery_engine.dto.RecordEventRequest;
import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.entity.Placement;
import com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus;
import com.premiergroup.ad_delivery_engine.enums.EventType;
import com.premiergroup.ad_delivery_engine.exception.NotFoundException;
import com.premiergroup.ad_delivery_engine.repository.AdvertisementRepository;
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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public class EligibilityServiceTest {

    private static final Caller STAFF = Caller.staff("staff-1");

    @Autowired
    private EligibilityService eligibilityService;
    @Autowired
    private AdvertisementService advertisementService;
    @Autowired
    private EventLoggingService eventLoggingService;
    @Autowired
    private AdvertisementRepository advertisementRepository;
    @Autowired
    private PlacementRepository placementRepository;
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
    public void evaluateShouldOrderByPriorityThenSpendThenAge() {
        // given
        Advertisement low = save(Fixtures.activeAd("adv-1", now).title("low priority"));
        Advertisement spent = save(Fixtures.activeAd("adv-1", now).title("spent").amountSpentMicros(10_000_000L));
        Advertisement older = save(Fixtures.activeAd("adv-1", now).title("older")
                .createdAt(now.minus(Duration.ofDays(5))));
        Advertisement newer = save(Fixtures.activeAd("adv-1", now).title("newer"));
        assign(low, 2, null);
        assign(spent, 1, null);
        assign(newer, 1, null);
        assign(older, 1, null);

        // when
        List<EligibleAdvertisement> result = eligibilityService.evaluate(placement.getId(), now);

        // then
        assertThat(result).extracting(EligibleAdvertisement::title)
                .containsExactly("older", "newer", "spent", "low priority");
        assertThat(result).extracting(EligibleAdvertisement::priority).containsExactly(1, 1, 1, 2);
    }

    @Test
    public void evaluateShouldExcludeAdvertisementsOutsideTheirWindow() {
        // given
        Advertisement future = save(Fixtures.activeAd("adv-1", now).title("future")
                .scheduleStart(now.plus(Duration.ofDays(1))));
        Advertisement running = save(Fixtures.activeAd("adv-1", now).title("running"));
        assign(future, 1, null);
        assign(running, 1, null);

        // when
        List<EligibleAdvertisement> result = eligibilityService.evaluate(placement.getId(), now);

        // then
        assertThat(result).extracting(EligibleAdvertisement::title).containsExactly("running");
    }

    @Test
    public void evaluateShouldCompleteAdvertisementsPastTheirSchedule() {
        // given
        Advertisement ad = save(Fixtures.activeAd("adv-1", now));
        assign(ad, 1, null);
        Instant later = ad.getScheduleEnd().plusSeconds(1);

        // when
        List<EligibleAdvertisement> result = eligibilityService.evaluate(placement.getId(), later);

        // then
        assertThat(result).isEmpty();
        assertThat(advertisementRepository.findById(ad.getId()).orElseThrow().getStatus())
                .isEqualTo(AdvertisementStatus.COMPLETED);
    }

    @Test
    public void evaluateShouldSkipPausedAdvertisements() {
        // given
        Advertisement ad = save(Fixtures.activeAd("adv-1", now).status(AdvertisementStatus.PAUSED));
        assign(ad, 1, null);

        // when and then
        assertThat(eligibilityService.evaluate(placement.getId(), now)).isEmpty();
    }

    @Test
    public void evaluateShouldHonourImpressionCap() {
        // given
        Advertisement ad = save(Fixtures.activeAd("adv-1", now));
        assign(ad, 1, 2L);
        impression(ad);
        assertThat(eligibilityService.evaluate(placement.getId(), now)).hasSize(1);

        // when
        impression(ad);

        // then
        assertThat(eligibilityService.evaluate(placement.getId(), now)).isEmpty();
    }

    @Test
    public void evaluateShouldStopServingAtDailyBudget() {
        // given
        Advertisement ad = save(Fixtures.activeAd("adv-1", now).dailyBudgetMicros(5_000_000L));
        assign(ad, 1, null);

        // when
        eventLoggingService.record(RecordEventRequest.builder()
                .advertisementId(ad.getId())
                .placementId(placement.getId())
                .eventType(EventType.CLICK)
                .build());

        // then
        assertThat(eligibilityService.evaluate(placement.getId(), now)).isEmpty();
        assertThat(eligibilityService.evaluate(placement.getId(), now.plus(Duration.ofDays(1)))).hasSize(1);
    }

    @Test
    public void evaluateShouldReturnNothingForInactivePlacement() {
        // given
        Advertisement ad = save(Fixtures.activeAd("adv-1", now));
        assign(ad, 1, null);
        placement.setActive(false);
        placementRepository.save(placement);

        // when and then
        assertThat(eligibilityService.evaluate(placement.getId(), now)).isEmpty();
    }

    @Test
    public void evaluateShouldFailForUnknownPlacement() {
        assertThatThrownBy(() -> eligibilityService.evaluate(Long.MAX_VALUE, now))
                .isInstanceOf(NotFoundException.class);
    }

    private Advertisement save(Advertisement.AdvertisementBuilder builder) {
        return advertisementRepository.save(builder.build());
    }

    private void assign(Advertisement ad, int priority, Long maxImpressions) {
        advertisementService.assignPlacement(STAFF, ad.getId(),
                new AssignPlacementRequest(placement.getId(), priority, maxImpressions));
    }

    private void impression(Advertisement ad) {
        eventLoggingService.record(RecordEventRequest.builder()
                .advertisementId(ad.getId())
                .placementId(placement.getId())
                .eventType(EventType.IMPRESSION)
                .build());
    }
}
