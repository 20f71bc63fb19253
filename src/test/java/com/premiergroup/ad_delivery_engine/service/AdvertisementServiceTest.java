package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.AdvertisementFilter;
import com.premiergroup.ad_delivery_engine.dto.AdvertisementResponse;
import com.premiergroup.ad_delivery_engine.dto.AssignPlacementRequest;
import com.premiergroup.ad_delivery_engine.dto.AssignmentResponse;
import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.CreateAdvertisementRequest;
import com.premiergroup.ad_delivery_engine.entity.CreativeAssets;
import com.premiergroup.ad_delivery_engine.entity.Placement;
import com.premiergroup.ad_delivery_engine.enums.AdType;
import com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus;
import com.premiergroup.ad_delivery_engine.enums.PricingModel;
import com.premiergroup.ad_delivery_engine.exception.ForbiddenOperationException;
import com.premiergroup.ad_delivery_engine.exception.InvalidStateException;
import com.premiergroup.ad_delivery_engine.exception.NotFoundException;
import com.premiergroup.ad_delivery_engine.exception.ValidationException;
import com.premiergroup.ad_delivery_engine.repository.AdvertisementRepository;
import com.premiergroup.ad_delivery_engine.repository.PlacementAssignmentRepository;
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
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public class AdvertisementServiceTest {

    private static final Caller STAFF = Caller.staff("staff-1");

    @Autowired
    private AdvertisementService advertisementService;
    @Autowired
    private AdvertisementRepository advertisementRepository;
    @Autowired
    private PlacementRepository placementRepository;
    @Autowired
    private PlacementAssignmentRepository assignmentRepository;
    @Autowired
    private MutableClock clock;

    private Instant now;
    private Caller owner;
    private Placement placement;

    @BeforeEach
    public void setUp() {
        clock.setInstant(TestClockConfig.START);
        now = clock.instant();
        owner = Caller.advertiser("farmer-" + UUID.randomUUID());
        placement = placementRepository.save(Fixtures.placement(now).build());
    }

    @Test
    public void createShouldApplyDefaultsAndAssignKnownPlacements() {
        // given
        CreateAdvertisementRequest request = request()
                .placementIds(List.of(placement.getId(), Long.MAX_VALUE))
                .build();

        // when
        AdvertisementResponse created = advertisementService.create(owner, request);

        // then
        assertThat(created.status()).isEqualTo(AdvertisementStatus.DRAFT);
        assertThat(created.advertiserId()).isEqualTo(owner.id());
        assertThat(created.currency()).isEqualTo("GHS");
        assertThat(created.pricingModel()).isEqualTo(PricingModel.CPC);
        assertThat(created.creative().getCallToAction()).isEqualTo("Learn More");
        assertThat(created.budget()).isEqualByComparingTo("250");
        assertThat(created.amountSpent()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(advertisementService.listAssignments(owner, created.id()))
                .extracting(AssignmentResponse::placementId, AssignmentResponse::priority)
                .containsExactly(tuple(placement.getId(), 1));
    }

    @Test
    public void createShouldReportEveryValidationError() {
        // given
        CreateAdvertisementRequest request = request()
                .scheduleStart(now.plus(Duration.ofDays(10)))
                .scheduleEnd(now.plus(Duration.ofDays(5)))
                .dailyBudget(new BigDecimal("500"))
                .build();

        // when and then
        assertThatThrownBy(() -> advertisementService.create(owner, request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("End date must be after start date")
                .hasMessageContaining("Daily budget cannot exceed total budget");
    }

    @Test
    public void createShouldRequireIdentity() {
        assertThatThrownBy(() -> advertisementService.create(Caller.anonymous(), request().build()))
                .isInstanceOf(ForbiddenOperationException.class);
    }

    @Test
    public void advertisementShouldWalkThroughApprovalWorkflow() {
        // given
        UUID id = advertisementService.create(owner, request().build()).id();

        // when
        advertisementService.submit(owner, id);
        AdvertisementResponse approved = advertisementService.approve(STAFF, id, "ok");
        clock.setInstant(approved.scheduleStart().plusSeconds(60));
        AdvertisementResponse paused = advertisementService.pause(owner, id);
        AdvertisementResponse resumed = advertisementService.resume(owner, id);

        // then
        assertThat(approved.status()).isEqualTo(AdvertisementStatus.ACTIVE);
        assertThat(approved.approvedBy()).isEqualTo("staff-1");
        assertThat(paused.status()).isEqualTo(AdvertisementStatus.PAUSED);
        assertThat(resumed.status()).isEqualTo(AdvertisementStatus.ACTIVE);
        assertThat(resumed.active()).isTrue();
    }

    @Test
    public void approveShouldRequireStaff() {
        // given
        UUID id = advertisementService.create(owner, request().build()).id();
        advertisementService.submit(owner, id);

        // when and then
        assertThatThrownBy(() -> advertisementService.approve(owner, id, null))
                .isInstanceOf(ForbiddenOperationException.class);
        assertThat(advertisementService.get(owner, id).status()).isEqualTo(AdvertisementStatus.PENDING_APPROVAL);
    }

    @Test
    public void rejectShouldStoreReason() {
        // given
        UUID id = advertisementService.create(owner, request().build()).id();
        advertisementService.submit(owner, id);

        // when
        AdvertisementResponse rejected = advertisementService.reject(STAFF, id, "Blurry banner");

        // then
        assertThat(rejected.status()).isEqualTo(AdvertisementStatus.REJECTED);
        assertThat(rejected.rejectionReason()).isEqualTo("Blurry banner");
    }

    @Test
    public void pauseShouldFailForDraft() {
        // given
        UUID id = advertisementService.create(owner, request().build()).id();

        // when and then
        assertThatThrownBy(() -> advertisementService.pause(owner, id)).isInstanceOf(InvalidStateException.class);
    }

    @Test
    public void getShouldHideOtherAdvertisersAdvertisements() {
        // given
        UUID id = advertisementService.create(owner, request().build()).id();

        // when and then
        assertThatThrownBy(() -> advertisementService.get(Caller.advertiser("someone-else"), id))
                .isInstanceOf(ForbiddenOperationException.class);
        assertThat(advertisementService.get(STAFF, id).id()).isEqualTo(id);
    }

    @Test
    public void listShouldScopeToOwnerAndApplyFilters() {
        // given
        UUID draft = advertisementService.create(owner, request().build()).id();
        UUID banner = advertisementService.create(owner, request().adType(AdType.BRAND_AWARENESS).build()).id();
        advertisementService.create(Caller.advertiser("other-" + UUID.randomUUID()), request().build());

        // when
        List<AdvertisementResponse> all = advertisementService.list(owner, AdvertisementFilter.none());
        List<AdvertisementResponse> brand = advertisementService.list(owner,
                AdvertisementFilter.builder().adType(AdType.BRAND_AWARENESS).build());
        List<AdvertisementResponse> active = advertisementService.list(owner,
                AdvertisementFilter.builder().activeOnly(true).build());

        // then
        assertThat(all).extracting(AdvertisementResponse::id).containsExactlyInAnyOrder(draft, banner);
        assertThat(brand).extracting(AdvertisementResponse::id).containsExactly(banner);
        assertThat(active).isEmpty();
    }

    @Test
    public void assignPlacementShouldUpdateExistingPair() {
        // given
        UUID id = advertisementService.create(owner, request().build()).id();
        advertisementService.assignPlacement(owner, id, new AssignPlacementRequest(placement.getId(), null, null));

        // when
        AssignmentResponse updated = advertisementService.assignPlacement(owner, id,
                new AssignPlacementRequest(placement.getId(), 3, 500L));

        // then
        assertThat(updated.priority()).isEqualTo(3);
        assertThat(updated.maxImpressions()).isEqualTo(500L);
        assertThat(advertisementService.listAssignments(owner, id)).hasSize(1);
    }

    @Test
    public void assignPlacementShouldRejectInactivePlacement() {
        // given
        UUID id = advertisementService.create(owner, request().build()).id();
        Placement inactive = placementRepository.save(Fixtures.placement(now).active(false).build());

        // when and then
        assertThatThrownBy(() -> advertisementService.assignPlacement(owner, id,
                new AssignPlacementRequest(inactive.getId(), 1, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    public void unassignPlacementShouldFailWhenNotAssigned() {
        // given
        UUID id = advertisementService.create(owner, request().build()).id();

        // when and then
        assertThatThrownBy(() -> advertisementService.unassignPlacement(owner, id, placement.getId()))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    public void deleteShouldRemoveAdvertisementAndAssignments() {
        // given
        UUID id = advertisementService.create(owner, request().placementIds(List.of(placement.getId())).build()).id();

        // when
        advertisementService.delete(owner, id);

        // then
        assertThat(advertisementRepository.findById(id)).isEmpty();
        assertThat(assignmentRepository.findByAdvertisement_IdOrderByPriorityAsc(id)).isEmpty();
    }

    private CreateAdvertisementRequest.CreateAdvertisementRequestBuilder request() {
        return CreateAdvertisementRequest.builder()
                .title("Tractor hire for the planting season")
                .adType(AdType.EQUIPMENT_RENTAL)
                .creative(CreativeAssets.builder().bannerImageUrl("https://cdn.example.com/tractor.png").build())
                .budget(new BigDecimal("250"))
                .bidAmount(new BigDecimal("0.40"))
                .scheduleStart(now.plus(Duration.ofDays(1)))
                .scheduleEnd(now.plus(Duration.ofDays(31)));
    }
}
