package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.AdvertisementFilter;
import com.premiergroup.ad_delivery_engine.dto.AdvertisementResponse;
import com.premiergroup.ad_delivery_engine.dto.AssignPlacementRequest;
import com.premiergroup.ad_delivery_engine.dto.AssignmentResponse;
import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.CreateAdvertisementRequest;
import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.entity.Campaign;
import com.premiergroup.ad_delivery_engine.entity.CreativeAssets;
import com.premiergroup.ad_delivery_engine.entity.Placement;
import com.premiergroup.ad_delivery_engine.entity.PlacementAssignment;
import com.premiergroup.ad_delivery_engine.entity.Targeting;
import com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus;
import com.premiergroup.ad_delivery_engine.enums.PricingModel;
import com.premiergroup.ad_delivery_engine.exception.NotFoundException;
import com.premiergroup.ad_delivery_engine.exception.ValidationException;
import com.premiergroup.ad_delivery_engine.repository.AdvertisementRepository;
import com.premiergroup.ad_delivery_engine.repository.CampaignRepository;
import com.premiergroup.ad_delivery_engine.repository.PlacementAssignmentRepository;
import com.premiergroup.ad_delivery_engine.repository.PlacementRepository;
import com.premiergroup.ad_delivery_engine.util.Micros;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.BiConsumer;

@Service
@Log4j2
@RequiredArgsConstructor
public class AdvertisementService {

    static final String DEFAULT_CURRENCY = "GHS";
    static final String DEFAULT_CALL_TO_ACTION = "Learn More";

    private final AdvertisementRepository advertisementRepository;
    private final PlacementRepository placementRepository;
    private final PlacementAssignmentRepository assignmentRepository;
    private final CampaignRepository campaignRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Transactional
    public AdvertisementResponse create(Caller caller, CreateAdvertisementRequest request) {
        accessPolicy.requireIdentified(caller);
        validate(request);

        Campaign campaign = null;
        if (request.campaignId() != null) {
            campaign = campaignRepository.findById(request.campaignId())
                    .orElseThrow(() -> NotFoundException.of("Campaign", request.campaignId()));
            accessPolicy.requireOwnerOrStaff(caller, campaign.getManagerId());
        }

        Instant now = clock.instant();
        Advertisement ad = Advertisement.builder()
                .id(UUID.randomUUID())
                .advertiserId(caller.id())
                .title(request.title().trim())
                .description(request.description())
                .adType(request.adType())
                .campaign(campaign)
                .targeting(request.targeting() == null ? new Targeting() : request.targeting())
                .creative(withDefaults(request.creative()))
                .budgetMicros(Micros.fromUnits(request.budget()))
                .dailyBudgetMicros(Micros.fromUnitsNullable(request.dailyBudget()))
                .bidAmountMicros(Micros.fromUnits(request.bidAmount()))
                .pricingModel(request.pricingModel() == null ? PricingModel.CPC : request.pricingModel())
                .currency(request.currency() == null ? DEFAULT_CURRENCY : request.currency().toUpperCase(Locale.ROOT))
                .scheduleStart(request.scheduleStart())
                .scheduleEnd(request.scheduleEnd())
                .status(AdvertisementStatus.DRAFT)
                .createdAt(now)
                .updatedAt(now)
                .build();

        if (request.placementIds() != null) {
            for (Long placementId : request.placementIds()) {
                placementRepository.findById(placementId)
                        .filter(Placement::isActive)
                        .ifPresentOrElse(
                                placement -> ad.getAssignments().add(newAssignment(ad, placement, 1, null, now)),
                                () -> log.warn("Skipping unknown or inactive placement {} for new advertisement {}",
                                        placementId, ad.getId()));
            }
        }

        Advertisement saved = advertisementRepository.save(ad);
        log.info("Advertiser {} created advertisement {} with {} placement(s)",
                caller.id(), saved.getId(), saved.getAssignments().size());
        return DtoMapper.toResponse(saved, now);
    }

    @Transactional(readOnly = true)
    public AdvertisementResponse get(Caller caller, UUID id) {
        Advertisement ad = getEntity(id);
        accessPolicy.requireOwnerOrStaff(caller, ad.getAdvertiserId());
        return DtoMapper.toResponse(ad, clock.instant());
    }

    /**
     * Owners see their own advertisements, staff see every advertisement. {@code activeOnly} applies the
     * computed eligibility predicate at the current instant.
     */
    @Transactional(readOnly = true)
    public List<AdvertisementResponse> list(Caller caller, AdvertisementFilter filter) {
        accessPolicy.requireIdentified(caller);
        Instant now = clock.instant();

        Specification<Advertisement> spec = (root, query, cb) -> cb.conjunction();
        if (!caller.staff()) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("advertiserId"), caller.id()));
        }
        if (filter.status() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), filter.status()));
        }
        if (filter.adType() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("adType"), filter.adType()));
        }
        if (filter.campaignId() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("campaign").get("id"), filter.campaignId()));
        }
        if (filter.startsFrom() != null) {
            spec = spec.and((root, query, cb) ->
                    cb.greaterThanOrEqualTo(root.get("scheduleStart"), filter.startsFrom()));
        }
        if (filter.endsBefore() != null) {
            spec = spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.get("scheduleEnd"), filter.endsBefore()));
        }

        return advertisementRepository.findAll(spec, Sort.by(Sort.Direction.DESC, "createdAt")).stream()
                .filter(ad -> !filter.activeOnly() || AdvertisementLifecycle.isActive(ad, now))
                .map(ad -> DtoMapper.toResponse(ad, now))
                .toList();
    }

    @Transactional
    public AdvertisementResponse submit(Caller caller, UUID id) {
        return transition(caller, id, false, (ad, now) -> AdvertisementLifecycle.submit(ad, now));
    }

    @Transactional
    public AdvertisementResponse approve(Caller caller, UUID id, String notes) {
        return transition(caller, id, true, (ad, now) -> AdvertisementLifecycle.approve(ad, caller.id(), notes, now));
    }

    @Transactional
    public AdvertisementResponse reject(Caller caller, UUID id, String reason) {
        return transition(caller, id, true, (ad, now) -> AdvertisementLifecycle.reject(ad, reason, now));
    }

    @Transactional
    public AdvertisementResponse pause(Caller caller, UUID id) {
        return transition(caller, id, false, (ad, now) -> AdvertisementLifecycle.pause(ad, now));
    }

    @Transactional
    public AdvertisementResponse resume(Caller caller, UUID id) {
        return transition(caller, id, false, (ad, now) -> AdvertisementLifecycle.resume(ad, now));
    }

    /**
     * Removes the advertisement and its assignments. Logged delivery events stay in place.
     */
    @Transactional
    public void delete(Caller caller, UUID id) {
        Advertisement ad = advertisementRepository.findByIdForUpdate(id)
                .orElseThrow(() -> NotFoundException.of("Advertisement", id));
        accessPolicy.requireOwnerOrStaff(caller, ad.getAdvertiserId());
        advertisementRepository.delete(ad);
        log.info("Advertisement {} deleted by {}", id, caller.id());
    }

    /**
     * Attaches the advertisement to a placement. Re-assigning an existing pair updates its priority and cap.
     */
    @Transactional
    public AssignmentResponse assignPlacement(Caller caller, UUID id, AssignPlacementRequest request) {
        Advertisement ad = getEntity(id);
        accessPolicy.requireOwnerOrStaff(caller, ad.getAdvertiserId());

        Placement placement = placementRepository.findById(request.placementId())
                .orElseThrow(() -> NotFoundException.of("Placement", request.placementId()));
        if (!placement.isActive()) {
            throw new ValidationException("Placement " + placement.getId() + " is not active");
        }

        int priority = request.priority() == null ? 1 : request.priority();
        Instant now = clock.instant();
        PlacementAssignment assignment = assignmentRepository
                .findByAdvertisement_IdAndPlacement_Id(id, placement.getId())
                .map(existing -> {
                    existing.setPriority(priority);
                    existing.setMaxImpressions(request.maxImpressions());
                    return existing;
                })
                .orElseGet(() -> {
                    PlacementAssignment created = newAssignment(ad, placement, priority, request.maxImpressions(), now);
                    ad.getAssignments().add(created);
                    return created;
                });

        assignment = assignmentRepository.save(assignment);
        log.info("Advertisement {} assigned to placement {} with priority {}", id, placement.getId(), priority);
        return DtoMapper.toResponse(assignment);
    }

    @Transactional
    public void unassignPlacement(Caller caller, UUID id, Long placementId) {
        Advertisement ad = getEntity(id);
        accessPolicy.requireOwnerOrStaff(caller, ad.getAdvertiserId());

        PlacementAssignment assignment = assignmentRepository.findByAdvertisement_IdAndPlacement_Id(id, placementId)
                .orElseThrow(() -> new NotFoundException(
                        "Advertisement " + id + " is not assigned to placement " + placementId));
        ad.getAssignments().remove(assignment);
        assignmentRepository.delete(assignment);
        log.info("Advertisement {} detached from placement {}", id, placementId);
    }

    @Transactional(readOnly = true)
    public List<AssignmentResponse> listAssignments(Caller caller, UUID id) {
        Advertisement ad = getEntity(id);
        accessPolicy.requireOwnerOrStaff(caller, ad.getAdvertiserId());
        return assignmentRepository.findByAdvertisement_IdOrderByPriorityAsc(id).stream()
                .map(DtoMapper::toResponse)
                .toList();
    }

    Advertisement getEntity(UUID id) {
        return advertisementRepository.findById(id)
                .orElseThrow(() -> NotFoundException.of("Advertisement", id));
    }

    private AdvertisementResponse transition(Caller caller,
                                             UUID id,
                                             boolean staffOnly,
                                             BiConsumer<Advertisement, Instant> action) {
        Advertisement ad = advertisementRepository.findByIdForUpdate(id)
                .orElseThrow(() -> NotFoundException.of("Advertisement", id));
        if (staffOnly) {
            accessPolicy.requireStaff(caller);
        } else {
            accessPolicy.requireOwnerOrStaff(caller, ad.getAdvertiserId());
        }

        AdvertisementStatus before = ad.getStatus();
        Instant now = clock.instant();
        action.accept(ad, now);
        Advertisement saved = advertisementRepository.save(ad);
        log.info("Advertisement {} moved from {} to {} by {}", id, before, saved.getStatus(), caller.id());
        return DtoMapper.toResponse(saved, now);
    }

    private static void validate(CreateAdvertisementRequest request) {
        List<String> errors = new ArrayList<>();
        if (request.title() == null || request.title().isBlank()) {
            errors.add("Title is required");
        }
        if (request.adType() == null) {
            errors.add("Ad type is required");
        }
        if (request.scheduleStart() == null || request.scheduleEnd() == null) {
            errors.add("Start and end dates are required");
        } else if (!request.scheduleStart().isBefore(request.scheduleEnd())) {
            errors.add("End date must be after start date");
        }
        if (request.budget() == null || request.budget().signum() <= 0) {
            errors.add("Budget must be greater than 0");
        } else if (request.dailyBudget() != null && request.dailyBudget().compareTo(request.budget()) > 0) {
            errors.add("Daily budget cannot exceed total budget");
        }
        if (request.dailyBudget() != null && request.dailyBudget().signum() <= 0) {
            errors.add("Daily budget must be greater than 0");
        }
        if (request.bidAmount() != null && request.bidAmount().compareTo(BigDecimal.ZERO) < 0) {
            errors.add("Bid amount cannot be negative");
        }
        if (request.currency() != null && !request.currency().matches("[A-Za-z]{3}")) {
            errors.add("Currency must be a 3-letter code");
        }
        Targeting targeting = request.targeting();
        if (targeting != null && targeting.getAudience() != null) {
            Targeting.Audience audience = targeting.getAudience();
            if (audience.getAgeRange() == null || audience.getAgeRange().isBlank()) {
                errors.add("Target audience must include age_range");
            }
            if (audience.getInterests() == null || audience.getInterests().isEmpty()) {
                errors.add("Target audience must include interests");
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(String.join("; ", errors));
        }
    }

    private static CreativeAssets withDefaults(CreativeAssets creative) {
        CreativeAssets assets = creative == null ? new CreativeAssets() : creative;
        if (assets.getCallToAction() == null || assets.getCallToAction().isBlank()) {
            assets.setCallToAction(DEFAULT_CALL_TO_ACTION);
        }
        return assets;
    }

    private static PlacementAssignment newAssignment(Advertisement ad,
                                                     Placement placement,
                                                     int priority,
                                                     Long maxImpressions,
                                                     Instant now) {
        return PlacementAssignment.builder()
                .advertisement(ad)
                .placement(placement)
                .priority(priority)
                .maxImpressions(maxImpressions)
                .assignedAt(now)
                .build();
    }
}
