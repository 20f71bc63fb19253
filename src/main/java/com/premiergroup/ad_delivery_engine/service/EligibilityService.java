package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.EligibleAdvertisement;
import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.entity.Placement;
import com.premiergroup.ad_delivery_engine.entity.PlacementAssignment;
import com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus;
import com.premiergroup.ad_delivery_engine.enums.EventType;
import com.premiergroup.ad_delivery_engine.exception.NotFoundException;
import com.premiergroup.ad_delivery_engine.repository.AdvertisementRepository;
import com.premiergroup.ad_delivery_engine.repository.DeliveryEventRepository;
import com.premiergroup.ad_delivery_engine.repository.PlacementAssignmentRepository;
import com.premiergroup.ad_delivery_engine.repository.PlacementRepository;
import com.premiergroup.ad_delivery_engine.util.Micros;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks the advertisements a placement may serve at a given instant.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class EligibilityService {

    private static final Comparator<PlacementAssignment> SERVING_ORDER = Comparator
            .comparingInt(PlacementAssignment::getPriority)
            .thenComparingLong(pa -> pa.getAdvertisement().getAmountSpentMicros())
            .thenComparing(pa -> pa.getAdvertisement().getCreatedAt())
            .thenComparing(pa -> pa.getAdvertisement().getId());

    private final PlacementRepository placementRepository;
    private final PlacementAssignmentRepository assignmentRepository;
    private final AdvertisementRepository advertisementRepository;
    private final DeliveryEventRepository eventRepository;
    private final BudgetLedgerService budgetLedger;
    private final ZoneId analyticsZone;

    /**
     * Advertisements past their window or out of budget are completed on the way.
     */
    @Transactional
    public List<EligibleAdvertisement> evaluate(Long placementId, Instant now) {
        Placement placement = placementRepository.findById(placementId)
                .orElseThrow(() -> NotFoundException.of("Placement", placementId));
        if (!placement.isActive()) {
            log.debug("Placement {} is inactive, nothing to serve", placementId);
            return List.of();
        }

        LocalDate today = LocalDate.ofInstant(now, analyticsZone);
        List<PlacementAssignment> eligible = new ArrayList<>();
        for (PlacementAssignment assignment : assignmentRepository.findWithAdvertisementByPlacementId(placementId)) {
            Advertisement ad = assignment.getAdvertisement();

            if (AdvertisementLifecycle.shouldComplete(ad, now)) {
                int updated = advertisementRepository.markCompleted(
                        ad.getId(), now, AdvertisementStatus.ACTIVE, AdvertisementStatus.COMPLETED);
                if (updated > 0) {
                    log.info("Advertisement {} completed (schedule over or budget spent)", ad.getId());
                }
                continue;
            }
            if (!AdvertisementLifecycle.isActive(ad, now)) {
                log.debug("Placement {}: advertisement {} not active ({})", placementId, ad.getId(), ad.getStatus());
                continue;
            }
            if (!budgetLedger.isWithinDailyBudget(ad, today)) {
                log.debug("Placement {}: advertisement {} reached its daily budget", placementId, ad.getId());
                continue;
            }
            if (assignment.getMaxImpressions() != null) {
                long served = eventRepository.countByAdvertisementIdAndPlacementIdAndEventTypeAndOrphanedFalse(
                        ad.getId(), placementId, EventType.IMPRESSION);
                if (served >= assignment.getMaxImpressions()) {
                    log.debug("Placement {}: advertisement {} reached its impression cap of {}",
                            placementId, ad.getId(), assignment.getMaxImpressions());
                    continue;
                }
            }
            eligible.add(assignment);
        }

        eligible.sort(SERVING_ORDER);
        log.debug("Placement {} has {} eligible advertisement(s)", placementId, eligible.size());
        return eligible.stream()
                .map(pa -> new EligibleAdvertisement(
                        pa.getAdvertisement().getId(),
                        pa.getAdvertisement().getTitle(),
                        pa.getPriority(),
                        Micros.toUnits(pa.getAdvertisement().getAmountSpentMicros()),
                        pa.getAdvertisement().getCreative()))
                .toList();
    }
}
