package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.RecordEventRequest;
import com.premiergroup.ad_delivery_engine.dto.RecordedEvent;
import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.entity.DeliveryEvent;
import com.premiergroup.ad_delivery_engine.entity.Placement;
import com.premiergroup.ad_delivery_engine.entity.PlacementAssignment;
import com.premiergroup.ad_delivery_engine.enums.EventType;
import com.premiergroup.ad_delivery_engine.enums.OrphanReason;
import com.premiergroup.ad_delivery_engine.exception.BudgetExceededException;
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

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Appends delivery events. The event insert and the counter update share one transaction and the
 * advertisement row lock, so concurrent reporters never lose an update.
 * <p>
 * Only events for an advertisement that is active and assigned to the reporting placement are charged.
 * Impressions beyond the assignment's impression cap are kept as orphans; clicks and conversions on a
 * capped placement are still charged because they follow an impression that was already served.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class EventLoggingService {

    private final PlacementRepository placementRepository;
    private final PlacementAssignmentRepository assignmentRepository;
    private final AdvertisementRepository advertisementRepository;
    private final DeliveryEventRepository eventRepository;
    private final EventCostCalculator costCalculator;
    private final BudgetLedgerService budgetLedger;
    private final Clock clock;
    private final ZoneId analyticsZone;

    @Transactional
    public RecordedEvent record(RecordEventRequest request) {
        Placement placement = placementRepository.findById(request.placementId())
                .orElseThrow(() -> NotFoundException.of("Placement", request.placementId()));

        Instant now = clock.instant();
        Optional<Advertisement> found = advertisementRepository.findByIdForUpdate(request.advertisementId());
        if (found.isEmpty()) {
            return orphan(request, now, OrphanReason.ADVERTISEMENT_NOT_FOUND);
        }

        Advertisement ad = found.get();
        if (!AdvertisementLifecycle.isActive(ad, now)) {
            return orphan(request, now, OrphanReason.NOT_ELIGIBLE);
        }

        Optional<PlacementAssignment> assignment = assignmentRepository
                .findByAdvertisement_IdAndPlacement_Id(ad.getId(), placement.getId());
        if (assignment.isEmpty()) {
            return orphan(request, now, OrphanReason.NOT_ASSIGNED);
        }
        if (request.eventType() == EventType.IMPRESSION && capReached(assignment.get(), ad, placement)) {
            return orphan(request, now, OrphanReason.NOT_ELIGIBLE);
        }

        long cost = costCalculator.costMicros(ad, placement, request.eventType());
        long charged;
        try {
            charged = budgetLedger.charge(ad, request.eventType(), cost, now);
        } catch (BudgetExceededException e) {
            log.warn("Budget exhausted while recording {}: {}", request.eventType(), e.getMessage());
            if (AdvertisementLifecycle.shouldComplete(ad, now)) {
                AdvertisementLifecycle.complete(ad, now);
                advertisementRepository.save(ad);
            }
            return orphan(request, now, OrphanReason.NOT_ELIGIBLE);
        }

        DeliveryEvent event = eventRepository.save(newEvent(request, now, charged, null));
        advertisementRepository.save(ad);
        return new RecordedEvent(event.getId(), false, null, Micros.toUnits(charged));
    }

    // Counted under the advertisement row lock, so two reporters cannot both take the last slot.
    private boolean capReached(PlacementAssignment assignment, Advertisement ad, Placement placement) {
        Long cap = assignment.getMaxImpressions();
        if (cap == null) {
            return false;
        }
        long served = eventRepository.countByAdvertisementIdAndPlacementIdAndEventTypeAndOrphanedFalse(
                ad.getId(), placement.getId(), EventType.IMPRESSION);
        return served >= cap;
    }

    private RecordedEvent orphan(RecordEventRequest request, Instant now, OrphanReason reason) {
        DeliveryEvent event = eventRepository.save(newEvent(request, now, 0L, reason));
        log.warn("Recorded orphaned {} event {} for advertisement {} on placement {}: {}",
                request.eventType(), event.getId(), request.advertisementId(), request.placementId(), reason);
        return new RecordedEvent(event.getId(), true, reason, Micros.toUnits(0L));
    }

    private DeliveryEvent newEvent(RecordEventRequest request, Instant now, long costMicros, OrphanReason reason) {
        Map<String, String> metadata = request.metadata() == null
                ? new TreeMap<>()
                : new TreeMap<>(request.metadata());
        return DeliveryEvent.builder()
                .id(UUID.randomUUID())
                .advertisementId(request.advertisementId())
                .placementId(request.placementId())
                .eventType(request.eventType())
                .occurredAt(now)
                .eventDate(LocalDate.ofInstant(now, analyticsZone))
                .costMicros(costMicros)
                .userReference(request.userReference())
                .sessionId(request.sessionId())
                .metadata(metadata)
                .orphaned(reason != null)
                .orphanReason(reason)
                .build();
    }
}
