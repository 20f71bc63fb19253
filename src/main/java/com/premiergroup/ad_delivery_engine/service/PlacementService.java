package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.CreatePlacementRequest;
import com.premiergroup.ad_delivery_engine.dto.PlacementResponse;
import com.premiergroup.ad_delivery_engine.dto.UpdatePlacementRequest;
import com.premiergroup.ad_delivery_engine.entity.Placement;
import com.premiergroup.ad_delivery_engine.enums.PlacementLocation;
import com.premiergroup.ad_delivery_engine.exception.InvalidStateException;
import com.premiergroup.ad_delivery_engine.exception.NotFoundException;
import com.premiergroup.ad_delivery_engine.exception.ValidationException;
import com.premiergroup.ad_delivery_engine.repository.PlacementAssignmentRepository;
import com.premiergroup.ad_delivery_engine.repository.PlacementRepository;
import com.premiergroup.ad_delivery_engine.util.Micros;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

@Service
@Log4j2
@RequiredArgsConstructor
public class PlacementService {

    private final PlacementRepository placementRepository;
    private final PlacementAssignmentRepository assignmentRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Transactional
    public PlacementResponse create(Caller caller, CreatePlacementRequest request) {
        accessPolicy.requireStaff(caller);
        if (placementRepository.existsByName(request.name())) {
            throw new ValidationException("Placement name already in use: " + request.name());
        }

        Placement placement = Placement.builder()
                .name(request.name())
                .location(request.location())
                .dimensions(request.dimensions())
                .maxCreativeSizeMb(request.maxCreativeSizeMb() == null ? 5 : request.maxCreativeSizeMb())
                .pricePerImpressionMicros(Micros.fromUnits(request.pricePerImpression()))
                .pricePerClickMicros(Micros.fromUnits(request.pricePerClick()))
                .active(request.active() == null || request.active())
                .createdAt(clock.instant())
                .build();
        placement = placementRepository.save(placement);
        log.info("Created placement {} ({}) at {}", placement.getId(), placement.getName(), placement.getLocation());
        return DtoMapper.toResponse(placement);
    }

    /**
     * Pricing and the active flag are always editable; name, location and dimensions only while no
     * advertisement is assigned to the placement.
     */
    @Transactional
    public PlacementResponse update(Caller caller, Long placementId, UpdatePlacementRequest request) {
        accessPolicy.requireStaff(caller);
        Placement placement = getEntity(placementId);

        boolean identityChange = changes(request.name(), placement.getName())
                || changes(request.location(), placement.getLocation())
                || changes(request.dimensions(), placement.getDimensions())
                || changes(request.maxCreativeSizeMb(), placement.getMaxCreativeSizeMb());
        if (identityChange && assignmentRepository.existsByPlacement_Id(placementId)) {
            throw new InvalidStateException(
                    "Placement " + placementId + " is referenced by assignments; only pricing and active flag may change");
        }
        if (request.name() != null && changes(request.name(), placement.getName())
                && placementRepository.existsByName(request.name())) {
            throw new ValidationException("Placement name already in use: " + request.name());
        }

        if (request.name() != null) placement.setName(request.name());
        if (request.location() != null) placement.setLocation(request.location());
        if (request.dimensions() != null) placement.setDimensions(request.dimensions());
        if (request.maxCreativeSizeMb() != null) placement.setMaxCreativeSizeMb(request.maxCreativeSizeMb());
        if (request.pricePerImpression() != null) {
            placement.setPricePerImpressionMicros(Micros.fromUnits(request.pricePerImpression()));
        }
        if (request.pricePerClick() != null) {
            placement.setPricePerClickMicros(Micros.fromUnits(request.pricePerClick()));
        }
        if (request.active() != null) placement.setActive(request.active());

        return DtoMapper.toResponse(placementRepository.save(placement));
    }

    @Transactional(readOnly = true)
    public PlacementResponse get(Long placementId) {
        return DtoMapper.toResponse(getEntity(placementId));
    }

    /**
     * Lists placements, active ones unless {@code active} says otherwise.
     */
    @Transactional(readOnly = true)
    public List<PlacementResponse> list(PlacementLocation location, Boolean active) {
        boolean activeFlag = active == null || active;
        List<Placement> placements = location == null
                ? placementRepository.findByActiveOrderByLocationAscNameAsc(activeFlag)
                : placementRepository.findByLocationAndActiveOrderByNameAsc(location, activeFlag);
        return placements.stream().map(DtoMapper::toResponse).toList();
    }

    Placement getEntity(Long placementId) {
        return placementRepository.findById(placementId)
                .orElseThrow(() -> NotFoundException.of("Placement", placementId));
    }

    private static boolean changes(Object requested, Object current) {
        return requested != null && !Objects.equals(requested, current);
    }
}
