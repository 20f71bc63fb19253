package com.premiergroup.ad_delivery_engine.controller;

import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.CreatePlacementRequest;
import com.premiergroup.ad_delivery_engine.dto.EligibleAdvertisement;
import com.premiergroup.ad_delivery_engine.dto.PlacementResponse;
import com.premiergroup.ad_delivery_engine.dto.UpdatePlacementRequest;
import com.premiergroup.ad_delivery_engine.enums.PlacementLocation;
import com.premiergroup.ad_delivery_engine.service.EligibilityService;
import com.premiergroup.ad_delivery_engine.service.PlacementService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/placements")
@RequiredArgsConstructor
public class PlacementController {

    private final PlacementService placementService;
    private final EligibilityService eligibilityService;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<PlacementResponse> create(Caller caller, @Valid @RequestBody CreatePlacementRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(placementService.create(caller, request));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<PlacementResponse> update(Caller caller,
                                                    @PathVariable Long id,
                                                    @Valid @RequestBody UpdatePlacementRequest request) {
        return ResponseEntity.ok(placementService.update(caller, id, request));
    }

    @GetMapping
    public ResponseEntity<List<PlacementResponse>> list(@RequestParam(required = false) PlacementLocation location,
                                                        @RequestParam(required = false) Boolean active) {
        List<PlacementResponse> placements = placementService.list(location, active);
        if (placements.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(placements);
    }

    @GetMapping("/{id}")
    public ResponseEntity<PlacementResponse> get(@PathVariable Long id) {
        return ResponseEntity.ok(placementService.get(id));
    }

    /**
     * Advertisements that may serve on the placement right now, in serving order.
     * <p>
     * Example: GET api/placements/3/eligible-advertisements
     */
    @GetMapping("/{id}/eligible-advertisements")
    public ResponseEntity<List<EligibleAdvertisement>> eligible(@PathVariable Long id,
                                                                @RequestParam(required = false) Instant at) {
        List<EligibleAdvertisement> eligible = eligibilityService.evaluate(id, at == null ? clock.instant() : at);
        if (eligible.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(eligible);
    }
}
