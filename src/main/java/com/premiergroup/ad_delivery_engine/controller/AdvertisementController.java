package com.premiergroup.ad_delivery_engine.controller;

import com.premiergroup.ad_delivery_engine.dto.AdvertisementFilter;
import com.premiergroup.ad_delivery_engine.dto.AdvertisementResponse;
import com.premiergroup.ad_delivery_engine.dto.ApprovalRequest;
import com.premiergroup.ad_delivery_engine.dto.AssignPlacementRequest;
import com.premiergroup.ad_delivery_engine.dto.AssignmentResponse;
import com.premiergroup.ad_delivery_engine.dto.BudgetTopUpRequest;
import com.premiergroup.ad_delivery_engine.dto.BulkActionRequest;
import com.premiergroup.ad_delivery_engine.dto.BulkItemResult;
import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.CreateAdvertisementRequest;
import com.premiergroup.ad_delivery_engine.dto.LedgerReconciliation;
import com.premiergroup.ad_delivery_engine.dto.RejectionRequest;
import com.premiergroup.ad_delivery_engine.enums.AdType;
import com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus;
import com.premiergroup.ad_delivery_engine.service.AdvertisementService;
import com.premiergroup.ad_delivery_engine.service.BudgetLedgerService;
import com.premiergroup.ad_delivery_engine.service.BulkActionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/advertisements")
@RequiredArgsConstructor
public class AdvertisementController {

    private final AdvertisementService advertisementService;
    private final BudgetLedgerService budgetLedgerService;
    private final BulkActionService bulkActionService;

    @PostMapping
    public ResponseEntity<AdvertisementResponse> create(Caller caller,
                                                        @Valid @RequestBody CreateAdvertisementRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(advertisementService.create(caller, request));
    }

    @GetMapping
    public ResponseEntity<List<AdvertisementResponse>> list(
            Caller caller,
            @RequestParam(required = false) AdvertisementStatus status,
            @RequestParam(required = false) AdType adType,
            @RequestParam(required = false) UUID campaignId,
            @RequestParam(required = false) Instant startsFrom,
            @RequestParam(required = false) Instant endsBefore,
            @RequestParam(defaultValue = "false") boolean activeOnly
    ) {
        AdvertisementFilter filter = AdvertisementFilter.builder()
                .status(status)
                .adType(adType)
                .campaignId(campaignId)
                .startsFrom(startsFrom)
                .endsBefore(endsBefore)
                .activeOnly(activeOnly)
                .build();
        List<AdvertisementResponse> advertisements = advertisementService.list(caller, filter);
        if (advertisements.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(advertisements);
    }

    @GetMapping("/{id}")
    public ResponseEntity<AdvertisementResponse> get(Caller caller, @PathVariable UUID id) {
        return ResponseEntity.ok(advertisementService.get(caller, id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(Caller caller, @PathVariable UUID id) {
        advertisementService.delete(caller, id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/submit")
    public ResponseEntity<AdvertisementResponse> submit(Caller caller, @PathVariable UUID id) {
        return ResponseEntity.ok(advertisementService.submit(caller, id));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<AdvertisementResponse> approve(Caller caller,
                                                         @PathVariable UUID id,
                                                         @Valid @RequestBody(required = false) ApprovalRequest request) {
        String notes = request == null ? null : request.notes();
        return ResponseEntity.ok(advertisementService.approve(caller, id, notes));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<AdvertisementResponse> reject(Caller caller,
                                                        @PathVariable UUID id,
                                                        @Valid @RequestBody RejectionRequest request) {
        return ResponseEntity.ok(advertisementService.reject(caller, id, request.reason()));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<AdvertisementResponse> pause(Caller caller, @PathVariable UUID id) {
        return ResponseEntity.ok(advertisementService.pause(caller, id));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<AdvertisementResponse> resume(Caller caller, @PathVariable UUID id) {
        return ResponseEntity.ok(advertisementService.resume(caller, id));
    }

    @PostMapping("/{id}/placements")
    public ResponseEntity<AssignmentResponse> assignPlacement(Caller caller,
                                                              @PathVariable UUID id,
                                                              @Valid @RequestBody AssignPlacementRequest request) {
        return ResponseEntity.ok(advertisementService.assignPlacement(caller, id, request));
    }

    @GetMapping("/{id}/placements")
    public ResponseEntity<List<AssignmentResponse>> listAssignments(Caller caller, @PathVariable UUID id) {
        List<AssignmentResponse> assignments = advertisementService.listAssignments(caller, id);
        if (assignments.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(assignments);
    }

    @DeleteMapping("/{id}/placements/{placementId}")
    public ResponseEntity<Void> unassignPlacement(Caller caller,
                                                  @PathVariable UUID id,
                                                  @PathVariable Long placementId) {
        advertisementService.unassignPlacement(caller, id, placementId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/budget/top-ups")
    public ResponseEntity<AdvertisementResponse> topUp(Caller caller,
                                                       @PathVariable UUID id,
                                                       @Valid @RequestBody BudgetTopUpRequest request) {
        return ResponseEntity.ok(budgetLedgerService.topUp(caller, id, request));
    }

    /**
     * Compare the advertisement's counters with its delivery log. With {@code repair=true} the counters are
     * rewritten from the log.
     */
    @PostMapping("/{id}/ledger/reconcile")
    public ResponseEntity<LedgerReconciliation> reconcile(Caller caller,
                                                          @PathVariable UUID id,
                                                          @RequestParam(defaultValue = "false") boolean repair) {
        return ResponseEntity.ok(budgetLedgerService.reconcile(caller, id, repair));
    }

    @PostMapping("/bulk-actions")
    public ResponseEntity<List<BulkItemResult>> bulkAction(Caller caller,
                                                           @Valid @RequestBody BulkActionRequest request) {
        return ResponseEntity.ok(bulkActionService.apply(caller, request));
    }
}
