package com.premiergroup.ad_delivery_engine.controller;

import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.CampaignPerformance;
import com.premiergroup.ad_delivery_engine.dto.CampaignResponse;
import com.premiergroup.ad_delivery_engine.dto.CreateCampaignRequest;
import com.premiergroup.ad_delivery_engine.service.CampaignRollupService;
import com.premiergroup.ad_delivery_engine.service.CampaignService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/campaigns")
@RequiredArgsConstructor
public class CampaignController {

    private final CampaignService campaignService;
    private final CampaignRollupService campaignRollupService;

    @PostMapping
    public ResponseEntity<CampaignResponse> create(Caller caller, @Valid @RequestBody CreateCampaignRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(campaignService.create(caller, request));
    }

    @GetMapping
    public ResponseEntity<List<CampaignResponse>> list(Caller caller) {
        List<CampaignResponse> campaigns = campaignService.list(caller);
        if (campaigns.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(campaigns);
    }

    @GetMapping("/{id}")
    public ResponseEntity<CampaignResponse> get(Caller caller, @PathVariable UUID id) {
        return ResponseEntity.ok(campaignService.get(caller, id));
    }

    @GetMapping("/{id}/performance")
    public ResponseEntity<CampaignPerformance> performance(Caller caller, @PathVariable UUID id) {
        return ResponseEntity.ok(campaignRollupService.getPerformance(caller, id));
    }
}
