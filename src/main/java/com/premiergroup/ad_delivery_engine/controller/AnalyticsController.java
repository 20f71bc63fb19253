package com.premiergroup.ad_delivery_engine.controller;

import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.DailyAnalyticsResponse;
import com.premiergroup.ad_delivery_engine.service.AnalyticsAggregationService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/advertisements/{id}/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsAggregationService aggregationService;

    @GetMapping
    public ResponseEntity<List<DailyAnalyticsResponse>> getAnalytics(
            Caller caller,
            @PathVariable UUID id,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        List<DailyAnalyticsResponse> days = aggregationService.getAnalytics(caller, id, start, end);
        if (days.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(days);
    }

    /**
     * Drop and recompute the rollups of a window from the delivery log.
     * <p>
     * Example: POST api/advertisements/{id}/analytics/rebuild?start=2025-01-01&end=2025-01-31
     */
    @PostMapping("/rebuild")
    public ResponseEntity<List<DailyAnalyticsResponse>> rebuild(
            Caller caller,
            @PathVariable UUID id,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        return ResponseEntity.ok(aggregationService.rebuild(caller, id, start, end));
    }
}
