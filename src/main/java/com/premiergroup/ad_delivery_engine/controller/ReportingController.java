package com.premiergroup.ad_delivery_engine.controller;

import com.premiergroup.ad_delivery_engine.dto.AdvertisementPerformance;
import com.premiergroup.ad_delivery_engine.dto.AdvertisementTrendGraph;
import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.DashboardOverview;
import com.premiergroup.ad_delivery_engine.dto.DeliveryTrendStats;
import com.premiergroup.ad_delivery_engine.dto.MarketInsights;
import com.premiergroup.ad_delivery_engine.enums.DateFilter;
import com.premiergroup.ad_delivery_engine.enums.MetricFilter;
import com.premiergroup.ad_delivery_engine.service.ReportingService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportingController {

    private final ReportingService reportingService;

    @GetMapping("/overview")
    public ResponseEntity<DashboardOverview> overview(
            Caller caller,
            @RequestParam(required = false) BigDecimal valuePerConversion
    ) {
        return ResponseEntity.ok(reportingService.overview(caller, valuePerConversion));
    }

    @GetMapping("/advertisements/{id}/performance")
    public ResponseEntity<AdvertisementPerformance> advertisementPerformance(
            Caller caller,
            @PathVariable UUID id,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) BigDecimal valuePerConversion
    ) {
        return ResponseEntity.ok(reportingService.advertisementPerformance(caller, id, from, to, valuePerConversion));
    }

    /**
     * Example: GET api/reports/trends?dateRange=CUSTOM&startDate=2025-01-01&endDate=2025-03-31
     */
    @GetMapping("/trends")
    public ResponseEntity<DeliveryTrendStats> trends(
            Caller caller,
            @RequestParam DateFilter dateRange,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate
    ) {
        return ResponseEntity.ok(reportingService.trends(caller, dateRange, startDate, endDate));
    }

    @GetMapping("/trends/by-advertisement")
    public ResponseEntity<AdvertisementTrendGraph> trendGraph(
            Caller caller,
            @RequestParam DateFilter dateRange,
            @RequestParam MetricFilter metric,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate
    ) {
        AdvertisementTrendGraph graph = reportingService.trendGraph(caller, dateRange, startDate, endDate, metric);
        if (graph.labels().isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(graph);
    }

    @GetMapping("/market-insights")
    public ResponseEntity<MarketInsights> marketInsights(Caller caller) {
        return ResponseEntity.ok(reportingService.marketInsights(caller));
    }
}
