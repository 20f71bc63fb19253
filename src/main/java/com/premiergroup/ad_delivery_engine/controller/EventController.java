package com.premiergroup.ad_delivery_engine.controller;

import com.premiergroup.ad_delivery_engine.dto.RecordEventRequest;
import com.premiergroup.ad_delivery_engine.dto.RecordedEvent;
import com.premiergroup.ad_delivery_engine.service.EventLoggingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final EventLoggingService eventLoggingService;

    /**
     * Record an impression, click or conversion. Events that cannot be billed are still stored and come back
     * flagged as orphaned.
     */
    @PostMapping
    public ResponseEntity<RecordedEvent> record(@Valid @RequestBody RecordEventRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(eventLoggingService.record(request));
    }
}
