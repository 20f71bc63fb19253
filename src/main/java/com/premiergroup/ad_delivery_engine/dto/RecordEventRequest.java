package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.enums.EventType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;

import java.util.Map;
import java.util.UUID;

@Builder
public record RecordEventRequest(
        @NotNull UUID advertisementId,
        @NotNull Long placementId,
        @NotNull EventType eventType,
        @Size(max = 64) String userReference,
        @Size(max = 100) String sessionId,
        @Size(max = 10) Map<@Size(max = 64) String, @Size(max = 256) String> metadata
) {
}
