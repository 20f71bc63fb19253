package com.premiergroup.ad_delivery_engine.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record AssignPlacementRequest(
        @NotNull Long placementId,
        @Positive Integer priority,
        @Positive Long maxImpressions
) {
}
