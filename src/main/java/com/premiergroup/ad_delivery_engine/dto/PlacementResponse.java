package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.enums.PlacementLocation;

import java.math.BigDecimal;
import java.time.Instant;

public record PlacementResponse(
        Long id,
        String name,
        PlacementLocation location,
        String dimensions,
        Integer maxCreativeSizeMb,
        BigDecimal pricePerImpression,
        BigDecimal pricePerClick,
        boolean active,
        Instant createdAt
) {
}
