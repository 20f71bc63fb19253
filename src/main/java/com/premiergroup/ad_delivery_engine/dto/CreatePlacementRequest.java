package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.enums.PlacementLocation;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record CreatePlacementRequest(
        @NotBlank @Size(max = 100) String name,
        @NotNull PlacementLocation location,
        @Size(max = 20) String dimensions,
        @PositiveOrZero Integer maxCreativeSizeMb,
        @PositiveOrZero BigDecimal pricePerImpression,
        @PositiveOrZero BigDecimal pricePerClick,
        Boolean active
) {
}
