package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.entity.CreativeAssets;
import com.premiergroup.ad_delivery_engine.entity.Targeting;
import com.premiergroup.ad_delivery_engine.enums.AdType;
import com.premiergroup.ad_delivery_engine.enums.PricingModel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Builder
public record CreateAdvertisementRequest(
        @NotBlank @Size(max = 200) String title,
        @Size(max = 2000) String description,
        @NotNull AdType adType,
        UUID campaignId,
        Targeting targeting,
        CreativeAssets creative,
        @NotNull BigDecimal budget,
        BigDecimal dailyBudget,
        BigDecimal bidAmount,
        PricingModel pricingModel,
        @Size(min = 3, max = 3) String currency,
        @NotNull Instant scheduleStart,
        @NotNull Instant scheduleEnd,
        List<Long> placementIds
) {
}
