package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.enums.CampaignType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder
public record CreateCampaignRequest(
        @NotBlank @Size(max = 200) String name,
        @Size(max = 2000) String description,
        CampaignType campaignType,
        @NotNull BigDecimal totalBudget,
        @NotNull Instant scheduleStart,
        @NotNull Instant scheduleEnd,
        @Positive Long targetImpressions,
        @Positive Long targetClicks,
        @Positive Long targetConversions,
        @Positive BigDecimal targetCtr
) {
}
