package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.entity.CreativeAssets;

import java.math.BigDecimal;
import java.util.UUID;

public record EligibleAdvertisement(
        UUID advertisementId,
        String title,
        int priority,
        BigDecimal amountSpent,
        CreativeAssets creative
) {
}
