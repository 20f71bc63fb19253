package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.enums.AdType;
import com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus;
import lombok.Builder;

import java.time.Instant;
import java.util.UUID;

@Builder
public record AdvertisementFilter(
        AdvertisementStatus status,
        AdType adType,
        UUID campaignId,
        Instant startsFrom,
        Instant endsBefore,
        boolean activeOnly
) {

    public static AdvertisementFilter none() {
        return AdvertisementFilter.builder().build();
    }
}
