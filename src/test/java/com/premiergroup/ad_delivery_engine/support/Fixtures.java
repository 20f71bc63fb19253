package com.premiergroup.ad_delivery_engine.support;

import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.entity.CreativeAssets;
import com.premiergroup.ad_delivery_engine.entity.Placement;
import com.premiergroup.ad_delivery_engine.enums.AdType;
import com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus;
import com.premiergroup.ad_delivery_engine.enums.PlacementLocation;
import com.premiergroup.ad_delivery_engine.enums.PricingModel;
import com.premiergroup.ad_delivery_engine.util.Micros;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public final class Fixtures {

    private Fixtures() {
    }

    /**
     * An approved CPC advertisement running from a day before {@code now} to thirty days after it.
     */
    public static Advertisement.AdvertisementBuilder activeAd(String advertiserId, Instant now) {
        return Advertisement.builder()
                .id(UUID.randomUUID())
                .advertiserId(advertiserId)
                .title("Fresh maize seedlings")
                .adType(AdType.PRODUCT_PROMOTION)
                .creative(CreativeAssets.builder()
                        .bannerImageUrl("https://cdn.example.com/banner.png")
                        .callToAction("Learn More")
                        .build())
                .budgetMicros(Micros.fromUnits(new BigDecimal("100")))
                .bidAmountMicros(Micros.fromUnits(new BigDecimal("5")))
                .pricingModel(PricingModel.CPC)
                .currency("GHS")
                .scheduleStart(now.minus(Duration.ofDays(1)))
                .scheduleEnd(now.plus(Duration.ofDays(30)))
                .status(AdvertisementStatus.ACTIVE)
                .createdAt(now.minus(Duration.ofDays(2)))
                .updatedAt(now.minus(Duration.ofDays(2)));
    }

    public static Placement.PlacementBuilder placement(Instant now) {
        return Placement.builder()
                .name("placement-" + UUID.randomUUID())
                .location(PlacementLocation.HOMEPAGE_BANNER)
                .dimensions("728x90")
                .maxCreativeSizeMb(5)
                .active(true)
                .createdAt(now);
    }
}
