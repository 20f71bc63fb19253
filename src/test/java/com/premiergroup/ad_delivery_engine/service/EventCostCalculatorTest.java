package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.entity.Placement;
import com.premiergroup.ad_delivery_engine.enums.EventType;
import com.premiergroup.ad_delivery_engine.enums.PricingModel;
import com.premiergroup.ad_delivery_engine.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

public class EventCostCalculatorTest {

    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    private final EventCostCalculator calculator = new EventCostCalculator();

    @Test
    public void cpcShouldChargePlacementClickPriceWhenSet() {
        // given
        Advertisement ad = Fixtures.activeAd("adv-1", NOW).build();
        Placement placement = Fixtures.placement(NOW).pricePerClickMicros(2_500_000L).build();

        // when and then
        assertThat(calculator.costMicros(ad, placement, EventType.CLICK)).isEqualTo(2_500_000L);
        assertThat(calculator.costMicros(ad, placement, EventType.IMPRESSION)).isZero();
    }

    @Test
    public void cpcShouldFallBackToBidWithoutPlacementPrice() {
        // given
        Advertisement ad = Fixtures.activeAd("adv-1", NOW).build();
        Placement placement = Fixtures.placement(NOW).build();

        // when and then
        assertThat(calculator.costMicros(ad, placement, EventType.CLICK)).isEqualTo(5_000_000L);
    }

    @Test
    public void cpmShouldChargeBidPerThousandImpressions() {
        // given
        Advertisement ad = Fixtures.activeAd("adv-1", NOW)
                .pricingModel(PricingModel.CPM)
                .bidAmountMicros(8_000_000L)
                .build();
        Placement placement = Fixtures.placement(NOW).build();

        // when and then
        assertThat(calculator.costMicros(ad, placement, EventType.IMPRESSION)).isEqualTo(8_000L);
        assertThat(calculator.costMicros(ad, placement, EventType.CLICK)).isZero();
    }

    @Test
    public void cpaShouldChargeOnlyConversions() {
        // given
        Advertisement ad = Fixtures.activeAd("adv-1", NOW).pricingModel(PricingModel.CPA).build();
        Placement placement = Fixtures.placement(NOW).pricePerClickMicros(1_000_000L).build();

        // when and then
        assertThat(calculator.costMicros(ad, placement, EventType.CONVERSION)).isEqualTo(5_000_000L);
        assertThat(calculator.costMicros(ad, placement, EventType.CLICK)).isZero();
    }

    @Test
    public void flatRateShouldNeverChargePerEvent() {
        // given
        Advertisement ad = Fixtures.activeAd("adv-1", NOW).pricingModel(PricingModel.FLAT_RATE).build();
        Placement placement = Fixtures.placement(NOW).pricePerImpressionMicros(1_000L).build();

        // when and then
        assertThat(calculator.costMicros(ad, placement, EventType.IMPRESSION)).isZero();
    }
}
