package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.entity.Placement;
import com.premiergroup.ad_delivery_engine.enums.EventType;
import org.springframework.stereotype.Component;

/**
 * Price of a single delivery event, fixed at the moment it is recorded.
 * <ul>
 *     <li>CPM: impressions at the placement's impression price, else bid / 1000</li>
 *     <li>CPC: clicks at the placement's click price, else the bid</li>
 *     <li>CPA: conversions at the bid</li>
 *     <li>FLAT_RATE: nothing per event, settled by billing</li>
 * </ul>
 */
@Component
public class EventCostCalculator {

    public long costMicros(Advertisement ad, Placement placement, EventType eventType) {
        return switch (ad.getPricingModel()) {
            case CPM -> eventType == EventType.IMPRESSION
                    ? orFallback(placement.getPricePerImpressionMicros(), ad.getBidAmountMicros() / 1000)
                    : 0L;
            case CPC -> eventType == EventType.CLICK
                    ? orFallback(placement.getPricePerClickMicros(), ad.getBidAmountMicros())
                    : 0L;
            case CPA -> eventType == EventType.CONVERSION ? ad.getBidAmountMicros() : 0L;
            case FLAT_RATE -> 0L;
        };
    }

    private static long orFallback(long placementPrice, long bidPrice) {
        return placementPrice > 0 ? placementPrice : bidPrice;
    }
}
