package com.premiergroup.ad_delivery_engine.enums;

public enum PricingModel {
    CPM,
    CPC,
    CPA,
    FLAT_RATE
}
