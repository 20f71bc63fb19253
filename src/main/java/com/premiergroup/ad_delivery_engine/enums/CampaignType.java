package com.premiergroup.ad_delivery_engine.enums;

public enum CampaignType {
    SEASONAL,
    PRODUCT_LAUNCH,
    BRAND_AWARENESS,
    FARMER_EDUCATION,
    MARKET_EXPANSION
}
