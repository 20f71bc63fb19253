package com.premiergroup.ad_delivery_engine.enums;

public enum AdType {
    PRODUCT_PROMOTION,
    FARMER_SPOTLIGHT,
    SEASONAL_CAMPAIGN,
    BRAND_AWARENESS,
    VALUE_ADDITION,
    EQUIPMENT_RENTAL,
    TRAINING_PROGRAM,
    MARKET_PRICE_ALERT
}
