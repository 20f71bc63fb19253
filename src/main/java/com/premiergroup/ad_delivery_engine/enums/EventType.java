package com.premiergroup.ad_delivery_engine.enums;

public enum EventType {
    IMPRESSION,
    CLICK,
    CONVERSION,
    VIEW,
    ENGAGEMENT
}
