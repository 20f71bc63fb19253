package com.premiergroup.ad_delivery_engine.enums;

/**
 * Why a delivery event was kept for audit without being charged or counted.
 */
public enum OrphanReason {
    ADVERTISEMENT_NOT_FOUND,
    NOT_ASSIGNED,
    NOT_ELIGIBLE
}
