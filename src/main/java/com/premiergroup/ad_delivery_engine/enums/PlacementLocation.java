package com.premiergroup.ad_delivery_engine.enums;

public enum PlacementLocation {
    HOMEPAGE_BANNER,
    SEARCH_RESULTS,
    PRODUCT_DETAIL,
    CATEGORY_PAGE,
    MOBILE_APP,
    FARMER_DASHBOARD,
    MARKETPLACE,
    SIDEBAR
}
