package com.premiergroup.ad_delivery_engine.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.stream.Stream;

/**
 * References to creatives hosted by the asset store. Only presence is checked here.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreativeAssets {

    @Column(name = "banner_image_url", length = 500)
    private String bannerImageUrl;

    @Column(name = "banner_mobile_url", length = 500)
    private String bannerMobileUrl;

    @Column(name = "video_url", length = 500)
    private String videoUrl;

    @Column(name = "landing_page_url", length = 500)
    private String landingPageUrl;

    @Column(name = "call_to_action", length = 50)
    private String callToAction;

    public boolean hasCreative() {
        return Stream.of(bannerImageUrl, bannerMobileUrl, videoUrl)
                .anyMatch(url -> url != null && !url.isBlank());
    }
}
