package com.premiergroup.ad_delivery_engine.service;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class DeliveryBreakdownClassifierTest {

    @Test
    public void countryShouldUppercaseValidCodes() {
        assertThat(DeliveryBreakdownClassifier.country(Map.of("country", " gh "))).isEqualTo("GH");
        assertThat(DeliveryBreakdownClassifier.country(Map.of("country", "nga"))).isEqualTo("NGA");
    }

    @Test
    public void countryShouldFallBackToUnknown() {
        assertThat(DeliveryBreakdownClassifier.country(null)).isEqualTo("unknown");
        assertThat(DeliveryBreakdownClassifier.country(Map.of())).isEqualTo("unknown");
        assertThat(DeliveryBreakdownClassifier.country(Map.of("country", "Ghana"))).isEqualTo("unknown");
        assertThat(DeliveryBreakdownClassifier.country(Map.of("country", "G1"))).isEqualTo("unknown");
    }

    @Test
    public void deviceClassShouldRecognizeTablets() {
        assertThat(DeliveryBreakdownClassifier.deviceClass(Map.of("user_agent", "Mozilla/5.0 (iPad; CPU OS 17_0)")))
                .isEqualTo("tablet");
        assertThat(DeliveryBreakdownClassifier.deviceClass(Map.of("user_agent", "Mozilla/5.0 (Linux; Android 13; SM-X200)")))
                .isEqualTo("tablet");
    }

    @Test
    public void deviceClassShouldRecognizePhones() {
        assertThat(DeliveryBreakdownClassifier.deviceClass(Map.of("user_agent", "Mozilla/5.0 (Linux; Android 14) Mobile")))
                .isEqualTo("mobile");
        assertThat(DeliveryBreakdownClassifier.deviceClass(Map.of("user_agent", "Mozilla/5.0 (iPhone; CPU iPhone OS 17_0)")))
                .isEqualTo("mobile");
    }

    @Test
    public void deviceClassShouldDefaultToDesktopOrUnknown() {
        assertThat(DeliveryBreakdownClassifier.deviceClass(Map.of("user_agent", "Mozilla/5.0 (X11; Linux x86_64)")))
                .isEqualTo("desktop");
        assertThat(DeliveryBreakdownClassifier.deviceClass(Map.of("user_agent", "  "))).isEqualTo("unknown");
        assertThat(DeliveryBreakdownClassifier.deviceClass(null)).isEqualTo("unknown");
    }
}
