package com.premiergroup.ad_delivery_engine.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed rule table: each threshold that is missed adds its two suggestions.
 */
@Component
public class ThresholdRecommendationStrategy implements RecommendationStrategy {

    private final BigDecimal ctrThreshold;
    private final BigDecimal cpcThreshold;
    private final long minImpressions;
    private final BigDecimal conversionRateThreshold;

    public ThresholdRecommendationStrategy(
            @Value("${ad-engine.recommendations.ctr-threshold:1.0}") BigDecimal ctrThreshold,
            @Value("${ad-engine.recommendations.cpc-threshold:0.50}") BigDecimal cpcThreshold,
            @Value("${ad-engine.recommendations.min-impressions:1000}") long minImpressions,
            @Value("${ad-engine.recommendations.conversion-rate-threshold:2.0}") BigDecimal conversionRateThreshold) {
        this.ctrThreshold = ctrThreshold;
        this.cpcThreshold = cpcThreshold;
        this.minImpressions = minImpressions;
        this.conversionRateThreshold = conversionRateThreshold;
    }

    @Override
    public List<String> recommend(PerformanceSnapshot snapshot) {
        List<String> recommendations = new ArrayList<>();

        if (snapshot.ctr().compareTo(ctrThreshold) < 0) {
            recommendations.add("Consider updating your ad creative to improve click-through rate");
            recommendations.add("Test different call-to-action buttons");
        }
        if (snapshot.cpc().compareTo(cpcThreshold) > 0) {
            recommendations.add("Your cost-per-click is high. Consider adjusting your targeting");
            recommendations.add("Review your bid strategy and consider lowering your bid amount");
        }
        if (snapshot.impressions() < minImpressions) {
            recommendations.add("Increase your budget to reach more potential customers");
            recommendations.add("Expand your geographic targeting");
        }
        if (snapshot.conversionRate().compareTo(conversionRateThreshold) < 0) {
            recommendations.add("Optimize your landing page for better conversions");
            recommendations.add("A/B test different ad messages");
        }
        return recommendations;
    }
}
