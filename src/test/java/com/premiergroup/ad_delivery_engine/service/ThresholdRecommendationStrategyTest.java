package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.service.RecommendationStrategy.PerformanceSnapshot;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ThresholdRecommendationStrategyTest {

    private final ThresholdRecommendationStrategy strategy = new ThresholdRecommendationStrategy(
            new BigDecimal("1.0"), new BigDecimal("0.50"), 1000, new BigDecimal("2.0"));

    @Test
    public void recommendShouldReturnNothingForHealthyPerformance() {
        // given
        PerformanceSnapshot snapshot = new PerformanceSnapshot(
                new BigDecimal("3.5"), new BigDecimal("0.20"), 5000, new BigDecimal("4.0"));

        // when and then
        assertThat(strategy.recommend(snapshot)).isEmpty();
    }

    @Test
    public void recommendShouldReturnEveryRuleInOrderWhenAllThresholdsMissed() {
        // given
        PerformanceSnapshot snapshot = new PerformanceSnapshot(
                new BigDecimal("0.5"), new BigDecimal("1.20"), 10, new BigDecimal("1.0"));

        // when
        List<String> result = strategy.recommend(snapshot);

        // then
        assertThat(result).containsExactly(
                "Consider updating your ad creative to improve click-through rate",
                "Test different call-to-action buttons",
                "Your cost-per-click is high. Consider adjusting your targeting",
                "Review your bid strategy and consider lowering your bid amount",
                "Increase your budget to reach more potential customers",
                "Expand your geographic targeting",
                "Optimize your landing page for better conversions",
                "A/B test different ad messages");
    }

    @Test
    public void recommendShouldTreatThresholdsAsExclusive() {
        // given
        PerformanceSnapshot snapshot = new PerformanceSnapshot(
                new BigDecimal("1.0"), new BigDecimal("0.50"), 1000, new BigDecimal("2.0"));

        // when and then
        assertThat(strategy.recommend(snapshot)).isEmpty();
    }
}
