package com.premiergroup.ad_delivery_engine.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.premiergroup.ad_delivery_engine.util.JsonCountsConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * Per-advertisement daily rollup. Derived from the delivery log and safe to drop and rebuild.
 */
@Entity
@Table(name = "daily_analytics",
        uniqueConstraints = @UniqueConstraint(columnNames = {"advertisement_id", "stats_date"}),
        indexes = @Index(name = "idx_daily_analytics_date", columnList = "stats_date"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties({"hibernateLazyInitializer", "handler"})
public class DailyAnalytics {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(name = "advertisement_id", nullable = false)
    private UUID advertisementId;

    @Column(name = "stats_date", nullable = false)
    private LocalDate statsDate;

    private long impressions;
    private long clicks;
    private long conversions;

    @Column(name = "amount_spent_micros", nullable = false)
    private long amountSpentMicros;

    @Column(precision = 12, scale = 4)
    private BigDecimal ctr;

    @Column(precision = 19, scale = 4)
    private BigDecimal cpc;

    @Column(precision = 19, scale = 4)
    private BigDecimal cpa;

    @Convert(converter = JsonCountsConverter.class)
    @Column(name = "demographic_breakdown", length = 4000)
    private Map<String, Long> demographicBreakdown;

    @Convert(converter = JsonCountsConverter.class)
    @Column(name = "geographic_breakdown", length = 4000)
    private Map<String, Long> geographicBreakdown;
}
