package com.premiergroup.ad_delivery_engine.entity;

import com.premiergroup.ad_delivery_engine.enums.AdType;
import com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus;
import com.premiergroup.ad_delivery_engine.enums.PricingModel;
import com.premiergroup.ad_delivery_engine.util.TargetingConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * An advertiser's ad with its schedule, budget and cumulative delivery counters.
 * <p>
 * The counters ({@code impressions}, {@code clicks}, {@code conversions}, {@code amountSpentMicros}) are written
 * only by the budget ledger while it holds the row lock.
 */
@Entity
@Table(name = "advertisements", indexes = {
        @Index(name = "idx_ads_advertiser_status", columnList = "advertiser_id, status"),
        @Index(name = "idx_ads_schedule", columnList = "schedule_start, schedule_end"),
        @Index(name = "idx_ads_campaign", columnList = "campaign_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = {"assignments", "campaign"})
@ToString(exclude = {"assignments", "campaign"})
public class Advertisement {

    @Id
    private UUID id;

    @Version
    private Long version;

    @Column(name = "advertiser_id", nullable = false, length = 64)
    private String advertiserId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "ad_type", nullable = false, length = 30)
    private AdType adType;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_id")
    private Campaign campaign;

    @Convert(converter = TargetingConverter.class)
    @Column(length = 4000)
    private Targeting targeting;

    @Embedded
    private CreativeAssets creative;

    @Column(name = "budget_micros", nullable = false)
    private long budgetMicros;

    @Column(name = "daily_budget_micros")
    private Long dailyBudgetMicros;

    @Column(name = "bid_amount_micros", nullable = false)
    private long bidAmountMicros;

    @Enumerated(EnumType.STRING)
    @Column(name = "pricing_model", nullable = false, length = 20)
    private PricingModel pricingModel;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "schedule_start", nullable = false)
    private Instant scheduleStart;

    @Column(name = "schedule_end", nullable = false)
    private Instant scheduleEnd;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AdvertisementStatus status;

    @Column(name = "approval_notes", length = 1000)
    private String approvalNotes;

    @Column(name = "rejection_reason", length = 1000)
    private String rejectionReason;

    @Column(name = "approved_by", length = 64)
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    // ===== Counters =====
    private long impressions;
    private long clicks;
    private long conversions;

    @Column(name = "amount_spent_micros", nullable = false)
    private long amountSpentMicros;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "advertisement", cascade = CascadeType.ALL, orphanRemoval = true)
    @Builder.Default
    private Set<PlacementAssignment> assignments = new HashSet<>();

    public long remainingBudgetMicros() {
        return Math.max(0L, budgetMicros - amountSpentMicros);
    }
}
