package com.premiergroup.ad_delivery_engine.entity;

import com.premiergroup.ad_delivery_engine.enums.CampaignType;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Groups advertisements. Holds goals only; performance is always recomputed from member advertisements.
 */
@Entity
@Table(name = "campaigns")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = "advertisements")
@ToString(exclude = "advertisements")
public class Campaign {

    @Id
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "campaign_type", length = 30)
    private CampaignType campaignType;

    @Column(name = "manager_id", nullable = false, length = 64)
    private String managerId;

    @Column(name = "total_budget_micros", nullable = false)
    private long totalBudgetMicros;

    @Column(name = "schedule_start", nullable = false)
    private Instant scheduleStart;

    @Column(name = "schedule_end", nullable = false)
    private Instant scheduleEnd;

    @Column(name = "target_impressions")
    private Long targetImpressions;

    @Column(name = "target_clicks")
    private Long targetClicks;

    @Column(name = "target_conversions")
    private Long targetConversions;

    @Column(name = "target_ctr", precision = 7, scale = 4)
    private BigDecimal targetCtr;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @OneToMany(mappedBy = "campaign")
    private Set<Advertisement> advertisements;

    /**
     * Switched on and inside its schedule window at {@code now}.
     */
    public boolean isRunning(Instant now) {
        return active && !now.isBefore(scheduleStart) && !now.isAfter(scheduleEnd);
    }
}
