package com.premiergroup.ad_delivery_engine.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "placement_assignments",
        uniqueConstraints = @UniqueConstraint(columnNames = {"advertisement_id", "placement_id"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"advertisement", "placement"})
public class PlacementAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "advertisement_id", nullable = false)
    private Advertisement advertisement;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "placement_id", nullable = false)
    private Placement placement;

    /** 1 = highest. */
    @Column(nullable = false)
    private int priority;

    @Column(name = "max_impressions")
    private Long maxImpressions;

    @Column(name = "assigned_at", nullable = false)
    private Instant assignedAt;
}
