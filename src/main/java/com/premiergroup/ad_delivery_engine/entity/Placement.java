package com.premiergroup.ad_delivery_engine.entity;

import com.premiergroup.ad_delivery_engine.enums.PlacementLocation;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Set;

@Entity
@Table(name = "placements")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = "assignments")
@ToString(exclude = "assignments")
public class Placement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private PlacementLocation location;

    @Column(length = 20)
    private String dimensions;              // e.g. 728x90, 300x250

    @Column(name = "max_creative_size_mb")
    private Integer maxCreativeSizeMb;

    @Column(name = "price_per_impression_micros", nullable = false)
    private long pricePerImpressionMicros;

    @Column(name = "price_per_click_micros", nullable = false)
    private long pricePerClickMicros;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @OneToMany(mappedBy = "placement")
    private Set<PlacementAssignment> assignments;
}
