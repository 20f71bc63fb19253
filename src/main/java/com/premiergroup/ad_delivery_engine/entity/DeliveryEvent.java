package com.premiergroup.ad_delivery_engine.entity;

import com.premiergroup.ad_delivery_engine.enums.EventType;
import com.premiergroup.ad_delivery_engine.enums.OrphanReason;
import com.premiergroup.ad_delivery_engine.util.JsonMapConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only delivery log entry. The advertisement and placement are plain ids, not associations, so the
 * log outlives deleted advertisements.
 */
@Entity
@Immutable
@Table(name = "delivery_events", indexes = {
        @Index(name = "idx_events_ad_date", columnList = "advertisement_id, event_date"),
        @Index(name = "idx_events_ad_placement_type", columnList = "advertisement_id, placement_id, event_type"),
        @Index(name = "idx_events_date", columnList = "event_date")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@ToString
public class DeliveryEvent implements Persistable<UUID> {

    @Id
    private UUID id;

    @Column(name = "advertisement_id", nullable = false)
    private UUID advertisementId;

    @Column(name = "placement_id", nullable = false)
    private Long placementId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 20)
    private EventType eventType;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    /** Calendar day of {@code occurredAt} in the analytics zone; partition key for retention. */
    @Column(name = "event_date", nullable = false)
    private LocalDate eventDate;

    @Column(name = "cost_micros", nullable = false)
    private long costMicros;

    @Column(name = "user_reference", length = 64)
    private String userReference;

    @Column(name = "session_id", length = 100)
    private String sessionId;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 4000)
    private Map<String, String> metadata;

    private boolean orphaned;

    @Enumerated(EnumType.STRING)
    @Column(name = "orphan_reason", length = 30)
    private OrphanReason orphanReason;

    /** Events are only ever inserted. */
    @Override
    public boolean isNew() {
        return true;
    }
}
