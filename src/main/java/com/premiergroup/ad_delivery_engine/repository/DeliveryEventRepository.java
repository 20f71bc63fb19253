package com.premiergroup.ad_delivery_engine.repository;

import com.premiergroup.ad_delivery_engine.entity.DeliveryEvent;
import com.premiergroup.ad_delivery_engine.enums.EventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface DeliveryEventRepository extends JpaRepository<DeliveryEvent, UUID> {

    List<DeliveryEvent> findByAdvertisementIdAndEventDate(UUID advertisementId, LocalDate eventDate);

    List<DeliveryEvent> findByAdvertisementIdOrderByOccurredAtAsc(UUID advertisementId);

    @Query("SELECT COALESCE(SUM(e.costMicros), 0) FROM DeliveryEvent e WHERE e.advertisementId = :adId")
    long sumCostByAdvertisementId(@Param("adId") UUID advertisementId);

    @Query("SELECT COALESCE(SUM(e.costMicros), 0) FROM DeliveryEvent e " +
            "WHERE e.advertisementId = :adId AND e.eventDate = :day")
    long sumCostByAdvertisementIdAndEventDate(@Param("adId") UUID advertisementId, @Param("day") LocalDate day);

    long countByAdvertisementIdAndEventTypeAndOrphanedFalse(UUID advertisementId, EventType eventType);

    long countByAdvertisementIdAndPlacementIdAndEventTypeAndOrphanedFalse(
            UUID advertisementId,
            Long placementId,
            EventType eventType
    );

    @Query("SELECT DISTINCT e.advertisementId FROM DeliveryEvent e WHERE e.eventDate BETWEEN :start AND :end")
    List<UUID> findAdvertisementIdsWithEventsBetween(@Param("start") LocalDate start, @Param("end") LocalDate end);

    @Query("SELECT DISTINCT e.advertisementId, e.eventDate FROM DeliveryEvent e " +
            "WHERE e.advertisementId IN :adIds AND e.orphaned = false AND e.eventDate BETWEEN :start AND :end")
    List<Object[]> findEventDaysBetween(@Param("adIds") Collection<UUID> advertisementIds,
                                        @Param("start") LocalDate start,
                                        @Param("end") LocalDate end);

    @Query("SELECT e.eventType, COUNT(e) FROM DeliveryEvent e " +
            "WHERE e.advertisementId IN :adIds AND e.orphaned = false AND e.occurredAt >= :since " +
            "GROUP BY e.eventType")
    List<Object[]> countByTypeSince(@Param("adIds") Collection<UUID> advertisementIds,
                                    @Param("since") Instant since);

    @Query("SELECT p.location, e.eventType, COUNT(e) FROM DeliveryEvent e, Placement p " +
            "WHERE p.id = e.placementId AND e.advertisementId IN :adIds AND e.orphaned = false " +
            "GROUP BY p.location, e.eventType")
    List<Object[]> countByPlacementLocation(@Param("adIds") Collection<UUID> advertisementIds);
}
