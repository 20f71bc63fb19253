package com.premiergroup.ad_delivery_engine.repository;

import com.premiergroup.ad_delivery_engine.entity.DailyAnalytics;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DailyAnalyticsRepository extends JpaRepository<DailyAnalytics, Long> {

    Optional<DailyAnalytics> findByAdvertisementIdAndStatsDate(UUID advertisementId, LocalDate statsDate);

    List<DailyAnalytics> findByAdvertisementIdAndStatsDateBetweenOrderByStatsDateAsc(
            UUID advertisementId,
            LocalDate start,
            LocalDate end
    );

    List<DailyAnalytics> findByAdvertisementIdInAndStatsDateBetween(
            Collection<UUID> advertisementIds,
            LocalDate start,
            LocalDate end
    );

    @Modifying
    @Query("DELETE FROM DailyAnalytics d WHERE d.advertisementId = :adId AND d.statsDate BETWEEN :start AND :end")
    int deleteWindow(@Param("adId") UUID advertisementId,
                     @Param("start") LocalDate start,
                     @Param("end") LocalDate end);
}
