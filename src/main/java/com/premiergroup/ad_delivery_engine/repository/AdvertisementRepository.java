package com.premiergroup.ad_delivery_engine.repository;

import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AdvertisementRepository extends JpaRepository<Advertisement, UUID>,
        JpaSpecificationExecutor<Advertisement> {

    /**
     * Loads the row under a write lock so counter updates for one advertisement are serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Advertisement a WHERE a.id = :id")
    Optional<Advertisement> findByIdForUpdate(@Param("id") UUID id);

    List<Advertisement> findByCampaign_Id(UUID campaignId);

    List<Advertisement> findByAdvertiserId(String advertiserId);

    long countByCampaign_Id(UUID campaignId);

    /**
     * Lazy completion. Touches only the status column so concurrent counter writers are not overwritten.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = false)
    @Query("UPDATE Advertisement a SET a.status = :completed, a.updatedAt = :now " +
            "WHERE a.id = :id AND a.status = :active")
    int markCompleted(@Param("id") UUID id,
                      @Param("now") Instant now,
                      @Param("active") AdvertisementStatus active,
                      @Param("completed") AdvertisementStatus completed);
}
