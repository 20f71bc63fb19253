package com.premiergroup.ad_delivery_engine.repository;

import com.premiergroup.ad_delivery_engine.entity.PlacementAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PlacementAssignmentRepository extends JpaRepository<PlacementAssignment, Long> {

    @Query("SELECT pa FROM PlacementAssignment pa JOIN FETCH pa.advertisement WHERE pa.placement.id = :placementId")
    List<PlacementAssignment> findWithAdvertisementByPlacementId(@Param("placementId") Long placementId);

    Optional<PlacementAssignment> findByAdvertisement_IdAndPlacement_Id(UUID advertisementId, Long placementId);

    List<PlacementAssignment> findByAdvertisement_IdOrderByPriorityAsc(UUID advertisementId);

    boolean existsByPlacement_Id(Long placementId);
}
