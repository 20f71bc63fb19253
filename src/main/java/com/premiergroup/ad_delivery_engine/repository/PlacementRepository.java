package com.premiergroup.ad_delivery_engine.repository;

import com.premiergroup.ad_delivery_engine.entity.Placement;
import com.premiergroup.ad_delivery_engine.enums.PlacementLocation;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface PlacementRepository extends JpaRepository<Placement, Long> {

    Optional<Placement> findByName(String name);

    boolean existsByName(String name);

    List<Placement> findByActiveOrderByLocationAscNameAsc(boolean active);

    List<Placement> findByLocationAndActiveOrderByNameAsc(PlacementLocation location, boolean active);
}
