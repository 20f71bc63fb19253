package com.premiergroup.ad_delivery_engine.repository;

import com.premiergroup.ad_delivery_engine.entity.Campaign;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface CampaignRepository extends JpaRepository<Campaign, UUID> {

    List<Campaign> findByManagerIdOrderByCreatedAtDesc(String managerId);

    List<Campaign> findAllByOrderByCreatedAtDesc();
}
