package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.AdvertisementResponse;
import com.premiergroup.ad_delivery_engine.dto.AssignmentResponse;
import com.premiergroup.ad_delivery_engine.dto.CampaignResponse;
import com.premiergroup.ad_delivery_engine.dto.DailyAnalyticsResponse;
import com.premiergroup.ad_delivery_engine.dto.PlacementResponse;
import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.entity.Campaign;
import com.premiergroup.ad_delivery_engine.entity.DailyAnalytics;
import com.premiergroup.ad_delivery_engine.entity.Placement;
import com.premiergroup.ad_delivery_engine.entity.PlacementAssignment;
import com.premiergroup.ad_delivery_engine.util.Micros;
import com.premiergroup.ad_delivery_engine.util.Ratios;

import java.time.Instant;

final class DtoMapper {

    private DtoMapper() {
    }

    static AdvertisementResponse toResponse(Advertisement ad, Instant now) {
        return AdvertisementResponse.builder()
                .id(ad.getId())
                .advertiserId(ad.getAdvertiserId())
                .title(ad.getTitle())
                .description(ad.getDescription())
                .adType(ad.getAdType())
                .campaignId(ad.getCampaign() == null ? null : ad.getCampaign().getId())
                .targeting(ad.getTargeting())
                .creative(ad.getCreative())
                .budget(Micros.toUnits(ad.getBudgetMicros()))
                .dailyBudget(Micros.toUnitsNullable(ad.getDailyBudgetMicros()))
                .bidAmount(Micros.toUnits(ad.getBidAmountMicros()))
                .pricingModel(ad.getPricingModel())
                .currency(ad.getCurrency())
                .scheduleStart(ad.getScheduleStart())
                .scheduleEnd(ad.getScheduleEnd())
                .status(ad.getStatus())
                .effectiveStatus(AdvertisementLifecycle.effectiveStatus(ad, now))
                .active(AdvertisementLifecycle.isActive(ad, now))
                .approvedBy(ad.getApprovedBy())
                .approvedAt(ad.getApprovedAt())
                .approvalNotes(ad.getApprovalNotes())
                .rejectionReason(ad.getRejectionReason())
                .impressions(ad.getImpressions())
                .clicks(ad.getClicks())
                .conversions(ad.getConversions())
                .amountSpent(Micros.toUnits(ad.getAmountSpentMicros()))
                .clickThroughRate(Ratios.percent(ad.getClicks(), ad.getImpressions()))
                .conversionRate(Ratios.percent(ad.getConversions(), ad.getClicks()))
                .costPerClick(Ratios.costPer(ad.getAmountSpentMicros(), ad.getClicks()))
                .costPerAcquisition(Ratios.costPer(ad.getAmountSpentMicros(), ad.getConversions()))
                .createdAt(ad.getCreatedAt())
                .updatedAt(ad.getUpdatedAt())
                .build();
    }

    static PlacementResponse toResponse(Placement placement) {
        return new PlacementResponse(
                placement.getId(),
                placement.getName(),
                placement.getLocation(),
                placement.getDimensions(),
                placement.getMaxCreativeSizeMb(),
                Micros.toUnits(placement.getPricePerImpressionMicros()),
                Micros.toUnits(placement.getPricePerClickMicros()),
                placement.isActive(),
                placement.getCreatedAt()
        );
    }

    static AssignmentResponse toResponse(PlacementAssignment assignment) {
        return new AssignmentResponse(
                assignment.getAdvertisement().getId(),
                assignment.getPlacement().getId(),
                assignment.getPlacement().getName(),
                assignment.getPriority(),
                assignment.getMaxImpressions(),
                assignment.getAssignedAt()
        );
    }

    static CampaignResponse toResponse(Campaign campaign, Instant now) {
        return new CampaignResponse(
                campaign.getId(),
                campaign.getName(),
                campaign.getDescription(),
                campaign.getCampaignType(),
                campaign.getManagerId(),
                Micros.toUnits(campaign.getTotalBudgetMicros()),
                campaign.getScheduleStart(),
                campaign.getScheduleEnd(),
                campaign.getTargetImpressions(),
                campaign.getTargetClicks(),
                campaign.getTargetConversions(),
                campaign.getTargetCtr(),
                campaign.isRunning(now),
                campaign.getCreatedAt()
        );
    }

    static DailyAnalyticsResponse toResponse(DailyAnalytics row) {
        return new DailyAnalyticsResponse(
                row.getAdvertisementId(),
                row.getStatsDate(),
                row.getImpressions(),
                row.getClicks(),
                row.getConversions(),
                Micros.toUnits(row.getAmountSpentMicros()),
                row.getCtr(),
                row.getCpc(),
                row.getCpa(),
                row.getDemographicBreakdown(),
                row.getGeographicBreakdown()
        );
    }
}
