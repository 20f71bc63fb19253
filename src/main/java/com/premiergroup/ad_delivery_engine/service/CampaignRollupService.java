package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.CampaignPerformance;
import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.entity.Campaign;
import com.premiergroup.ad_delivery_engine.exception.NotFoundException;
import com.premiergroup.ad_delivery_engine.repository.AdvertisementRepository;
import com.premiergroup.ad_delivery_engine.repository.CampaignRepository;
import com.premiergroup.ad_delivery_engine.util.Micros;
import com.premiergroup.ad_delivery_engine.util.Ratios;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Campaign figures, always summed from the member advertisements' counters at read time.
 */
@Service
@RequiredArgsConstructor
public class CampaignRollupService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CampaignRepository campaignRepository;
    private final AdvertisementRepository advertisementRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Transactional(readOnly = true)
    public CampaignPerformance getPerformance(Caller caller, UUID campaignId) {
        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> NotFoundException.of("Campaign", campaignId));
        accessPolicy.requireOwnerOrStaff(caller, campaign.getManagerId());
        return summarize(campaign, advertisementRepository.findByCampaign_Id(campaignId), clock.instant());
    }

    public CampaignPerformance summarize(Campaign campaign, List<Advertisement> advertisements, Instant now) {
        long impressions = advertisements.stream().mapToLong(Advertisement::getImpressions).sum();
        long clicks = advertisements.stream().mapToLong(Advertisement::getClicks).sum();
        long conversions = advertisements.stream().mapToLong(Advertisement::getConversions).sum();
        long spentMicros = advertisements.stream().mapToLong(Advertisement::getAmountSpentMicros).sum();

        BigDecimal ctr = Ratios.percent(clicks, impressions);
        return CampaignPerformance.builder()
                .campaignId(campaign.getId())
                .campaignName(campaign.getName())
                .active(campaign.isRunning(now))
                .totalAdvertisements(advertisements.size())
                .impressions(impressions)
                .clicks(clicks)
                .conversions(conversions)
                .totalSpent(Micros.toUnits(spentMicros))
                .totalBudget(Micros.toUnits(campaign.getTotalBudgetMicros()))
                .budgetRemaining(Micros.toUnits(Math.max(0L, campaign.getTotalBudgetMicros() - spentMicros)))
                .ctr(ctr)
                .conversionRate(Ratios.percent(conversions, clicks))
                .goalsProgress(new CampaignPerformance.GoalProgress(
                        progress(impressions, campaign.getTargetImpressions()),
                        progress(clicks, campaign.getTargetClicks()),
                        progress(conversions, campaign.getTargetConversions()),
                        ctrProgress(ctr, campaign.getTargetCtr())))
                .build();
    }

    private static BigDecimal progress(long actual, Long target) {
        return target == null || target <= 0 ? null : Ratios.percent(actual, target);
    }

    private static BigDecimal ctrProgress(BigDecimal ctr, BigDecimal targetCtr) {
        if (targetCtr == null || targetCtr.signum() <= 0) {
            return null;
        }
        return ctr.multiply(HUNDRED).divide(targetCtr, Ratios.SCALE, RoundingMode.HALF_UP);
    }
}
