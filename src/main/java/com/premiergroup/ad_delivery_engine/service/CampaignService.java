package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.CampaignResponse;
import com.premiergroup.ad_delivery_engine.dto.CreateCampaignRequest;
import com.premiergroup.ad_delivery_engine.entity.Campaign;
import com.premiergroup.ad_delivery_engine.exception.NotFoundException;
import com.premiergroup.ad_delivery_engine.exception.ValidationException;
import com.premiergroup.ad_delivery_engine.repository.CampaignRepository;
import com.premiergroup.ad_delivery_engine.util.Micros;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
@Log4j2
@RequiredArgsConstructor
public class CampaignService {

    private final CampaignRepository campaignRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Transactional
    public CampaignResponse create(Caller caller, CreateCampaignRequest request) {
        accessPolicy.requireIdentified(caller);
        if (request.totalBudget() == null || request.totalBudget().signum() <= 0) {
            throw new ValidationException("Total budget must be greater than 0");
        }
        if (request.scheduleStart() == null || request.scheduleEnd() == null
                || !request.scheduleStart().isBefore(request.scheduleEnd())) {
            throw new ValidationException("End date must be after start date");
        }

        Campaign campaign = Campaign.builder()
                .id(UUID.randomUUID())
                .name(request.name().trim())
                .description(request.description())
                .campaignType(request.campaignType())
                .managerId(caller.id())
                .totalBudgetMicros(Micros.fromUnits(request.totalBudget()))
                .scheduleStart(request.scheduleStart())
                .scheduleEnd(request.scheduleEnd())
                .targetImpressions(request.targetImpressions())
                .targetClicks(request.targetClicks())
                .targetConversions(request.targetConversions())
                .targetCtr(request.targetCtr())
                .active(true)
                .createdAt(clock.instant())
                .build();
        campaign = campaignRepository.save(campaign);
        log.info("Campaign {} created by {}", campaign.getId(), caller.id());
        return DtoMapper.toResponse(campaign, clock.instant());
    }

    /**
     * Managers see their own campaigns, staff see all of them.
     */
    @Transactional(readOnly = true)
    public List<CampaignResponse> list(Caller caller) {
        accessPolicy.requireIdentified(caller);
        List<Campaign> campaigns = caller.staff()
                ? campaignRepository.findAllByOrderByCreatedAtDesc()
                : campaignRepository.findByManagerIdOrderByCreatedAtDesc(caller.id());
        Instant now = clock.instant();
        return campaigns.stream().map(c -> DtoMapper.toResponse(c, now)).toList();
    }

    @Transactional(readOnly = true)
    public CampaignResponse get(Caller caller, UUID id) {
        Campaign campaign = getEntity(id);
        accessPolicy.requireOwnerOrStaff(caller, campaign.getManagerId());
        return DtoMapper.toResponse(campaign, clock.instant());
    }

    Campaign getEntity(UUID id) {
        return campaignRepository.findById(id).orElseThrow(() -> NotFoundException.of("Campaign", id));
    }
}
