package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.AdvertisementResponse;
import com.premiergroup.ad_delivery_engine.dto.BudgetTopUpRequest;
import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.dto.LedgerReconciliation;
import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus;
import com.premiergroup.ad_delivery_engine.enums.EventType;
import com.premiergroup.ad_delivery_engine.exception.BudgetExceededException;
import com.premiergroup.ad_delivery_engine.exception.NotFoundException;
import com.premiergroup.ad_delivery_engine.exception.ValidationException;
import com.premiergroup.ad_delivery_engine.repository.AdvertisementRepository;
import com.premiergroup.ad_delivery_engine.repository.DeliveryEventRepository;
import com.premiergroup.ad_delivery_engine.util.Micros;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * The only writer of advertisement counters. Spend always equals the sum of charged event costs.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class BudgetLedgerService {

    private final AdvertisementRepository advertisementRepository;
    private final DeliveryEventRepository eventRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    /**
     * Applies one accepted event to an advertisement the caller holds under lock. The cost is clipped to the
     * remaining budget; the advertisement completes once nothing remains.
     *
     * @return the cost actually charged, in micros
     * @throws BudgetExceededException when a priced event arrives and no budget is left
     */
    @Transactional(propagation = Propagation.MANDATORY, noRollbackFor = BudgetExceededException.class)
    public long charge(Advertisement ad, EventType eventType, long costMicros, Instant now) {
        long remaining = ad.remainingBudgetMicros();
        if (costMicros > 0 && remaining == 0) {
            throw new BudgetExceededException("Advertisement " + ad.getId() + " has no budget left");
        }

        long charged = Math.min(costMicros, remaining);
        if (charged < costMicros) {
            log.info("Clipped {} charge for advertisement {} from {} to {} micros",
                    eventType, ad.getId(), costMicros, charged);
        }

        switch (eventType) {
            case IMPRESSION -> ad.setImpressions(ad.getImpressions() + 1);
            case CLICK -> ad.setClicks(ad.getClicks() + 1);
            case CONVERSION -> ad.setConversions(ad.getConversions() + 1);
            default -> {
                // views and engagements are logged but have no counter
            }
        }
        ad.setAmountSpentMicros(ad.getAmountSpentMicros() + charged);
        ad.setUpdatedAt(now);

        if (ad.remainingBudgetMicros() == 0 && ad.getStatus() == AdvertisementStatus.ACTIVE) {
            AdvertisementLifecycle.complete(ad, now);
            log.info("Advertisement {} exhausted its budget of {} and is now completed",
                    ad.getId(), Micros.toUnits(ad.getBudgetMicros()));
        }
        return charged;
    }

    public long todaySpendMicros(UUID advertisementId, LocalDate today) {
        return eventRepository.sumCostByAdvertisementIdAndEventDate(advertisementId, today);
    }

    /**
     * Soft cap: an advertisement whose spend for {@code today} reached its daily budget stops being served.
     */
    public boolean isWithinDailyBudget(Advertisement ad, LocalDate today) {
        if (ad.getDailyBudgetMicros() == null) {
            return true;
        }
        return todaySpendMicros(ad.getId(), today) < ad.getDailyBudgetMicros();
    }

    /**
     * Raises the budget ceiling after the billing service confirmed a payment. A completed advertisement
     * stays completed.
     */
    @Transactional
    public AdvertisementResponse topUp(Caller caller, UUID advertisementId, BudgetTopUpRequest request) {
        accessPolicy.requireStaff(caller);
        if (request.amount() == null || request.amount().signum() <= 0) {
            throw new ValidationException("Top-up amount must be greater than 0");
        }

        Advertisement ad = lock(advertisementId);
        long amountMicros = Micros.fromUnits(request.amount());
        Instant now = clock.instant();
        ad.setBudgetMicros(Math.addExact(ad.getBudgetMicros(), amountMicros));
        ad.setUpdatedAt(now);
        log.info("Budget of advertisement {} raised by {} (reference {})",
                advertisementId, request.amount(), request.reference());
        return DtoMapper.toResponse(advertisementRepository.save(ad), now);
    }

    /**
     * Compares counters with the delivery log. With {@code repair} the counters are rewritten from the log.
     */
    @Transactional
    public LedgerReconciliation reconcile(Caller caller, UUID advertisementId, boolean repair) {
        accessPolicy.requireStaff(caller);
        Advertisement ad = lock(advertisementId);

        long impressions = eventRepository.countByAdvertisementIdAndEventTypeAndOrphanedFalse(
                advertisementId, EventType.IMPRESSION);
        long clicks = eventRepository.countByAdvertisementIdAndEventTypeAndOrphanedFalse(
                advertisementId, EventType.CLICK);
        long conversions = eventRepository.countByAdvertisementIdAndEventTypeAndOrphanedFalse(
                advertisementId, EventType.CONVERSION);
        long spent = eventRepository.sumCostByAdvertisementId(advertisementId);

        boolean drift = impressions != ad.getImpressions()
                || clicks != ad.getClicks()
                || conversions != ad.getConversions()
                || spent != ad.getAmountSpentMicros();

        LedgerReconciliation result = LedgerReconciliation.builder()
                .advertisementId(advertisementId)
                .counterImpressions(ad.getImpressions())
                .loggedImpressions(impressions)
                .counterClicks(ad.getClicks())
                .loggedClicks(clicks)
                .counterConversions(ad.getConversions())
                .loggedConversions(conversions)
                .counterSpentMicros(ad.getAmountSpentMicros())
                .loggedSpentMicros(spent)
                .drift(drift)
                .repaired(drift && repair)
                .build();

        if (drift) {
            log.warn("Ledger drift on advertisement {}: {}", advertisementId, result);
            if (repair) {
                ad.setImpressions(impressions);
                ad.setClicks(clicks);
                ad.setConversions(conversions);
                ad.setAmountSpentMicros(spent);
                ad.setUpdatedAt(clock.instant());
                advertisementRepository.save(ad);
                log.info("Counters of advertisement {} rewritten from the delivery log", advertisementId);
            }
        }
        return result;
    }

    private Advertisement lock(UUID advertisementId) {
        return advertisementRepository.findByIdForUpdate(advertisementId)
                .orElseThrow(() -> NotFoundException.of("Advertisement", advertisementId));
    }
}
