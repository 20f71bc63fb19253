package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.entity.Advertisement;
import com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus;
import com.premiergroup.ad_delivery_engine.exception.InvalidStateException;
import com.premiergroup.ad_delivery_engine.exception.ValidationException;

import java.time.Instant;

import static com.premiergroup.ad_delivery_engine.enums.AdvertisementStatus.*;

/**
 * Advertisement state machine and the eligibility predicate.
 * <pre>
 * DRAFT -> PENDING_APPROVAL -> ACTIVE <-> PAUSED
 *                           -> REJECTED
 * ACTIVE -> COMPLETED (schedule over or budget exhausted)
 * </pre>
 * {@code EXPIRED} is only ever computed, see {@link #effectiveStatus(Advertisement, Instant)}.
 * All methods are pure over the advertisement's fields and {@code now}; nothing here is cached.
 */
public final class AdvertisementLifecycle {

    private AdvertisementLifecycle() {
    }

    public static boolean isActive(Advertisement ad, Instant now) {
        return ad.getStatus() == ACTIVE
                && !now.isBefore(ad.getScheduleStart())
                && !now.isAfter(ad.getScheduleEnd())
                && (ad.getDailyBudgetMicros() == null || ad.getAmountSpentMicros() < ad.getBudgetMicros());
    }

    public static AdvertisementStatus effectiveStatus(Advertisement ad, Instant now) {
        if (!ad.getStatus().isTerminal() && now.isAfter(ad.getScheduleEnd())) {
            return EXPIRED;
        }
        return ad.getStatus();
    }

    /**
     * Whether an active advertisement has run past its window or spent its whole budget.
     */
    public static boolean shouldComplete(Advertisement ad, Instant now) {
        return ad.getStatus() == ACTIVE
                && (now.isAfter(ad.getScheduleEnd()) || ad.getAmountSpentMicros() >= ad.getBudgetMicros());
    }

    public static void submit(Advertisement ad, Instant now) {
        requireStatus(ad, DRAFT, "submitted for approval");
        if (ad.getBudgetMicros() <= 0) {
            throw new ValidationException("Budget must be greater than 0");
        }
        if (!ad.getScheduleStart().isAfter(now)) {
            throw new ValidationException("Start date must be in the future");
        }
        if (ad.getCreative() == null || !ad.getCreative().hasCreative()) {
            throw new ValidationException("At least one creative asset is required");
        }
        transition(ad, PENDING_APPROVAL, now);
    }

    public static void approve(Advertisement ad, String approver, String notes, Instant now) {
        requireStatus(ad, PENDING_APPROVAL, "approved");
        if (approver == null || approver.isBlank()) {
            throw new ValidationException("Approver is required");
        }
        ad.setApprovedBy(approver);
        ad.setApprovedAt(now);
        ad.setApprovalNotes(notes);
        transition(ad, ACTIVE, now);
    }

    public static void reject(Advertisement ad, String reason, Instant now) {
        requireStatus(ad, PENDING_APPROVAL, "rejected");
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A rejection reason is required");
        }
        ad.setRejectionReason(reason);
        transition(ad, REJECTED, now);
    }

    public static void pause(Advertisement ad, Instant now) {
        requireStatus(ad, ACTIVE, "paused");
        transition(ad, PAUSED, now);
    }

    public static void resume(Advertisement ad, Instant now) {
        requireStatus(ad, PAUSED, "resumed");
        if (now.isAfter(ad.getScheduleEnd())) {
            throw new InvalidStateException("Cannot resume expired advertisement " + ad.getId());
        }
        transition(ad, ACTIVE, now);
    }

    public static void complete(Advertisement ad, Instant now) {
        requireStatus(ad, ACTIVE, "completed");
        transition(ad, COMPLETED, now);
    }

    private static void requireStatus(Advertisement ad, AdvertisementStatus expected, String action) {
        if (ad.getStatus() != expected) {
            throw new InvalidStateException("Only %s advertisements can be %s (current status: %s)"
                    .formatted(expected.name().toLowerCase(), action, ad.getStatus().name().toLowerCase()));
        }
    }

    private static void transition(Advertisement ad, AdvertisementStatus target, Instant now) {
        ad.setStatus(target);
        ad.setUpdatedAt(now);
    }
}
