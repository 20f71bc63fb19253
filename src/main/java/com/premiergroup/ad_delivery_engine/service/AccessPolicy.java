package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.exception.ForbiddenOperationException;
import org.springframework.stereotype.Component;

/**
 * Ownership rules: owners act on their own advertisements and campaigns, staff on everything.
 */
@Component
public class AccessPolicy {

    public void requireIdentified(Caller caller) {
        if (caller == null || !caller.isIdentified()) {
            throw new ForbiddenOperationException("Caller identity is required");
        }
    }

    public void requireOwnerOrStaff(Caller caller, String ownerId) {
        requireIdentified(caller);
        if (!caller.staff() && !caller.id().equals(ownerId)) {
            throw new ForbiddenOperationException("Caller " + caller.id() + " does not own this resource");
        }
    }

    public void requireStaff(Caller caller) {
        requireIdentified(caller);
        if (!caller.staff()) {
            throw new ForbiddenOperationException("Staff privileges are required");
        }
    }
}
