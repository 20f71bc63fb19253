package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.BulkActionRequest;
import com.premiergroup.ad_delivery_engine.dto.BulkItemResult;
import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.exception.AdEngineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

/**
 * Staff batch actions. Each advertisement goes through the single-item transition in its own transaction;
 * one failure never affects the other items.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class BulkActionService {

    private final AdvertisementService advertisementService;
    private final AccessPolicy accessPolicy;

    public List<BulkItemResult> apply(Caller caller, BulkActionRequest request) {
        accessPolicy.requireStaff(caller);

        List<BulkItemResult> results = new ArrayList<>();
        for (UUID id : new LinkedHashSet<>(request.advertisementIds())) {
            try {
                switch (request.action()) {
                    case APPROVE -> advertisementService.approve(caller, id, request.notes());
                    case PAUSE -> advertisementService.pause(caller, id);
                    case RESUME -> advertisementService.resume(caller, id);
                }
                results.add(BulkItemResult.ok(id));
            } catch (AdEngineException e) {
                results.add(BulkItemResult.failed(id, e.getErrorType(), e.getMessage()));
            }
        }

        long failed = results.stream().filter(r -> !r.success()).count();
        log.info("Bulk {} by {}: {} succeeded, {} failed",
                request.action(), caller.id(), results.size() - failed, failed);
        return results;
    }
}
