package com.premiergroup.ad_delivery_engine.dto;

import com.premiergroup.ad_delivery_engine.enums.BulkAction;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

public record BulkActionRequest(
        @NotNull BulkAction action,
        @NotEmpty List<UUID> advertisementIds,
        String notes
) {
}
