package com.premiergroup.ad_delivery_engine.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * A top-up confirmed by the billing service.
 */
public record BudgetTopUpRequest(
        @NotNull @Positive BigDecimal amount,
        @Size(max = 100) String reference
) {
}
