package com.premiergroup.ad_delivery_engine.dto;

import jakarta.validation.constraints.Size;

public record ApprovalRequest(@Size(max = 1000) String notes) {
}
