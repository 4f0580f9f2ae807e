package com.vaultledger.api.dto;

import com.vaultledger.domain.PartnerStatus;
import jakarta.validation.constraints.NotNull;

public record PartnerStatusRequest(@NotNull(message = "INVALID_REQUEST") PartnerStatus status) {
}
