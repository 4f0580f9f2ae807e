package com.vaultledger.api.dto;

import jakarta.validation.constraints.NotBlank;

public record LiquidateRequest(@NotBlank(message = "INVALID_REQUEST") String marketplaceListingId) {
}
