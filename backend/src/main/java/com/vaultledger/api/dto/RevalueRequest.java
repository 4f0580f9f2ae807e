package com.vaultledger.api.dto;

import com.vaultledger.api.validation.BaseUnits;
import jakarta.validation.constraints.NotBlank;

public record RevalueRequest(@NotBlank(message = "INVALID_AMOUNT") @BaseUnits String valuationUsd) {
}
