package com.vaultledger.api.dto;

import com.vaultledger.api.validation.BaseUnits;
import jakarta.validation.constraints.NotBlank;

/**
 * USD price (6 decimals) of one whole collateral token.
 */
public record AssetRevalueRequest(@NotBlank(message = "INVALID_AMOUNT") @BaseUnits String unitPriceUsd) {
}
