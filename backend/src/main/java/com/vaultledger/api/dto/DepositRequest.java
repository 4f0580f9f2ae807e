package com.vaultledger.api.dto;

import com.vaultledger.api.validation.BaseUnits;
import com.vaultledger.api.validation.EvmAddress;
import com.vaultledger.domain.CollateralClass;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * POST /solvency/deposit. Amounts are base-unit decimal strings; valuationUsd has 6 decimals.
 */
public record DepositRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        @EvmAddress
        String collateralToken,

        @NotBlank(message = "INVALID_AMOUNT")
        @BaseUnits
        String collateralAmount,

        @NotBlank(message = "INVALID_AMOUNT")
        @BaseUnits
        String valuationUsd,

        @NotNull(message = "INVALID_REQUEST")
        CollateralClass collateralClass
) {
}
