package com.vaultledger.api.dto;

import com.vaultledger.api.validation.BaseUnits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * POST /solvency/repay and /solvency/withdraw.
 */
public record PositionAmountRequest(
        @NotNull(message = "INVALID_REQUEST")
        Long positionId,

        @NotBlank(message = "INVALID_AMOUNT")
        @BaseUnits
        String amount
) {
}
