package com.vaultledger.api.dto;

import com.vaultledger.api.validation.BaseUnits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record BorrowRequest(
        @NotNull(message = "INVALID_REQUEST")
        Long positionId,

        @NotBlank(message = "INVALID_AMOUNT")
        @BaseUnits
        String amount,

        @NotNull(message = "INVALID_REQUEST")
        @Positive(message = "INVALID_REQUEST")
        Long loanDurationSeconds,

        @NotNull(message = "INVALID_REQUEST")
        @Positive(message = "INVALID_REQUEST")
        Integer numberOfInstallments
) {
}
