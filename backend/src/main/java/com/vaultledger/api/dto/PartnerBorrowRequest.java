package com.vaultledger.api.dto;

import com.vaultledger.api.validation.BaseUnits;
import com.vaultledger.api.validation.EvmAddress;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record PartnerBorrowRequest(
        @NotBlank(message = "INVALID_REQUEST")
        @Size(max = 128, message = "INVALID_REQUEST")
        String partnerLoanId,

        @NotBlank(message = "INVALID_ADDRESS")
        @EvmAddress
        String userWallet,

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
