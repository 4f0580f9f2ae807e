package com.vaultledger.api.dto;

import com.vaultledger.api.validation.BaseUnits;
import com.vaultledger.api.validation.EvmAddress;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * The user already sent {@code repaymentAmount} of the stablecoin to the partner settlement address in
 * {@code transferTxHash}.
 */
public record RepayWithTransferRequest(
        @NotBlank(message = "INVALID_REQUEST")
        String partnerLoanId,

        @NotBlank(message = "INVALID_AMOUNT")
        @BaseUnits
        String repaymentAmount,

        @NotBlank(message = "INVALID_REQUEST")
        @Pattern(regexp = "^0x[0-9a-fA-F]{64}$", message = "INVALID_REQUEST")
        String transferTxHash,

        @NotBlank(message = "INVALID_ADDRESS")
        @EvmAddress
        String userWallet
) {
}
