package com.vaultledger.api.dto;

import com.vaultledger.api.validation.BaseUnits;
import jakarta.validation.constraints.NotBlank;

public record PartnerRepayRequest(
        @NotBlank(message = "INVALID_REQUEST")
        String partnerLoanId,

        @NotBlank(message = "INVALID_AMOUNT")
        @BaseUnits
        String repaymentAmount
) {
}
