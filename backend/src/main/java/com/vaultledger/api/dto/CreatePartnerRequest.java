package com.vaultledger.api.dto;

import com.vaultledger.api.validation.BaseUnits;
import com.vaultledger.api.validation.EvmAddress;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * POST /partners/admin. platformFeeBps is optional.
 */
public record CreatePartnerRequest(
        @NotBlank(message = "INVALID_REQUEST")
        String name,

        @NotBlank(message = "INVALID_REQUEST")
        @Pattern(regexp = "^[a-z0-9]{2,16}$", message = "INVALID_REQUEST")
        String prefix,

        String tier,

        @NotBlank(message = "INVALID_AMOUNT")
        @BaseUnits
        String dailyBorrowLimit,

        @NotBlank(message = "INVALID_AMOUNT")
        @BaseUnits
        String totalBorrowLimit,

        @Min(value = 0, message = "INVALID_REQUEST")
        @Max(value = 10_000, message = "INVALID_REQUEST")
        Integer platformFeeBps,

        @NotBlank(message = "INVALID_ADDRESS")
        @EvmAddress
        String settlementAddress
) {
}
