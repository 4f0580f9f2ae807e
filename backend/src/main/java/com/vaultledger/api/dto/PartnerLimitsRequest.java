package com.vaultledger.api.dto;

import com.vaultledger.api.validation.BaseUnits;

/**
 * Either limit may be omitted to keep the current value.
 */
public record PartnerLimitsRequest(@BaseUnits String dailyBorrowLimit, @BaseUnits String totalBorrowLimit) {
}
