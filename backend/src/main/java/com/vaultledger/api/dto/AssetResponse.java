package com.vaultledger.api.dto;

import com.vaultledger.common.Amounts;
import com.vaultledger.domain.AssetStatus;
import com.vaultledger.domain.CollateralAsset;
import com.vaultledger.domain.CollateralClass;

import java.time.Instant;

public record AssetResponse(String assetId,
                            String assetIdBytes32,
                            AssetStatus status,
                            String attestor,
                            String tokenAddress,
                            String complianceAddress,
                            String totalSupply,
                            CollateralClass collateralClass,
                            String unitPriceUsd,
                            Instant priceUpdatedAt) {

    public static AssetResponse from(CollateralAsset a) {
        return new AssetResponse(a.getAssetId(), a.getAssetIdBytes32(), a.getStatus(), a.getAttestor(),
                a.getTokenAddress(), a.getComplianceAddress(), Amounts.format(a.getTotalSupply()),
                a.getCollateralClass(), Amounts.format(a.getUnitPriceUsd()), a.getPriceUpdatedAt());
    }
}
