package com.vaultledger.asset;

import com.vaultledger.common.Addresses;
import com.vaultledger.common.Bytes32Codec;
import com.vaultledger.common.NotFoundException;
import com.vaultledger.common.StateException;
import com.vaultledger.common.ValidationException;
import com.vaultledger.config.CaffeineConfig;
import com.vaultledger.domain.AppliedEvent;
import com.vaultledger.domain.AppliedEventRepository;
import com.vaultledger.domain.AssetStatus;
import com.vaultledger.domain.CollateralAsset;
import com.vaultledger.domain.CollateralAssetRepository;
import com.vaultledger.domain.TokenHolding;
import com.vaultledger.domain.TokenHoldingRepository;
import com.vaultledger.domain.VaultEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Mirror of the asset registry and of holder balances of tokenized collateral.
 * bytes32 registry ids map one-to-one onto UUIDs through {@link Bytes32Codec}, which rejects any bytes32 that is not
 * a UUID's canonical encoding. A second token claiming an already tokenized asset is a MAPPING_CONFLICT.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollateralAssetService {

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private final CollateralAssetRepository collateralAssetRepository;
    private final TokenHoldingRepository tokenHoldingRepository;
    private final AppliedEventRepository appliedEventRepository;

    @Cacheable(cacheNames = CaffeineConfig.ASSET_BY_TOKEN_CACHE, key = "#tokenAddress.toLowerCase()", unless = "#result == null")
    public Optional<CollateralAsset> findByToken(String tokenAddress) {
        return collateralAssetRepository.findByTokenAddress(tokenAddress.toLowerCase());
    }

    public CollateralAsset getAsset(String assetId) {
        return collateralAssetRepository.findById(assetId)
                .orElseThrow(() -> new NotFoundException(NotFoundException.ASSET_NOT_FOUND, "Asset not found: " + assetId));
    }

    public List<CollateralAsset> listAssets() {
        return collateralAssetRepository.findAll();
    }

    @CacheEvict(cacheNames = CaffeineConfig.ASSET_BY_TOKEN_CACHE, allEntries = true)
    public CollateralAsset recordRegistration(String assetIdBytes32, String attestationHash, String attestor,
                                              String txHash, long blockNumber) {
        UUID assetId = Bytes32Codec.toUuid(assetIdBytes32);
        String canonical = Bytes32Codec.fromUuid(assetId);
        CollateralAsset asset = collateralAssetRepository.findById(assetId.toString()).orElse(null);
        if (asset != null) {
            if (txHash.equalsIgnoreCase(asset.getRegistryTxHash())) {
                log.debug("Asset {} registration from {} already applied", assetId, txHash);
                return asset;
            }
        } else {
            asset = new CollateralAsset();
            asset.setAssetId(assetId.toString());
            asset.setAssetIdBytes32(canonical);
            asset.setStatus(AssetStatus.REGISTERED);
        }
        asset.setAttestationHash(attestationHash);
        asset.setAttestor(attestor != null ? attestor.toLowerCase() : null);
        asset.setRegistryTxHash(txHash.toLowerCase());
        asset.setRegistryBlock(blockNumber);
        asset.setUpdatedAt(Instant.now());
        CollateralAsset saved = collateralAssetRepository.save(asset);
        log.info("Asset {} registered at block {}", assetId, blockNumber);
        return saved;
    }

    /**
     * @throws IllegalStateException when the asset's registration has not been ingested yet; the event is retried
     */
    @CacheEvict(cacheNames = CaffeineConfig.ASSET_BY_TOKEN_CACHE, allEntries = true)
    public CollateralAsset recordTokenSuite(String assetIdBytes32, String tokenAddress, String complianceAddress,
                                            BigInteger totalSupply, String txHash, long blockNumber) {
        UUID assetId = Bytes32Codec.toUuid(assetIdBytes32);
        CollateralAsset asset = collateralAssetRepository.findById(assetId.toString())
                .orElseThrow(() -> new IllegalStateException("Asset " + assetId + " not registered yet"));
        String token = Addresses.normalize("tokenAddress", tokenAddress);
        if (asset.getTokenAddress() != null) {
            if (!asset.getTokenAddress().equals(token)) {
                throw new StateException(StateException.MAPPING_CONFLICT,
                        "Asset " + assetId + " already tokenized as " + asset.getTokenAddress());
            }
            log.debug("Asset {} token suite already applied", assetId);
            return asset;
        }
        asset.setTokenAddress(token);
        asset.setComplianceAddress(complianceAddress != null ? complianceAddress.toLowerCase() : null);
        asset.setTotalSupply(totalSupply);
        asset.setDeploymentTxHash(txHash.toLowerCase());
        asset.setDeploymentBlock(blockNumber);
        asset.setStatus(AssetStatus.TOKENIZED);
        asset.setUpdatedAt(Instant.now());
        CollateralAsset saved = collateralAssetRepository.save(asset);
        log.info("Asset {} tokenized as {} (supply {})", assetId, token, totalSupply);
        return saved;
    }

    /**
     * Sets the admin-asserted unit price (stablecoin base units per whole token).
     */
    @CacheEvict(cacheNames = CaffeineConfig.ASSET_BY_TOKEN_CACHE, allEntries = true)
    public CollateralAsset updatePrice(String tokenAddress, BigInteger unitPriceUsd) {
        if (unitPriceUsd == null || unitPriceUsd.signum() <= 0) {
            throw new ValidationException(ValidationException.INVALID_AMOUNT, "unitPriceUsd must be greater than zero");
        }
        String token = Addresses.normalize("tokenAddress", tokenAddress);
        CollateralAsset asset = collateralAssetRepository.findByTokenAddress(token)
                .orElseThrow(() -> new NotFoundException(NotFoundException.ASSET_NOT_FOUND, "No asset for token " + token));
        Instant now = Instant.now();
        asset.setUnitPriceUsd(unitPriceUsd);
        asset.setPriceUpdatedAt(now);
        asset.setUpdatedAt(now);
        return collateralAssetRepository.save(asset);
    }

    /**
     * Moves {@code amount} between holders. Mints and burns touch one side only. Each side is applied at most once
     * per event: its dedupe row ({@code eventKey/debit}, {@code eventKey/credit}) is inserted before the balance
     * write and released if that write fails, so a retry after a partial failure only redoes the missing side.
     */
    public void applyTransfer(String eventKey, String tokenAddress, String from, String to, BigInteger amount,
                              long blockNumber) {
        String token = tokenAddress.toLowerCase();
        if (from.equalsIgnoreCase(to)) {
            log.debug("Transfer {} is a self-transfer of {}; balances unchanged", eventKey, from);
            return;
        }
        if (!ZERO_ADDRESS.equalsIgnoreCase(from)) {
            applyOnce(eventKey + "/debit", token, from.toLowerCase(), amount.negate(), blockNumber);
        }
        if (!ZERO_ADDRESS.equalsIgnoreCase(to)) {
            applyOnce(eventKey + "/credit", token, to.toLowerCase(), amount, blockNumber);
        }
    }

    public List<TokenHolding> holdersOf(String tokenAddress) {
        return tokenHoldingRepository.findByTokenAddress(tokenAddress.toLowerCase());
    }

    private void applyOnce(String legKey, String token, String holder, BigInteger delta, long blockNumber) {
        if (appliedEventRepository.existsById(legKey)) {
            log.debug("Transfer leg {} already applied", legKey);
            return;
        }
        try {
            appliedEventRepository.insert(new AppliedEvent(legKey, VaultEventType.TRANSFER, Instant.now()));
        } catch (DuplicateKeyException e) {
            log.debug("Transfer leg {} claimed concurrently", legKey);
            return;
        }
        try {
            adjust(token, holder, delta, blockNumber);
        } catch (RuntimeException e) {
            appliedEventRepository.deleteById(legKey);
            throw e;
        }
    }

    private void adjust(String token, String holder, BigInteger delta, long blockNumber) {
        TokenHolding holding = tokenHoldingRepository.findByTokenAddressAndHolder(token, holder).orElseGet(() -> {
            TokenHolding h = new TokenHolding();
            h.setTokenAddress(token);
            h.setHolder(holder);
            return h;
        });
        BigInteger balance = holding.getBalance().add(delta);
        if (balance.signum() < 0) {
            log.warn("Holding of {} in {} would go negative ({}); clamped to zero", holder, token, balance);
            balance = BigInteger.ZERO;
        }
        holding.setBalance(balance);
        holding.setLastBlock(Math.max(holding.getLastBlock(), blockNumber));
        holding.setUpdatedAt(Instant.now());
        tokenHoldingRepository.save(holding);
    }
}
