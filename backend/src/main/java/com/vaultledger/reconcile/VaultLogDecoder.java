package com.vaultledger.reconcile;

import com.vaultledger.chain.AbiCodec;
import com.vaultledger.chain.Hex;
import com.vaultledger.chain.LogEntry;
import com.vaultledger.chain.VaultContract;
import com.vaultledger.chain.config.ChainProperties;
import com.vaultledger.common.Addresses;
import com.vaultledger.domain.ChainEvent;
import com.vaultledger.domain.ChainEventStatus;
import com.vaultledger.domain.VaultEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw logs of the vault, the asset registry and tracked tokens into queue entries. Unknown topics and
 * removed (reorged) logs decode to empty. Payload values are decimal strings for integers, lower-case hex for
 * addresses and bytes32.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VaultLogDecoder {

    static final String POSITION_KEY = "position:";
    static final String ASSET_KEY = "asset:";
    static final String TOKEN_KEY = "token:";
    static final String RAW_KEY = "raw:";
    static final String RAW_TOPICS = "rawTopics";
    static final String RAW_DATA = "rawData";

    private final ChainProperties chainProperties;

    public Optional<ChainEvent> decode(LogEntry entry) {
        if (entry.removed() || entry.topics().isEmpty()) {
            return Optional.empty();
        }
        String topic0 = entry.topic(0).toLowerCase();
        if (Addresses.same(entry.address(), chainProperties.getVaultAddress())) {
            return decodeVault(entry, topic0);
        }
        if (Addresses.same(entry.address(), chainProperties.getRegistryAddress())) {
            return decodeRegistry(entry, topic0);
        }
        if (VaultContract.TRANSFER_TOPIC.equals(topic0) && entry.topics().size() >= 3) {
            Map<String, String> args = new LinkedHashMap<>();
            args.put("from", AbiCodec.address(entry.topic(1)));
            args.put("to", AbiCodec.address(entry.topic(2)));
            args.put("value", Hex.toBigInteger(entry.data()).toString());
            return Optional.of(event(entry, VaultEventType.TRANSFER, TOKEN_KEY + entry.address().toLowerCase(), null, args));
        }
        log.debug("Ignoring log {}:{} with topic {}", entry.transactionHash(), entry.logIndex(), topic0);
        return Optional.empty();
    }

    private Optional<ChainEvent> decodeVault(LogEntry entry, String topic0) {
        VaultEventType type = switch (topic0) {
            case VaultContract.POSITION_CREATED -> VaultEventType.POSITION_CREATED;
            case VaultContract.USDC_BORROWED -> VaultEventType.USDC_BORROWED;
            case VaultContract.REPAYMENT_PLAN_CREATED -> VaultEventType.REPAYMENT_PLAN_CREATED;
            case VaultContract.LOAN_REPAID -> VaultEventType.LOAN_REPAID;
            case VaultContract.COLLATERAL_WITHDRAWN -> VaultEventType.COLLATERAL_WITHDRAWN;
            case VaultContract.MISSED_PAYMENT_MARKED -> VaultEventType.MISSED_PAYMENT_MARKED;
            case VaultContract.POSITION_DEFAULTED -> VaultEventType.POSITION_DEFAULTED;
            case VaultContract.POSITION_LIQUIDATED -> VaultEventType.POSITION_LIQUIDATED;
            case VaultContract.LIQUIDATION_SETTLED -> VaultEventType.LIQUIDATION_SETTLED;
            default -> null;
        };
        if (type == null) {
            log.debug("Ignoring vault log {}:{} with topic {}", entry.transactionHash(), entry.logIndex(), topic0);
            return Optional.empty();
        }
        long positionId = AbiCodec.uint(entry.topic(1)).longValueExact();
        List<String> w = AbiCodec.words(entry.data());
        Map<String, String> args = new LinkedHashMap<>();
        switch (type) {
            case POSITION_CREATED -> {
                args.put("user", AbiCodec.address(entry.topic(2)));
                args.put("collateralToken", AbiCodec.address(w.get(0)));
                args.put("collateralAmount", AbiCodec.uint(w.get(1)).toString());
                args.put("tokenValueUSD", AbiCodec.uint(w.get(2)).toString());
                args.put("tokenType", AbiCodec.uint(w.get(3)).toString());
            }
            case USDC_BORROWED -> {
                args.put("amount", AbiCodec.uint(w.get(0)).toString());
                args.put("totalDebt", AbiCodec.uint(w.get(1)).toString());
            }
            case REPAYMENT_PLAN_CREATED -> {
                args.put("loanDuration", AbiCodec.uint(w.get(0)).toString());
                args.put("numberOfInstallments", AbiCodec.uint(w.get(1)).toString());
                args.put("installmentInterval", AbiCodec.uint(w.get(2)).toString());
            }
            case LOAN_REPAID -> {
                args.put("amountPaid", AbiCodec.uint(w.get(0)).toString());
                args.put("principal", AbiCodec.uint(w.get(1)).toString());
                args.put("interest", AbiCodec.uint(w.get(2)).toString());
                args.put("remainingDebt", AbiCodec.uint(w.get(3)).toString());
            }
            case COLLATERAL_WITHDRAWN -> {
                args.put("amount", AbiCodec.uint(w.get(0)).toString());
                args.put("remainingCollateral", AbiCodec.uint(w.get(1)).toString());
            }
            case MISSED_PAYMENT_MARKED -> args.put("missedPayments", AbiCodec.uint(w.get(0)).toString());
            case POSITION_LIQUIDATED -> {
                args.put("marketplaceListingId", AbiCodec.bytes32(w.get(0)));
                args.put("debtAmount", AbiCodec.uint(w.get(1)).toString());
            }
            case LIQUIDATION_SETTLED -> {
                args.put("yieldReceived", AbiCodec.uint(w.get(0)).toString());
                args.put("debtRepaid", AbiCodec.uint(w.get(1)).toString());
                args.put("userRefund", AbiCodec.uint(w.get(2)).toString());
            }
            default -> {
                // no data arguments
            }
        }
        return Optional.of(event(entry, type, POSITION_KEY + positionId, positionId, args));
    }

    private Optional<ChainEvent> decodeRegistry(LogEntry entry, String topic0) {
        String assetId = AbiCodec.bytes32(entry.topic(1));
        List<String> w = AbiCodec.words(entry.data());
        Map<String, String> args = new LinkedHashMap<>();
        args.put("assetId", assetId);
        VaultEventType type;
        if (VaultContract.ASSET_REGISTERED.equals(topic0)) {
            type = VaultEventType.ASSET_REGISTERED;
            args.put("attestationHash", AbiCodec.bytes32(w.get(0)));
            args.put("attestor", AbiCodec.address(w.get(1)));
        } else if (VaultContract.TOKEN_SUITE_DEPLOYED.equals(topic0)) {
            type = VaultEventType.TOKEN_SUITE_DEPLOYED;
            args.put("tokenAddress", AbiCodec.address(w.get(0)));
            args.put("complianceAddress", AbiCodec.address(w.get(1)));
            args.put("totalSupply", AbiCodec.uint(w.get(2)).toString());
        } else {
            log.debug("Ignoring registry log {}:{} with topic {}", entry.transactionHash(), entry.logIndex(), topic0);
            return Optional.empty();
        }
        return Optional.of(event(entry, type, ASSET_KEY + assetId, null, args));
    }

    /**
     * Dead-lettered queue entry for a log that failed to decode. It keeps the raw topics and data and the best
     * ordering key the topics allow, so later events of the same position, asset or token wait behind it.
     */
    public ChainEvent undecodable(LogEntry entry, RuntimeException cause) {
        Map<String, String> raw = new LinkedHashMap<>();
        raw.put(RAW_TOPICS, String.join(",", entry.topics()));
        raw.put(RAW_DATA, entry.data());
        ChainEvent event = event(entry, VaultEventType.UNDECODED, rawOrderingKey(entry), null, raw);
        event.setStatus(ChainEventStatus.DEAD);
        event.setAttempts(1);
        event.setLastError(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        return event;
    }

    /**
     * Decodes an {@link VaultEventType#UNDECODED} entry again from its stored raw log.
     */
    public Optional<ChainEvent> redecode(ChainEvent undecoded) {
        String topics = undecoded.arg(RAW_TOPICS);
        LogEntry entry = new LogEntry(undecoded.getContractAddress(),
                topics == null || topics.isEmpty() ? List.of() : List.of(topics.split(",")),
                undecoded.arg(RAW_DATA), undecoded.getBlockNumber(), undecoded.getTxHash(), undecoded.getLogIndex(), false);
        return decode(entry);
    }

    private String rawOrderingKey(LogEntry entry) {
        String address = entry.address().toLowerCase();
        if (entry.topics().size() > 1 && Addresses.same(address, chainProperties.getVaultAddress())) {
            try {
                return POSITION_KEY + AbiCodec.uint(entry.topic(1)).longValueExact();
            } catch (RuntimeException e) {
                log.debug("Topic 1 of {}:{} is not a position id", entry.transactionHash(), entry.logIndex());
            }
        }
        if (entry.topics().size() > 1 && Addresses.same(address, chainProperties.getRegistryAddress())) {
            return ASSET_KEY + entry.topic(1).toLowerCase();
        }
        if (Addresses.same(address, chainProperties.getVaultAddress())
                || Addresses.same(address, chainProperties.getRegistryAddress())) {
            return RAW_KEY + address;
        }
        return TOKEN_KEY + address;
    }

    private static ChainEvent event(LogEntry entry, VaultEventType type, String orderingKey, Long positionId,
                                    Map<String, String> args) {
        ChainEvent event = new ChainEvent();
        event.setEventKey(ChainEvent.keyOf(entry.transactionHash(), entry.logIndex()));
        event.setType(type);
        event.setOrderingKey(orderingKey);
        event.setPositionId(positionId);
        event.setContractAddress(entry.address().toLowerCase());
        event.setTxHash(entry.transactionHash().toLowerCase());
        event.setBlockNumber(entry.blockNumber());
        event.setLogIndex(entry.logIndex());
        event.setPayload(args);
        event.setStatus(ChainEventStatus.PENDING);
        event.setCreatedAt(Instant.now());
        return event;
    }
}
