package com.vaultledger.chain;

import com.vaultledger.chain.config.ChainProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read-only vault calls used to resync a position mirror on demand.
 */
@Component
@RequiredArgsConstructor
public class VaultStateReader {

    private static final int POSITION_WORDS = 8;

    private final ChainClient chainClient;
    private final ChainProperties properties;

    public Mono<OnChainPosition> readPosition(long positionId) {
        String vault = properties.getVaultAddress();
        Mono<List<String>> position = chainClient.call(vault, AbiCodec.encodeCall(VaultContract.GET_POSITION, positionId))
                .map(AbiCodec::words);
        Mono<String> debt = chainClient.call(vault, AbiCodec.encodeCall(VaultContract.GET_OUTSTANDING_DEBT, positionId));
        return Mono.zip(position, debt).map(t -> {
            List<String> w = t.getT1();
            if (w.size() < POSITION_WORDS) {
                throw new RpcException("getPosition(" + positionId + ") returned " + w.size() + " words");
            }
            return new OnChainPosition(
                    positionId,
                    AbiCodec.address(w.get(0)),
                    AbiCodec.address(w.get(1)),
                    AbiCodec.uint(w.get(2)),
                    AbiCodec.uint(w.get(3)),
                    AbiCodec.uint(w.get(4)),
                    AbiCodec.uint(w.get(5)).longValueExact(),
                    AbiCodec.bool(w.get(6)),
                    AbiCodec.uint(w.get(7)).intValueExact(),
                    Hex.toBigInteger(t.getT2()));
        });
    }
}
