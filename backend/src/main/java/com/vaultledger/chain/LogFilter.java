package com.vaultledger.chain;

import java.util.List;

/**
 * eth_getLogs filter: any of {@code addresses}, first topic any of {@code topic0}, inclusive block range.
 */
public record LogFilter(List<String> addresses, List<String> topic0, long fromBlock, long toBlock) {
}
