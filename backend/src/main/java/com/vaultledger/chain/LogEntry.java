package com.vaultledger.chain;

import java.util.List;

/**
 * One event log as returned by eth_getLogs or inside a receipt. Addresses are lower-case.
 */
public record LogEntry(String address,
                       List<String> topics,
                       String data,
                       long blockNumber,
                       String transactionHash,
                       int logIndex,
                       boolean removed) {

    public String topic(int i) {
        return i < topics.size() ? topics.get(i) : null;
    }
}
