package com.vaultledger.chain;

import java.util.List;

/**
 * Mined transaction receipt. {@code successful} is status 0x1.
 */
public record TransactionReceipt(String transactionHash,
                                 long blockNumber,
                                 boolean successful,
                                 String from,
                                 String to,
                                 List<LogEntry> logs) {

    public List<LogEntry> logsFrom(String contractAddress, String topic0) {
        return logs.stream()
                .filter(l -> l.address().equalsIgnoreCase(contractAddress))
                .filter(l -> topic0.equalsIgnoreCase(l.topic(0)))
                .toList();
    }
}
