package com.vaultledger.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backoff for RPC reads and rejected submissions: baseDelayMs * 2^attempt, ±jitterFactor, capped.
 */
@ConfigurationProperties(prefix = "vaultledger.chain.retry")
@NoArgsConstructor
@Getter
@Setter
public class ChainRetryProperties {

    private long baseDelayMs = 1000L;
    private double jitterFactor = 0.2;
    private int maxAttempts = 5;
    private long maxDelayMs = 30_000L;
}
