package com.vaultledger.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Local RPC throttling shared by all chain reads and writes.
 */
@ConfigurationProperties(prefix = "vaultledger.chain.rpc")
@NoArgsConstructor
@Getter
@Setter
public class ChainRpcProperties {

    /** Global RPC budget (requests/second) across endpoints. */
    private int maxRequestsPerSecond = 10;

    /** Max wait for a local limiter permit before failing the call. */
    private long localLimiterTimeoutMs = 5_000L;

    /** Log a permit wait at info when it took at least this long. */
    private long localLimiterLogThresholdMs = 250L;
}
