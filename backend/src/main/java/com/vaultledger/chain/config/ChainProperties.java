package com.vaultledger.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Chain endpoints, contract addresses and confirmation policy.
 */
@ConfigurationProperties(prefix = "vaultledger.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    /** JSON-RPC endpoints, used round-robin. */
    private List<String> urls = new ArrayList<>();
    /** Collateral vault contract. */
    private String vaultAddress;
    /** Stablecoin (6 decimals) lent by the vault. */
    private String stablecoinAddress;
    /** Asset registry emitting AssetRegistered / TokenSuiteDeployed. */
    private String registryAddress;
    /** Node-managed platform account that signs every submission. */
    private String signerAddress;
    /** Blocks required on top of a transaction before it counts as confirmed (default 1 = mined). */
    private int confirmations = 1;
    /** Upper bound for waiting on a receipt after broadcast (default 5 min). */
    private long confirmationTimeoutMs = 300_000L;
    /** Delay between receipt polls while waiting for confirmation. */
    private long receiptPollIntervalMs = 2_000L;
    /** Timeout for a single blocking RPC round-trip made by the submitter thread. */
    private long rpcTimeoutMs = 30_000L;
}
