package com.vaultledger.health;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * LTV caps and health-factor bands, all in basis points (10000 = 100%).
 */
@ConfigurationProperties(prefix = "vaultledger.health")
@NoArgsConstructor
@Getter
@Setter
public class HealthProperties {

    /** Max borrow as share of valuation for class A collateral (default 70%). */
    private int ltvClassABps = 7000;
    /** Max borrow as share of valuation for class B collateral (default 60%). */
    private int ltvClassBBps = 6000;
    /** Health factor strictly below this flags a liquidation candidate (default 110%). */
    private int liquidationThresholdBps = 11000;
    /** Health factor at or below this (and not liquidatable) is WARNING (default 125%). */
    private int warningThresholdBps = 12500;
    /** Interval of the full liquidation-candidate rescan. */
    private long scanIntervalMs = 300_000L;
    /** Decimals of collateral tokens; unit prices are per whole token. */
    private int collateralTokenDecimals = 18;
}
