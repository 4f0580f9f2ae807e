package com.vaultledger.partner;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Partner onboarding defaults and API key format.
 */
@ConfigurationProperties(prefix = "vaultledger.partner")
@NoArgsConstructor
@Getter
@Setter
public class PartnerProperties {

    /** Platform fee applied when a partner is created without one (basis points). */
    private int defaultPlatformFeeBps = 50;
    /** Environment segment of issued keys: pk_{prefix}_{environment}_{secret}. */
    private String keyEnvironment = "live";
    /** Window used for the daily borrow limit. */
    private long dailyWindowSeconds = 86_400L;
}
