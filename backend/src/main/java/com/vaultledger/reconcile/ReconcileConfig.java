package com.vaultledger.reconcile;

import com.vaultledger.common.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ReconcileProperties.class)
public class ReconcileConfig {

    public static final String RECONCILE_RETRY_POLICY = "reconcileRetryPolicy";

    @Bean(name = RECONCILE_RETRY_POLICY)
    public RetryPolicy reconcileRetryPolicy(ReconcileProperties properties) {
        return new RetryPolicy(properties.getRetryBaseDelayMs(), 0.2, properties.getMaxAttempts(), properties.getRetryMaxDelayMs());
    }
}
