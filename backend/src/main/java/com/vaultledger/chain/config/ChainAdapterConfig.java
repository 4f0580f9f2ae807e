package com.vaultledger.chain.config;

import com.vaultledger.chain.EvmRpcClient;
import com.vaultledger.chain.RpcEndpointRotator;
import com.vaultledger.chain.WebClientEvmRpcClient;
import com.vaultledger.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Chain RPC wiring: endpoint rotator, WebClient transport, local rate limiter and the shared retry policy.
 */
@Configuration
@EnableConfigurationProperties({ ChainProperties.class, ChainRetryProperties.class, ChainRpcProperties.class })
public class ChainAdapterConfig {

    /** Used when vaultledger.chain.urls is empty, so the context starts against a local node. */
    private static final List<String> DEFAULT_FALLBACK_URLS = List.of("http://localhost:8545");

    public static final String CHAIN_RETRY_POLICY = "chainRetryPolicy";
    public static final String CHAIN_RPC_RATE_LIMITER = "chainRpcRateLimiter";

    @Bean(name = CHAIN_RETRY_POLICY)
    public RetryPolicy chainRetryPolicy(ChainRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts(),
                retryProperties.getMaxDelayMs());
    }

    @Bean
    public RpcEndpointRotator chainRpcEndpointRotator(ChainProperties properties, ChainRetryProperties retryProperties) {
        List<String> urls = properties.getUrls() == null || properties.getUrls().isEmpty()
                ? DEFAULT_FALLBACK_URLS
                : properties.getUrls();
        return new RpcEndpointRotator(urls, chainRetryPolicy(retryProperties));
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = CHAIN_RPC_RATE_LIMITER)
    public RateLimiter chainRpcRateLimiter(ChainRpcProperties rpcProperties) {
        int rps = Math.max(1, rpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("chain-rpc", config);
    }
}
