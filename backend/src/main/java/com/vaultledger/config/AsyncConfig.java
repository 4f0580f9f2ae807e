package com.vaultledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: chain-submitter (single owner of the signing nonce), reconcile-executor (one task per
 * event group), scan-executor (health rescans), notify-executor (fire-and-forget notifications).
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String CHAIN_SUBMITTER_EXECUTOR = "chain-submitter";
    public static final String RECONCILE_EXECUTOR = "reconcile-executor";
    public static final String SCAN_EXECUTOR = "scan-executor";
    public static final String NOTIFY_EXECUTOR = "notify-executor";

    /** Exactly one thread: every broadcast from the platform signer is issued from here, in FIFO order. */
    @Bean(name = CHAIN_SUBMITTER_EXECUTOR)
    public ThreadPoolTaskExecutor chainSubmitterExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("chain-submitter-");
        e.initialize();
        return e;
    }

    @Bean(name = RECONCILE_EXECUTOR)
    public ThreadPoolTaskExecutor reconcileExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setThreadNamePrefix("reconcile-");
        e.initialize();
        return e;
    }

    @Bean(name = SCAN_EXECUTOR)
    public Executor scanExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(2);
        e.setThreadNamePrefix("scan-");
        e.initialize();
        return e;
    }

    @Bean(name = NOTIFY_EXECUTOR)
    public Executor notifyExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setThreadNamePrefix("notify-");
        e.initialize();
        return e;
    }
}
