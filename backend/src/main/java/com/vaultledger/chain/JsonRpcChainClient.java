package com.vaultledger.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultledger.chain.config.ChainAdapterConfig;
import com.vaultledger.chain.config.ChainRpcProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ChainClient over raw Ethereum JSON-RPC. Every request takes a local rate-limiter permit and the next
 * endpoint from the rotator; reads retry transient failures with the rotator's backoff.
 */
@Slf4j
@Component
public class JsonRpcChainClient implements ChainClient {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ChainRpcProperties rpcProperties;
    private final ObjectMapper objectMapper;

    public JsonRpcChainClient(EvmRpcClient rpcClient,
                              RpcEndpointRotator rotator,
                              @Qualifier(ChainAdapterConfig.CHAIN_RPC_RATE_LIMITER) RateLimiter rateLimiter,
                              ChainRpcProperties rpcProperties,
                              ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.rpcProperties = rpcProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Long> blockNumber() {
        return read("eth_blockNumber", List.of()).map(node -> Hex.toLong(node.asText()));
    }

    @Override
    public Mono<TransactionReceipt> getTransactionReceipt(String txHash) {
        return read("eth_getTransactionReceipt", List.of(txHash))
                .flatMap(node -> node.isNull() || node.isMissingNode() ? Mono.empty() : Mono.just(toReceipt(node)));
    }

    @Override
    public Mono<List<LogEntry>> getLogs(LogFilter filter) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("fromBlock", Hex.quantity(filter.fromBlock()));
        params.put("toBlock", Hex.quantity(filter.toBlock()));
        params.put("address", filter.addresses());
        params.put("topics", List.of(filter.topic0()));
        return read("eth_getLogs", List.of(params)).map(node -> {
            List<LogEntry> logs = new ArrayList<>();
            node.forEach(l -> logs.add(toLog(l)));
            return logs;
        });
    }

    @Override
    public Mono<String> call(String to, String data) {
        return read("eth_call", List.of(Map.of("to", to, "data", data), "latest")).map(JsonNode::asText);
    }

    @Override
    public Mono<BigInteger> getPendingNonce(String address) {
        return read("eth_getTransactionCount", List.of(address, "pending")).map(node -> Hex.toBigInteger(node.asText()));
    }

    @Override
    public Mono<SignedTransaction> signTransaction(String from, String to, String data, BigInteger nonce) {
        Map<String, Object> tx = Map.of(
                "from", from,
                "to", to,
                "data", data,
                "nonce", Hex.quantity(nonce));
        return read("eth_signTransaction", List.of(tx)).map(node -> {
            String raw = node.path("raw").asText(null);
            String hash = node.path("tx").path("hash").asText(null);
            if (raw == null || hash == null) {
                throw new RpcException("eth_signTransaction returned no raw transaction or hash");
            }
            return new SignedTransaction(raw, hash.toLowerCase(), nonce);
        });
    }

    @Override
    public Mono<String> sendRawTransaction(String rawTransaction) {
        return once("eth_sendRawTransaction", List.of(rawTransaction)).map(node -> node.asText().toLowerCase());
    }

    private Mono<JsonNode> read(String method, Object params) {
        return once(method, params)
                .retryWhen(Retry.max(Math.max(0, rotator.getMaxAttempts() - 1))
                        .filter(RpcException::isTransient)
                        .doBeforeRetryAsync(signal -> {
                            log.warn("{} transient failure (attempt {}), retrying: {}",
                                    method, signal.totalRetries() + 1, signal.failure().getMessage());
                            return Mono.delay(Duration.ofMillis(rotator.retryDelayMs((int) signal.totalRetries()))).then();
                        })
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private Mono<JsonNode> once(String method, Object params) {
        return Mono.defer(() -> {
            long waitNanos = rateLimiter.reservePermission();
            if (waitNanos < 0) {
                return Mono.error(new RpcException("Local limiter timeout before " + method));
            }
            String endpoint = rotator.getNextEndpoint();
            Mono<String> call = rpcClient.call(endpoint, method, params);
            if (waitNanos > 0) {
                long waitedMs = waitNanos / 1_000_000L;
                if (waitedMs >= Math.max(1L, rpcProperties.getLocalLimiterLogThresholdMs())) {
                    log.info("Local chain RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpoint);
                }
                call = Mono.delay(Duration.ofNanos(waitNanos)).then(call);
            }
            return call.map(body -> result(method, body));
        });
    }

    private JsonNode result(String method, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error.path("message").asText(error.toString()));
        }
        return root.path("result");
    }

    private static TransactionReceipt toReceipt(JsonNode node) {
        List<LogEntry> logs = new ArrayList<>();
        node.path("logs").forEach(l -> logs.add(toLog(l)));
        return new TransactionReceipt(
                node.path("transactionHash").asText().toLowerCase(),
                Hex.toLong(node.path("blockNumber").asText()),
                "0x1".equals(node.path("status").asText()),
                lowerOrNull(node.path("from")),
                lowerOrNull(node.path("to")),
                logs);
    }

    private static LogEntry toLog(JsonNode l) {
        List<String> topics = new ArrayList<>();
        l.path("topics").forEach(t -> topics.add(t.asText().toLowerCase()));
        return new LogEntry(
                l.path("address").asText().toLowerCase(),
                topics,
                l.path("data").asText("0x"),
                Hex.toLong(l.path("blockNumber").asText()),
                l.path("transactionHash").asText().toLowerCase(),
                (int) Hex.toLong(l.path("logIndex").asText()),
                l.path("removed").asBoolean(false));
    }

    private static String lowerOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText().toLowerCase();
    }
}
