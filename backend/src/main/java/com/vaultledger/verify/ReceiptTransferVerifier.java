package com.vaultledger.verify;

import com.vaultledger.chain.AbiCodec;
import com.vaultledger.chain.ChainClient;
import com.vaultledger.chain.Hex;
import com.vaultledger.chain.LogEntry;
import com.vaultledger.chain.RpcException;
import com.vaultledger.chain.TransactionReceipt;
import com.vaultledger.chain.VaultContract;
import com.vaultledger.chain.config.ChainProperties;
import com.vaultledger.common.Addresses;
import com.vaultledger.common.ChainSubmissionException;
import com.vaultledger.common.OnChainVerificationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.List;

/**
 * Verifies ERC-20 transfers from the transaction receipt's Transfer logs. Amounts must match exactly.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReceiptTransferVerifier implements TransferVerifier {

    private final ChainClient chainClient;
    private final ChainProperties chainProperties;

    @Override
    public Mono<VerifiedTransfer> verifyTransfer(String txHash,
                                                 String expectedSender,
                                                 String expectedRecipient,
                                                 BigInteger expectedAmount,
                                                 String tokenAddress) {
        return chainClient.getTransactionReceipt(txHash)
                .switchIfEmpty(Mono.error(() -> new OnChainVerificationException(
                        OnChainVerificationException.TX_NOT_FOUND, "Transfer transaction not found: " + txHash)))
                .flatMap(receipt -> checkConfirmed(receipt).thenReturn(receipt))
                .map(receipt -> match(receipt, expectedSender, expectedRecipient, expectedAmount, tokenAddress))
                .onErrorMap(RpcException.class, e -> new ChainSubmissionException(
                        ChainSubmissionException.SUBMISSION_FAILED, "Chain lookup failed for " + txHash + ": " + e.getMessage(), e))
                .doOnNext(t -> log.info("Verified transfer {} of {} {} -> {} ({})",
                        t.txHash(), t.amount(), t.sender(), t.recipient(), t.tokenAddress()));
    }

    private Mono<Void> checkConfirmed(TransactionReceipt receipt) {
        if (!receipt.successful()) {
            return Mono.error(new OnChainVerificationException(OnChainVerificationException.TX_REVERTED,
                    "Transfer transaction reverted: " + receipt.transactionHash()));
        }
        int required = Math.max(1, chainProperties.getConfirmations());
        if (required == 1) {
            return Mono.empty();
        }
        return chainClient.blockNumber().flatMap(head -> {
            long depth = head - receipt.blockNumber() + 1;
            if (depth < required) {
                return Mono.error(new OnChainVerificationException(OnChainVerificationException.TX_NOT_CONFIRMED,
                        "Transfer transaction " + receipt.transactionHash() + " has " + depth + " of " + required + " confirmations"));
            }
            return Mono.empty();
        });
    }

    private static VerifiedTransfer match(TransactionReceipt receipt,
                                          String expectedSender,
                                          String expectedRecipient,
                                          BigInteger expectedAmount,
                                          String tokenAddress) {
        List<LogEntry> transfers = receipt.logsFrom(tokenAddress, VaultContract.TRANSFER_TOPIC).stream()
                .filter(l -> l.topics().size() == 3)
                .toList();
        if (transfers.isEmpty()) {
            throw new OnChainVerificationException(OnChainVerificationException.TRANSFER_NOT_FOUND,
                    "No transfer of token " + tokenAddress + " in transaction " + receipt.transactionHash());
        }
        List<LogEntry> between = transfers.stream()
                .filter(l -> Addresses.same(AbiCodec.address(l.topic(1)), expectedSender))
                .filter(l -> Addresses.same(AbiCodec.address(l.topic(2)), expectedRecipient))
                .toList();
        if (between.isEmpty()) {
            throw new OnChainVerificationException(OnChainVerificationException.TRANSFER_NOT_FOUND,
                    "No transfer from " + expectedSender + " to " + expectedRecipient + " in transaction " + receipt.transactionHash());
        }
        for (LogEntry l : between) {
            BigInteger amount = Hex.toBigInteger(l.data());
            if (amount.equals(expectedAmount)) {
                return new VerifiedTransfer(receipt.transactionHash(), l.address(), AbiCodec.address(l.topic(1)),
                        AbiCodec.address(l.topic(2)), amount, receipt.blockNumber(), l.logIndex());
            }
        }
        BigInteger got = Hex.toBigInteger(between.get(0).data());
        throw new OnChainVerificationException(OnChainVerificationException.AMOUNT_MISMATCH,
                "Transfer amount mismatch. Expected: " + expectedAmount + ", Got: " + got);
    }
}
