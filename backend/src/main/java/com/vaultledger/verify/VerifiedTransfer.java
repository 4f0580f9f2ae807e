package com.vaultledger.verify;

import java.math.BigInteger;

public record VerifiedTransfer(String txHash,
                               String tokenAddress,
                               String sender,
                               String recipient,
                               BigInteger amount,
                               long blockNumber,
                               int logIndex) {
}
