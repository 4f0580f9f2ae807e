package com.vaultledger.chain;

import java.math.BigInteger;

/**
 * A transaction signed by the node but not yet broadcast.
 */
public record SignedTransaction(String raw, String txHash, BigInteger nonce) {
}
