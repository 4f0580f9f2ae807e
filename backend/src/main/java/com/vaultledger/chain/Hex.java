package com.vaultledger.chain;

import java.math.BigInteger;

/**
 * JSON-RPC quantity and data helpers.
 */
public final class Hex {

    private Hex() {
    }

    public static String quantity(long value) {
        return "0x" + Long.toHexString(value);
    }

    public static String quantity(BigInteger value) {
        return "0x" + value.toString(16);
    }

    public static BigInteger toBigInteger(String hex) {
        if (hex == null || hex.isBlank() || "0x".equals(hex)) {
            return BigInteger.ZERO;
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        return digits.isEmpty() ? BigInteger.ZERO : new BigInteger(digits, 16);
    }

    public static long toLong(String hex) {
        return toBigInteger(hex).longValueExact();
    }

    public static String strip(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }
}
