package com.vaultledger.chain;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal ABI encoding for static argument types (address, uint, bool, bytes32) and word-level decoding of
 * log data and topics.
 */
public final class AbiCodec {

    private static final int WORD_HEX = 64;

    private AbiCodec() {
    }

    public static String encodeCall(String selector, Object... args) {
        StringBuilder sb = new StringBuilder(selector);
        for (Object arg : args) {
            sb.append(encodeWord(arg));
        }
        return sb.toString();
    }

    static String encodeWord(Object arg) {
        if (arg instanceof BigInteger value) {
            if (value.signum() < 0) {
                throw new IllegalArgumentException("Negative uint: " + value);
            }
            return leftPad(value.toString(16));
        }
        if (arg instanceof Long value) {
            return encodeWord(BigInteger.valueOf(value));
        }
        if (arg instanceof Integer value) {
            return encodeWord(BigInteger.valueOf(value));
        }
        if (arg instanceof Boolean value) {
            return leftPad(value ? "1" : "0");
        }
        if (arg instanceof String hex) {
            String digits = Hex.strip(hex).toLowerCase();
            if (digits.length() == 40) {
                return leftPad(digits);
            }
            if (digits.length() == WORD_HEX) {
                return digits;
            }
            throw new IllegalArgumentException("Unsupported hex argument length: " + hex);
        }
        throw new IllegalArgumentException("Unsupported ABI argument: " + arg);
    }

    /**
     * Splits ABI-encoded data into 32-byte words (hex without prefix).
     */
    public static List<String> words(String data) {
        String digits = data == null ? "" : Hex.strip(data);
        List<String> out = new ArrayList<>();
        for (int i = 0; i + WORD_HEX <= digits.length(); i += WORD_HEX) {
            out.add(digits.substring(i, i + WORD_HEX));
        }
        return out;
    }

    public static BigInteger uint(String word) {
        return new BigInteger(Hex.strip(word), 16);
    }

    public static String address(String word) {
        String digits = Hex.strip(word);
        return "0x" + digits.substring(digits.length() - 40).toLowerCase();
    }

    public static String bytes32(String word) {
        return "0x" + Hex.strip(word).toLowerCase();
    }

    public static boolean bool(String word) {
        return uint(word).signum() != 0;
    }

    private static String leftPad(String hex) {
        if (hex.length() > WORD_HEX) {
            throw new IllegalArgumentException("Value exceeds 32 bytes: 0x" + hex);
        }
        return "0".repeat(WORD_HEX - hex.length()) + hex;
    }
}
