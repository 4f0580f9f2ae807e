package com.vaultledger.common;

import java.util.HexFormat;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Canonical mapping between on-chain bytes32 identifiers and UUIDs: the UUID's 16 bytes are left-aligned in
 * the bytes32 and the remaining 16 bytes must be zero. The mapping is a bijection on that subset; anything
 * else is rejected rather than truncated.
 */
public final class Bytes32Codec {

    private static final Pattern BYTES32 = Pattern.compile("^0x[0-9a-fA-F]{64}$");
    private static final String ZERO_TAIL = "0".repeat(32);

    private Bytes32Codec() {
    }

    public static UUID toUuid(String bytes32) {
        if (bytes32 == null || !BYTES32.matcher(bytes32).matches()) {
            throw new ValidationException("Not a bytes32 value: " + bytes32);
        }
        String hex = bytes32.substring(2).toLowerCase();
        if (!hex.substring(32).equals(ZERO_TAIL)) {
            throw new ValidationException("bytes32 " + bytes32 + " does not encode a UUID (non-zero tail)");
        }
        byte[] raw = HexFormat.of().parseHex(hex.substring(0, 32));
        long msb = 0;
        long lsb = 0;
        for (int i = 0; i < 8; i++) {
            msb = (msb << 8) | (raw[i] & 0xff);
        }
        for (int i = 8; i < 16; i++) {
            lsb = (lsb << 8) | (raw[i] & 0xff);
        }
        return new UUID(msb, lsb);
    }

    public static String fromUuid(UUID uuid) {
        return "0x" + uuid.toString().replace("-", "") + ZERO_TAIL;
    }
}
