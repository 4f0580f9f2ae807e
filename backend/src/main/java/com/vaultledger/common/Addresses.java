package com.vaultledger.common;

import java.util.regex.Pattern;

/**
 * EVM address checks. Stored addresses are always lower-case.
 */
public final class Addresses {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {
    }

    public static boolean isValid(String address) {
        return address != null && EVM_ADDRESS.matcher(address.trim()).matches();
    }

    /**
     * Trimmed, lower-cased address.
     *
     * @throws ValidationException INVALID_ADDRESS when malformed
     */
    public static String normalize(String field, String address) {
        if (!isValid(address)) {
            throw new ValidationException(ValidationException.INVALID_ADDRESS, "Invalid " + field + ": " + address);
        }
        return address.trim().toLowerCase();
    }

    public static boolean same(String a, String b) {
        return a != null && b != null && a.trim().equalsIgnoreCase(b.trim());
    }
}
