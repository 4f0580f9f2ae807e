package com.vaultledger.common;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Base-unit integer amounts carried as decimal strings on the wire and in storage.
 */
public final class Amounts {

    private static final Pattern DECIMAL_INTEGER = Pattern.compile("^[0-9]{1,78}$");

    private Amounts() {
    }

    /**
     * Parses a non-negative decimal integer string (no sign, no fraction, no exponent).
     *
     * @throws ValidationException INVALID_AMOUNT when null, blank or malformed
     */
    public static BigInteger parse(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(ValidationException.INVALID_AMOUNT, field + " is required");
        }
        String trimmed = value.trim();
        if (!DECIMAL_INTEGER.matcher(trimmed).matches()) {
            throw new ValidationException(ValidationException.INVALID_AMOUNT,
                    field + " must be a decimal integer string in base units, got: " + value);
        }
        return new BigInteger(trimmed);
    }

    /**
     * Same as {@link #parse} but rejects zero.
     */
    public static BigInteger parsePositive(String field, String value) {
        BigInteger parsed = parse(field, value);
        if (parsed.signum() == 0) {
            throw new ValidationException(ValidationException.INVALID_AMOUNT, field + " must be greater than zero");
        }
        return parsed;
    }

    public static BigInteger orZero(BigInteger value) {
        return value != null ? value : BigInteger.ZERO;
    }

    public static String format(BigInteger value) {
        return value != null ? value.toString() : null;
    }
}
