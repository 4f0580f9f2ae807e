package com.vaultledger.common;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AmountsTest {

    @Test
    void parse_decimalIntegerString() {
        assertThat(Amounts.parse("amount", " 7000000000 ")).isEqualTo(BigInteger.valueOf(7_000_000_000L));
        assertThat(Amounts.parse("amount", "0")).isZero();
    }

    @Test
    void parse_rejectsSignFractionAndExponent() {
        for (String bad : new String[] {"-1", "1.5", "1e6", "0x10", "", " "}) {
            assertThatThrownBy(() -> Amounts.parse("amount", bad))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getErrorCode())
                    .isEqualTo(ValidationException.INVALID_AMOUNT);
        }
    }

    @Test
    void parsePositive_rejectsZero() {
        assertThatThrownBy(() -> Amounts.parsePositive("amount", "000"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("greater than zero");
    }

    @Test
    void format_nullSafe() {
        assertThat(Amounts.format(null)).isNull();
        assertThat(Amounts.format(BigInteger.TEN)).isEqualTo("10");
    }
}
