package com.vaultledger.health;

import com.vaultledger.domain.CollateralClass;
import com.vaultledger.domain.HealthStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class HealthEvaluatorTest {

    private static final BigInteger VALUATION = BigInteger.valueOf(10_000_000_000L);

    private HealthEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new HealthEvaluator(new HealthProperties());
    }

    @Test
    @DisplayName("class A at 70% LTV: 10,000 USD collateral caps borrowing at 7,000 USD; one unit more is refused")
    void borrowCapAtLtv() {
        BigInteger cap = evaluator.maxBorrowable(CollateralClass.CLASS_A, VALUATION);

        assertThat(cap).isEqualTo(BigInteger.valueOf(7_000_000_000L));
        assertThat(evaluator.canBorrow(CollateralClass.CLASS_A, VALUATION, BigInteger.ZERO, cap)).isTrue();
        assertThat(evaluator.canBorrow(CollateralClass.CLASS_A, VALUATION, BigInteger.ZERO, cap.add(BigInteger.ONE))).isFalse();
        assertThat(evaluator.healthFactor(VALUATION, cap)).isEqualTo(BigInteger.valueOf(14_285));
    }

    @Test
    @DisplayName("class B uses its own LTV")
    void classBLtv() {
        assertThat(evaluator.maxBorrowable(CollateralClass.CLASS_B, VALUATION)).isEqualTo(BigInteger.valueOf(6_000_000_000L));
    }

    @Test
    @DisplayName("existing debt counts against the cap")
    void existingDebtCounts() {
        BigInteger existing = BigInteger.valueOf(5_000_000_000L);
        assertThat(evaluator.canBorrow(CollateralClass.CLASS_A, VALUATION, existing, BigInteger.valueOf(2_000_000_000L))).isTrue();
        assertThat(evaluator.canBorrow(CollateralClass.CLASS_A, VALUATION, existing, BigInteger.valueOf(2_000_000_001L))).isFalse();
    }

    @Test
    @DisplayName("revaluation to 9,000 then 7,500 USD: 12857 healthy, then 10714 liquidatable")
    void revaluationMovesHealthFactor() {
        BigInteger debt = BigInteger.valueOf(7_000_000_000L);

        HealthSnapshot first = evaluator.evaluate(CollateralClass.CLASS_A, BigInteger.valueOf(9_000_000_000L), debt);
        assertThat(first.healthFactor()).isEqualTo(BigInteger.valueOf(12_857));
        assertThat(first.status()).isEqualTo(HealthStatus.HEALTHY);

        HealthSnapshot second = evaluator.evaluate(CollateralClass.CLASS_A, BigInteger.valueOf(7_500_000_000L), debt);
        assertThat(second.healthFactor()).isEqualTo(BigInteger.valueOf(10_714));
        assertThat(second.status()).isEqualTo(HealthStatus.LIQUIDATABLE);
        assertThat(second.liquidatable()).isTrue();
        assertThat(second.availableToBorrow()).isZero();
    }

    @Test
    @DisplayName("warning band is inclusive at 12500 and liquidation threshold exclusive at 11000")
    void bandBoundaries() {
        assertThat(evaluator.classify(BigInteger.valueOf(12_501))).isEqualTo(HealthStatus.HEALTHY);
        assertThat(evaluator.classify(BigInteger.valueOf(12_500))).isEqualTo(HealthStatus.WARNING);
        assertThat(evaluator.classify(BigInteger.valueOf(11_000))).isEqualTo(HealthStatus.WARNING);
        assertThat(evaluator.classify(BigInteger.valueOf(10_999))).isEqualTo(HealthStatus.LIQUIDATABLE);
    }

    @Test
    @DisplayName("no debt: unbounded health factor, never liquidatable")
    void noDebt() {
        HealthSnapshot snapshot = evaluator.evaluate(CollateralClass.CLASS_A, VALUATION, BigInteger.ZERO);
        assertThat(snapshot.healthFactor()).isNull();
        assertThat(snapshot.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(evaluator.isLiquidatable(null)).isFalse();
        assertThat(snapshot.availableToBorrow()).isEqualTo(BigInteger.valueOf(7_000_000_000L));
    }

    @Test
    @DisplayName("health factor decreases monotonically as debt grows")
    void monotonicInDebt() {
        BigInteger previous = null;
        for (long debt = 1_000_000_000L; debt <= 7_000_000_000L; debt += 500_000_000L) {
            BigInteger hf = evaluator.healthFactor(VALUATION, BigInteger.valueOf(debt));
            if (previous != null) {
                assertThat(hf).isLessThanOrEqualTo(previous);
            }
            previous = hf;
        }
    }
}
