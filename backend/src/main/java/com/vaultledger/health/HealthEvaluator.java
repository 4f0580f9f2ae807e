package com.vaultledger.health;

import com.vaultledger.domain.CollateralClass;
import com.vaultledger.domain.HealthStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * LTV capacity and health-factor math. No I/O; every input comes from the caller.
 * <ul>
 *   <li>maxBorrowable = LTV[class] * valuation / 10000</li>
 *   <li>healthFactor = valuation * 10000 / debt (integer division), absent when debt is zero</li>
 *   <li>liquidatable iff healthFactor &lt; liquidation threshold; a debt-free position never is</li>
 * </ul>
 * Flagging is all this class does; liquidation is a separate explicit admin action.
 */
@Component
@RequiredArgsConstructor
public class HealthEvaluator {

    public static final BigInteger BPS = BigInteger.valueOf(10_000);

    private final HealthProperties properties;

    public int ltvBps(CollateralClass collateralClass) {
        return switch (collateralClass) {
            case CLASS_A -> properties.getLtvClassABps();
            case CLASS_B -> properties.getLtvClassBBps();
        };
    }

    public BigInteger maxBorrowable(CollateralClass collateralClass, BigInteger valuationUsd) {
        return BigInteger.valueOf(ltvBps(collateralClass)).multiply(valuationUsd).divide(BPS);
    }

    /**
     * @return health factor in bps, or null when {@code outstandingDebt} is zero
     */
    public BigInteger healthFactor(BigInteger valuationUsd, BigInteger outstandingDebt) {
        if (outstandingDebt == null || outstandingDebt.signum() <= 0) {
            return null;
        }
        return valuationUsd.multiply(BPS).divide(outstandingDebt);
    }

    public boolean isLiquidatable(BigInteger healthFactor) {
        return healthFactor != null
                && healthFactor.compareTo(BigInteger.valueOf(properties.getLiquidationThresholdBps())) < 0;
    }

    public HealthStatus classify(BigInteger healthFactor) {
        if (healthFactor == null) {
            return HealthStatus.HEALTHY;
        }
        if (isLiquidatable(healthFactor)) {
            return HealthStatus.LIQUIDATABLE;
        }
        if (healthFactor.compareTo(BigInteger.valueOf(properties.getWarningThresholdBps())) <= 0) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.HEALTHY;
    }

    /**
     * True when borrowing {@code amount} on top of {@code existingDebt} stays within the LTV cap.
     */
    public boolean canBorrow(CollateralClass collateralClass, BigInteger valuationUsd, BigInteger existingDebt, BigInteger amount) {
        return amount.add(existingDebt).compareTo(maxBorrowable(collateralClass, valuationUsd)) <= 0;
    }

    public HealthSnapshot evaluate(CollateralClass collateralClass, BigInteger valuationUsd, BigInteger outstandingDebt) {
        BigInteger hf = healthFactor(valuationUsd, outstandingDebt);
        BigInteger max = maxBorrowable(collateralClass, valuationUsd);
        BigInteger available = max.subtract(outstandingDebt).max(BigInteger.ZERO);
        return new HealthSnapshot(hf, classify(hf), outstandingDebt, max, available);
    }
}
