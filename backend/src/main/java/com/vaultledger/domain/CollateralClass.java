package com.vaultledger.domain;

/**
 * Collateral class tag; each class has its own LTV cap. {@code onChainCode} is the vault's uint8 token type.
 */
public enum CollateralClass {
    CLASS_A(0),
    CLASS_B(1);

    private final int onChainCode;

    CollateralClass(int onChainCode) {
        this.onChainCode = onChainCode;
    }

    public int onChainCode() {
        return onChainCode;
    }

    public static CollateralClass fromOnChainCode(int code) {
        for (CollateralClass c : values()) {
            if (c.onChainCode == code) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown collateral class code: " + code);
    }
}
