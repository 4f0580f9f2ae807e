package com.vaultledger.api.validation;

import com.vaultledger.common.Addresses;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Null is left to {@code @NotBlank}.
 */
public class EvmAddressValidator implements ConstraintValidator<EvmAddress, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || Addresses.isValid(value);
    }
}
