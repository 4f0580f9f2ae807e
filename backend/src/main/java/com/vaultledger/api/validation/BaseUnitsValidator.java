package com.vaultledger.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

public class BaseUnitsValidator implements ConstraintValidator<BaseUnits, String> {

    private static final Pattern DECIMAL_INTEGER = Pattern.compile("^[0-9]{1,78}$");

    private boolean allowZero;

    @Override
    public void initialize(BaseUnits annotation) {
        this.allowZero = annotation.allowZero();
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        String trimmed = value.trim();
        if (!DECIMAL_INTEGER.matcher(trimmed).matches()) {
            return false;
        }
        return allowZero || trimmed.chars().anyMatch(c -> c != '0');
    }
}
