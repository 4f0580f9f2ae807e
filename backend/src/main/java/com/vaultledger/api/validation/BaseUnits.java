package com.vaultledger.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Decimal integer string in token base units ("1500000"), no sign, fraction or exponent.
 * Error code for API: INVALID_AMOUNT.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = BaseUnitsValidator.class)
public @interface BaseUnits {

    String message() default "INVALID_AMOUNT";

    /** Whether "0" is accepted. */
    boolean allowZero() default false;

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
