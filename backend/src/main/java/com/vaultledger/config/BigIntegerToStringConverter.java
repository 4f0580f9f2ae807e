package com.vaultledger.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigInteger;

/**
 * Writes base-unit amounts as decimal strings, so 18-decimal token quantities never pass through a double.
 */
@WritingConverter
public class BigIntegerToStringConverter implements Converter<BigInteger, String> {

    @Override
    public String convert(BigInteger source) {
        return source.toString();
    }
}
