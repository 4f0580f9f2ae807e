package com.vaultledger.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.math.BigInteger;

@ReadingConverter
public class StringToBigIntegerConverter implements Converter<String, BigInteger> {

    @Override
    public BigInteger convert(String source) {
        return new BigInteger(source);
    }
}
