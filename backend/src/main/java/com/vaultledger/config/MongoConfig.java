package com.vaultledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.Arrays;

/**
 * MongoDB configuration: every monetary field is a BigInteger stored as a decimal string.
 * Indexes are created from @CompoundIndex / @Indexed on domain documents at startup
 * (spring.data.mongodb.auto-index-creation).
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(Arrays.asList(
                new BigIntegerToStringConverter(),
                new StringToBigIntegerConverter()
        ));
    }
}
