package com.chainguru.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.Arrays;

/**
 * MongoDB configuration: measurement status is stored as its lower-case wire value in chain_metrics.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(Arrays.asList(
                new MeasurementStatusToStringConverter(),
                new StringToMeasurementStatusConverter()
        ));
    }
}
