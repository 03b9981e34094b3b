package com.tango.stream.raffle.conf;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;

@Configuration
public class CommonConfig {
    public static ObjectMapper DEFAULT_OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Bean
    public ObjectMapper objectMapper() {
        return DEFAULT_OBJECT_MAPPER;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Seeds of draws come from here.
     */
    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }
}
