package com.tango.stream.raffle;

import com.tango.stream.raffle.util.TestClock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

@Configuration
public class TestConfigurationClass {

    @Bean
    @Primary
    public Clock testClock() {
        return new TestClock(Clock.systemUTC());
    }
}
