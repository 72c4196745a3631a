package com.stylus.stream.broker;

import com.stylus.stream.broker.util.TestClock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

@Configuration
public class TestConfigurationClass {

    @Bean
    @Primary
    public TestClock testClock() {
        return new TestClock(Clock.systemDefaultZone());
    }
}
