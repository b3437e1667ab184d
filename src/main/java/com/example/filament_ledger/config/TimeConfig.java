package com.example.filament_ledger.config;

import com.example.filament_ledger.ledger.IdGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
class TimeConfig {
    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }

    @Bean
    public IdGenerator idGenerator() {
        return IdGenerator.random();
    }
}
