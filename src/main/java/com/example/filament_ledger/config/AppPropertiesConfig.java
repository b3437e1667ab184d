package com.example.filament_ledger.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({LedgerProperties.class, RecognitionProperties.class})
public class AppPropertiesConfig {
}
