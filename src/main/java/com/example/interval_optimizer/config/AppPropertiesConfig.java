package com.example.interval_optimizer.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties(OptimizerProperties.class)
public class AppPropertiesConfig {
}
