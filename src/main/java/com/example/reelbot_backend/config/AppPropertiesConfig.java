package com.example.reelbot_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({QueueProperties.class, ProgressProperties.class, PipelineProperties.class, ActorProperties.class})
public class AppPropertiesConfig {
}
