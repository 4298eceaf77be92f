package com.bundleradar.detection.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Detection module configuration.
 */
@Configuration
@EnableConfigurationProperties(DetectionProperties.class)
public class DetectionConfig {
}
