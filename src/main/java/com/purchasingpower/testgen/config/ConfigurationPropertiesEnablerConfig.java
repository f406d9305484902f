package com.purchasingpower.testgen.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes of this package.
 *
 * <ul>
 *   <li>{@link GlobalRetryConfig} - retry and circuit breaker settings
 *   <li>{@link CompressionProperties} - context compression settings
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    GlobalRetryConfig.class,
    CompressionProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
