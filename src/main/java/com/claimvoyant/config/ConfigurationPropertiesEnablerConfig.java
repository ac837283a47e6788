package com.claimvoyant.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes that are not components themselves.
 *
 * <ul>
 *   <li>{@link GeminiConfig} - Google Gemini API configuration
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    GeminiConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
