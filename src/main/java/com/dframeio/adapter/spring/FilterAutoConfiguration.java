package com.dframeio.adapter.spring;

import com.dframeio.config.ConfigLoader;
import com.dframeio.config.FilterEngineConfig;
import com.dframeio.filter.FilterEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the filter engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "dframeio.filter", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(FilterProperties.class)
public class FilterAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FilterAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public FilterEngineConfig filterEngineConfig(FilterProperties properties) {
        FilterEngineConfig config = properties.applyTo(ConfigLoader.load(properties.getConfigPath()));
        log.debug("Effective filter engine config after property overrides: {}", config);
        return config;
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterEngine filterEngine(FilterEngineConfig config) {
        log.info("Creating FilterEngine: {}", config);
        return new FilterEngine(config);
    }
}
