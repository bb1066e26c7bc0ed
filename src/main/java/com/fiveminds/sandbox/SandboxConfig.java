package com.fiveminds.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashSet;

/**
 * Wires the default {@link SandboxProvider}. Supply another provider bean to replace it.
 */
@Configuration
public class SandboxConfig {

    private static final Logger log = LoggerFactory.getLogger(SandboxConfig.class);

    @Bean
    @ConditionalOnMissingBean(SandboxProvider.class)
    public SandboxProvider localCopySandboxProvider(SandboxProperties properties) {
        log.info("Using local-copy sandbox provider rooted at {}", properties.getRootPath());
        return new LocalCopySandboxProvider(properties.getRootPath(), new HashSet<>(properties.getExcludes()));
    }
}
