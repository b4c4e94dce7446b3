package com.scriptorium.documentservice.config;

import com.scriptorium.templateregistry.TemplateRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Owns the single {@link TemplateRegistry} of the service. */
@Configuration
public class TemplateRegistryConfig {

    @Bean
    public TemplateRegistry templateRegistry() {
        return new TemplateRegistry();
    }
}
