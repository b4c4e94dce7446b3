package com.scriptorium.documentservice;

import com.scriptorium.documentservice.config.DocumentServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Scriptorium document service.
 *
 * <p>Builds the master document templates once at startup, registers them in a {@link
 * com.scriptorium.templateregistry.TemplateRegistry}, and hands out independent clones on request.
 */
@SpringBootApplication
@EnableConfigurationProperties(DocumentServiceProperties.class)
public class DocumentServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(DocumentServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DocumentServiceApplication.class, args);
        log.info("Scriptorium document service started");
    }
}
