package com.scriptorium.documentservice.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the document service, bound from {@code scriptorium.templates.*}:
 *
 * <pre>
 * scriptorium:
 *   templates:
 *     service-name: document-service
 *     builtins-enabled: true
 *     catalog-locations:
 *       - classpath*:templates/*.json
 * </pre>
 *
 * @param serviceName      name used in logs and the info endpoint. Required.
 * @param builtinsEnabled  whether the built-in contract templates are registered (default true)
 * @param catalogLocations Spring resource patterns of JSON master templates; each file registers
 *                         a template named after its base name
 */
@ConfigurationProperties(prefix = "scriptorium.templates")
@Validated
public record DocumentServiceProperties(
        @NotBlank String serviceName, Boolean builtinsEnabled, List<String> catalogLocations) {

    public static final String DEFAULT_CATALOG_LOCATION = "classpath*:templates/*.json";

    /** Applies defaults before Bean Validation runs. */
    public DocumentServiceProperties {
        if (builtinsEnabled == null) {
            builtinsEnabled = Boolean.TRUE;
        }
        if (catalogLocations == null || catalogLocations.isEmpty()) {
            catalogLocations = List.of(DEFAULT_CATALOG_LOCATION);
        } else {
            catalogLocations = List.copyOf(catalogLocations);
        }
    }
}
