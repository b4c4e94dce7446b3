package com.scriptorium.documentservice.infrastructure.catalog;

import com.scriptorium.templatemodel.DocumentTemplate;
import com.scriptorium.templatemodel.TemplateJson;
import com.scriptorium.templatemodel.TemplateJson.TemplateJsonException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

/**
 * Reads master templates from JSON resources.
 *
 * <p>Each resource holds one {@link DocumentTemplate}; its name is the file name without the
 * {@code .json} extension. Files whose name is blank without the extension are skipped. Read-only:
 * nothing is ever written back.
 */
@Component
public class TemplateCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(TemplateCatalogLoader.class);
    private static final String JSON_SUFFIX = ".json";

    private final ResourcePatternResolver resolver;

    public TemplateCatalogLoader() {
        this(new PathMatchingResourcePatternResolver());
    }

    public TemplateCatalogLoader(ResourcePatternResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Loads every template matched by {@code locations}, in location order. A later file with the
     * same name wins.
     *
     * @throws TemplateJsonException if a matched file is not a valid template
     * @throws UncheckedIOException  if a location cannot be scanned or a file cannot be opened
     */
    public Map<String, DocumentTemplate> load(List<String> locations) {
        Map<String, DocumentTemplate> templates = new LinkedHashMap<>();
        for (String location : locations) {
            for (Resource resource : resolve(location)) {
                String name = templateName(resource);
                if (name == null) {
                    continue;
                }
                if (name.isBlank()) {
                    log.warn("Skipping catalog file without a template name: {}", resource.getDescription());
                    continue;
                }
                templates.put(name, read(resource));
                log.debug("Loaded catalog template '{}' from {}", name, resource.getDescription());
            }
        }
        log.info("Loaded {} catalog template(s) from {}", templates.size(), locations);
        return templates;
    }

    private Resource[] resolve(String location) {
        try {
            return resolver.getResources(location);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan template catalog location " + location, e);
        }
    }

    private DocumentTemplate read(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return TemplateJson.read(in);
        } catch (TemplateJsonException e) {
            throw new TemplateJsonException("Invalid catalog template " + resource.getDescription(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open " + resource.getDescription(), e);
        }
    }

    private static String templateName(Resource resource) {
        String filename = resource.getFilename();
        if (filename == null || !filename.endsWith(JSON_SUFFIX)) {
            return null;
        }
        return filename.substring(0, filename.length() - JSON_SUFFIX.length());
    }
}
