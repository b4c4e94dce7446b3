package com.scriptorium.documentservice.domain;

import com.scriptorium.documentservice.config.DocumentServiceProperties;
import com.scriptorium.documentservice.infrastructure.catalog.TemplateCatalogLoader;
import com.scriptorium.templatemodel.DocumentTemplate;
import com.scriptorium.templateregistry.TemplateNotFoundException;
import com.scriptorium.templateregistry.TemplateRegistry;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Populates the {@link TemplateRegistry} with master templates and serves clones of them.
 *
 * <p>Masters come from two places: the built-in contracts of {@link ContractTemplates} and the JSON
 * catalog found by {@link TemplateCatalogLoader}. A catalog entry with a built-in's name replaces
 * the built-in.
 */
@Service
public class DocumentTemplateService {

    private static final Logger log = LoggerFactory.getLogger(DocumentTemplateService.class);

    private final TemplateRegistry registry;
    private final TemplateCatalogLoader catalogLoader;
    private final DocumentServiceProperties properties;
    private final Clock clock;

    @Autowired
    public DocumentTemplateService(
            TemplateRegistry registry,
            TemplateCatalogLoader catalogLoader,
            DocumentServiceProperties properties) {
        this(registry, catalogLoader, properties, Clock.systemDefaultZone());
    }

    DocumentTemplateService(
            TemplateRegistry registry,
            TemplateCatalogLoader catalogLoader,
            DocumentServiceProperties properties,
            Clock clock) {
        this.registry = registry;
        this.catalogLoader = catalogLoader;
        this.properties = properties;
        this.clock = clock;
    }

    /** Registers every master. Runs once, when the bean is ready. */
    @PostConstruct
    public void registerMasters() {
        if (properties.builtinsEnabled()) {
            DocumentTemplate serviceContract = ContractTemplates.serviceContract(clock);
            registry.register(ContractTemplates.SERVICE_CONTRACT, serviceContract);
            registry.register(ContractTemplates.CONSULTING_CONTRACT,
                    ContractTemplates.consultingContract(serviceContract));
        }
        Map<String, DocumentTemplate> catalog = catalogLoader.load(properties.catalogLocations());
        catalog.forEach(registry::register);
        log.info("{} registered {} master template(s): {}",
                properties.serviceName(), registry.size(), registry.names());
    }

    /**
     * Returns a fresh clone of the named master for the caller to customize.
     *
     * @throws TemplateNotFoundException if no master has that name
     */
    public DocumentTemplate create(String name) {
        return registry.create(name);
    }

    /**
     * Registers a new master derived from an existing one: the source is cloned, the clone is
     * passed to {@code customizer}, and the result is registered under {@code targetName}. The
     * source master is never touched.
     *
     * @return a clone of the newly registered master
     * @throws TemplateNotFoundException if {@code sourceName} is not registered
     */
    public DocumentTemplate derive(
            String sourceName, String targetName, Consumer<DocumentTemplate> customizer) {
        DocumentTemplate derived = registry.create(sourceName);
        customizer.accept(derived);
        registry.register(targetName, derived);
        log.info("Derived master template '{}' from '{}'", targetName, sourceName);
        return derived.deepClone();
    }

    /** Names of all registered masters, sorted. */
    public Set<String> templateNames() {
        return registry.names();
    }
}
