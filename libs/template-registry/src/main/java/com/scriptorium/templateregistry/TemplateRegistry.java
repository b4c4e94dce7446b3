package com.scriptorium.templateregistry;

import com.scriptorium.templatemodel.DocumentTemplate;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name-keyed store of master {@link DocumentTemplate}s that dispenses deep clones.
 *
 * <p>{@link #register(String, DocumentTemplate)} takes ownership of the exact instance it is given;
 * callers must not mutate it afterwards. {@link #create(String)} never exposes a master, only a
 * fresh {@link DocumentTemplate#deepClone()} of it, which the caller owns outright.
 *
 * <p>Safe for concurrent use. A lookup racing an overwrite of the same name clones either the old
 * or the new master, both of which are complete and never mutated.
 */
public final class TemplateRegistry {

    private static final Logger log = LoggerFactory.getLogger(TemplateRegistry.class);

    private final Map<String, DocumentTemplate> masters = new ConcurrentHashMap<>();

    /**
     * Stores {@code template} as the master for {@code name}, replacing any previous master.
     *
     * @param name     lookup key, e.g. "service_contract"
     * @param template the master; stored as-is, not copied
     */
    public void register(String name, DocumentTemplate template) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (template == null) {
            throw new IllegalArgumentException("template must not be null");
        }
        DocumentTemplate previous = masters.put(name, template);
        if (previous != null) {
            log.info("Replaced master template '{}'", name);
        } else {
            log.debug("Registered master template '{}'", name);
        }
    }

    /**
     * Returns an independent deep clone of the master registered under {@code name}.
     *
     * @throws TemplateNotFoundException if nothing is registered under {@code name}
     */
    public DocumentTemplate create(String name) {
        DocumentTemplate master = name != null ? masters.get(name) : null;
        if (master == null) {
            throw new TemplateNotFoundException(name);
        }
        return master.deepClone();
    }

    /** Whether a master is registered under {@code name}. */
    public boolean contains(String name) {
        return name != null && masters.containsKey(name);
    }

    /**
     * Removes the master registered under {@code name}.
     *
     * @return true if a master was removed
     */
    public boolean deregister(String name) {
        boolean removed = name != null && masters.remove(name) != null;
        if (removed) {
            log.info("Deregistered master template '{}'", name);
        }
        return removed;
    }

    /** Snapshot of the registered names, sorted. */
    public Set<String> names() {
        return new TreeSet<>(masters.keySet());
    }

    /** Number of registered masters. */
    public int size() {
        return masters.size();
    }
}
