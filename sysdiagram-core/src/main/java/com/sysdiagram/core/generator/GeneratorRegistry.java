package com.sysdiagram.core.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up {@link DiagramGenerator} implementations registered through {@link ServiceLoader}.
 */
public final class GeneratorRegistry {

    private static final Logger log = LoggerFactory.getLogger(GeneratorRegistry.class);

    private final List<DiagramGenerator> generators;

    private GeneratorRegistry(List<DiagramGenerator> generators) {
        this.generators = Collections.unmodifiableList(generators);
    }

    /**
     * Discovers all generators on the class path.
     *
     * @return registry of discovered generators, in discovery order
     */
    public static GeneratorRegistry load() {
        List<DiagramGenerator> found = new ArrayList<>();
        ServiceLoader.load(DiagramGenerator.class).forEach(found::add);
        log.debug("Discovered {} diagram generators", found.size());
        return new GeneratorRegistry(found);
    }

    /**
     * Returns all discovered generators.
     *
     * @return generators
     */
    public List<DiagramGenerator> all() {
        return generators;
    }

    /**
     * Finds a generator by id, ignoring case.
     *
     * @param id generator id
     * @return matching generator, if any
     */
    public Optional<DiagramGenerator> find(String id) {
        return generators.stream()
            .filter(g -> g.getId().equalsIgnoreCase(id))
            .findFirst();
    }

    /**
     * Finds a generator by id.
     *
     * @param id generator id
     * @return matching generator
     * @throws IllegalArgumentException if no generator has that id
     */
    public DiagramGenerator require(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException(
            "Unknown generator: " + id + ". Available: " + ids()));
    }

    /**
     * Returns the ids of all discovered generators.
     *
     * @return generator ids
     */
    public List<String> ids() {
        return generators.stream().map(DiagramGenerator::getId).toList();
    }
}
