package com.cfamily.astexport.frontend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Front ends available on the class path, in discovery order.
 */
public class FrontEndRegistry {

    private static final Logger log = LoggerFactory.getLogger(FrontEndRegistry.class);

    private final List<FrontEnd> frontEnds;

    public FrontEndRegistry(List<FrontEnd> frontEnds) {
        this.frontEnds = List.copyOf(frontEnds);
    }

    public static FrontEndRegistry load() {
        List<FrontEnd> found = new ArrayList<>();
        for (FrontEnd frontEnd : ServiceLoader.load(FrontEnd.class)) {
            log.debug("Discovered front end {} ({})", frontEnd.name(), frontEnd.getClass().getName());
            found.add(frontEnd);
        }
        return new FrontEndRegistry(found);
    }

    public List<FrontEnd> getFrontEnds() {
        return frontEnds;
    }

    public Optional<FrontEnd> byName(String name) {
        return frontEnds.stream()
                .filter(f -> f.name().equalsIgnoreCase(name))
                .findFirst();
    }

    /**
     * The named front end when {@code name} is given, otherwise the first one supporting
     * {@code source}.
     */
    public Optional<FrontEnd> select(String name, Path source) {
        if (name != null && !name.isBlank()) {
            return byName(name);
        }
        return frontEnds.stream()
                .filter(f -> f.supports(source))
                .findFirst();
    }

    public boolean isEmpty() {
        return frontEnds.isEmpty();
    }
}
