package org.example.sysmlapi.cache;

import org.example.sysmlapi.model.Element;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only id-to-element resolution used by the generators.
 */
@FunctionalInterface
public interface ElementLookup {

    Optional<Element> find(String elementId);

    static ElementLookup of(Map<String, Element> elements) {
        return id -> Optional.ofNullable(elements.get(id));
    }
}
