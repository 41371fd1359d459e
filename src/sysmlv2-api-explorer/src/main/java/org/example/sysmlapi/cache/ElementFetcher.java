package org.example.sysmlapi.cache;

import org.example.sysmlapi.model.Element;

/**
 * Loads one element by id from its source of truth, usually the API scoped
 * to a project and commit.
 */
@FunctionalInterface
public interface ElementFetcher {
    Element fetch(String elementId);
}
