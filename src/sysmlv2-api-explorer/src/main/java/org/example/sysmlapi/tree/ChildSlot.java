package org.example.sysmlapi.tree;

import org.example.sysmlapi.model.Element;

/**
 * Outcome of resolving one child reference during expansion.
 *
 * @param id      the referenced element id
 * @param kind    what happened
 * @param element the resolved element; {@code null} only for {@link Kind#FAILED}
 * @param reason  failure message for {@link Kind#FAILED}, the type tag for {@link Kind#FILTERED}
 */
public record ChildSlot(String id, Kind kind, Element element, String reason) {

    public enum Kind {
        /** Fetched and displayable; becomes a tree child. */
        LOADED,
        /** Fetched but its type is not displayable; cached, not shown. */
        FILTERED,
        /** The fetch failed; omitted from the tree. */
        FAILED
    }

    public static ChildSlot loaded(String id, Element element) {
        return new ChildSlot(id, Kind.LOADED, element, null);
    }

    public static ChildSlot filtered(String id, Element element) {
        return new ChildSlot(id, Kind.FILTERED, element, element.type());
    }

    public static ChildSlot failed(String id, String reason) {
        return new ChildSlot(id, Kind.FAILED, null, reason);
    }

    public boolean isLoaded()   { return kind == Kind.LOADED; }
    public boolean isFiltered() { return kind == Kind.FILTERED; }
    public boolean isFailed()   { return kind == Kind.FAILED; }
}
