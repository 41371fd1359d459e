package org.example.sysmlapi.generate;

import org.example.sysmlapi.model.Element;

/**
 * Decides whether an element present in both commits counts as modified.
 */
public enum ModificationPolicy {

    /** Compares the serialized JSON text; the same number written as 1 and 1.0 counts as a change. */
    TEXTUAL {
        @Override
        public boolean isModified(Element before, Element after) {
            return !before.toJson().equals(after.toJson());
        }
    },

    /** Compares the JSON trees; key order and number notation are ignored. */
    STRUCTURAL {
        @Override
        public boolean isModified(Element before, Element after) {
            return !before.json().similar(after.json());
        }
    };

    public abstract boolean isModified(Element before, Element after);
}
