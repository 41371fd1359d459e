package org.example.sysmlapi.model;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One model element as returned by the API: a JSON object keyed by {@code @id}.
 *
 * Child and cross references are {@code {"@id": ...}} stubs, never inline
 * elements, so navigating them requires a lookup or a fetch. The wrapped
 * JSON object must be treated as read-only once it is inside an Element.
 */
public final class Element {

    public static final String ID = "@id";
    public static final String TYPE = "@type";
    public static final String OWNED_MEMBER = "ownedMember";
    public static final String OWNED_FEATURE = "ownedFeature";

    private final JSONObject json;

    private Element(JSONObject json) {
        this.json = json;
    }

    public static Element of(JSONObject json) {
        Objects.requireNonNull(json, "json");
        return new Element(json);
    }

    public static Element parse(String text) {
        return new Element(new JSONObject(text));
    }

    // -------------------------------------------------------------------------
    // Identity
    // -------------------------------------------------------------------------

    public String id() {
        return json.optString(ID, null);
    }

    /** Full type tag, e.g. {@code PartUsage} or {@code sysml.PartUsage}; {@code null} if absent. */
    public String type() {
        return json.optString(TYPE, null);
    }

    /** Last dot-separated segment of the type tag, or {@code "Unknown"}. */
    public String simpleType() {
        String type = type();
        if (type == null || type.isBlank()) return "Unknown";
        int dot = type.lastIndexOf('.');
        return dot >= 0 ? type.substring(dot + 1) : type;
    }

    // -------------------------------------------------------------------------
    // Names
    // -------------------------------------------------------------------------

    /**
     * Returns {@code name}, then {@code declaredName}, then the last segment of
     * {@code qualifiedName} with surrounding quotes removed; {@code null} when
     * none is present.
     */
    public String name() {
        String name = nonBlank(string("name"));
        if (name == null) name = nonBlank(string("declaredName"));
        if (name == null) {
            String qn = nonBlank(string("qualifiedName"));
            if (qn != null) {
                String[] parts = qn.split("::");
                name = nonBlank(parts[parts.length - 1].replaceAll("^'|'$", ""));
            }
        }
        return name;
    }

    /** {@link #name()} or the first 8 characters of the id. */
    public String displayName() {
        String name = name();
        if (name != null) return name;
        String id = id();
        if (id == null) return "(unnamed)";
        return id.length() > 8 ? id.substring(0, 8) : id;
    }

    public String qualifiedName() {
        return nonBlank(string("qualifiedName"));
    }

    public String shortName() {
        String sn = nonBlank(string("shortName"));
        return sn != null ? sn : nonBlank(string("declaredShortName"));
    }

    // -------------------------------------------------------------------------
    // References
    // -------------------------------------------------------------------------

    /**
     * Returns the ids referenced under {@code key}, which may hold a single
     * reference object, an array of them, or bare id strings.
     */
    public List<String> references(String key) {
        Object value = json.opt(key);
        List<String> ids = new ArrayList<>();
        if (value instanceof JSONArray array) {
            for (Object item : array) {
                String id = referenceId(item);
                if (id != null) ids.add(id);
            }
        } else {
            String id = referenceId(value);
            if (id != null) ids.add(id);
        }
        return ids;
    }

    public List<String> ownedMemberIds() {
        return references(OWNED_MEMBER);
    }

    public List<String> ownedFeatureIds() {
        return references(OWNED_FEATURE);
    }

    /**
     * Owned members followed by owned features, without duplicates. A feature
     * that is also listed as a member keeps its member position.
     */
    public List<String> childReferenceIds() {
        Set<String> ids = new LinkedHashSet<>(ownedMemberIds());
        ids.addAll(ownedFeatureIds());
        return List.copyOf(ids);
    }

    public boolean hasChildReferences() {
        return !ownedMemberIds().isEmpty() || !ownedFeatureIds().isEmpty();
    }

    private static String referenceId(Object item) {
        if (item instanceof JSONObject ref) return nonBlank(ref.optString(ID, null));
        if (item instanceof String s) return nonBlank(s);
        return null;
    }

    // -------------------------------------------------------------------------
    // Raw access
    // -------------------------------------------------------------------------

    public boolean has(String key) {
        return json.has(key) && !json.isNull(key);
    }

    public String string(String key) {
        return json.optString(key, null);
    }

    public Object get(String key) {
        return json.opt(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(json.keySet());
    }

    public JSONObject json() {
        return json;
    }

    public String toJson() {
        return json.toString();
    }

    private static String nonBlank(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    // -------------------------------------------------------------------------
    // Equality is structural over the JSON payload.
    // -------------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Element other)) return false;
        return json.similar(other.json);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id(), type());
    }

    @Override
    public String toString() {
        return displayName() + " [" + simpleType() + "]";
    }
}
