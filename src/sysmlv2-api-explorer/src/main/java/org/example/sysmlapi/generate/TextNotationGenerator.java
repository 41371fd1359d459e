package org.example.sysmlapi.generate;

import org.example.sysmlapi.cache.ElementLookup;
import org.example.sysmlapi.model.Element;
import org.example.sysmlapi.model.ElementType;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Renders cached elements as SysML v2 textual notation.
 *
 * <p>Each displayable element becomes {@code keyword name;} or
 * {@code keyword name { ... }} when at least one of its children is cached and
 * displayable. Children are looked up, never fetched: a child that is not in
 * the lookup is left out.
 */
public class TextNotationGenerator {

    public static final String INDENT = "    ";

    private static final DateTimeFormatter HEADER_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ElementLookup lookup;

    public TextNotationGenerator(ElementLookup lookup) {
        this.lookup = lookup;
    }

    /**
     * Renders {@code element} and its cached subtree at indent level 0. An
     * element whose type has no keyword renders as a one-line comment.
     */
    public String generate(Element element) {
        Optional<ElementType> type = ElementType.of(element);
        if (type.isEmpty()) {
            return "/* " + element.simpleType() + " */\n";
        }
        StringBuilder sb = new StringBuilder();
        render(element, type.get(), 0, sb, new HashSet<>());
        return sb.toString();
    }

    /** Renders each element in turn, separated by blank lines; undisplayable ones are skipped. */
    public String generateAll(List<Element> elements) {
        StringBuilder sb = new StringBuilder();
        for (Element element : elements) {
            Optional<ElementType> type = ElementType.of(element);
            if (type.isEmpty()) continue;
            render(element, type.get(), 0, sb, new HashSet<>());
            sb.append('\n');
        }
        return sb.toString();
    }

    /** The comment block written at the top of an exported {@code .sysml} file. */
    public static String header(String projectName, String commitName, String commitId, LocalDateTime exportedAt) {
        StringBuilder sb = new StringBuilder();
        sb.append("// SysML v2 Export\n");
        sb.append("// Project: ").append(projectName).append('\n');
        sb.append("// Commit: ").append(commitName != null ? commitName : "(unnamed)")
            .append(" (").append(commitId).append(")\n");
        sb.append("// Exported: ").append(HEADER_TIME.format(exportedAt)).append('\n');
        sb.append('\n');
        return sb.toString();
    }

    /**
     * Quotes names that are not plain identifiers: any name containing a
     * space, a single quote or a parenthesis is wrapped in single quotes with
     * embedded quotes backslash-escaped.
     */
    public static String escapeName(String name) {
        if (name == null) return null;
        if (name.contains(" ") || name.contains("'") || name.contains("(") || name.contains(")")) {
            return "'" + name.replace("'", "\\'") + "'";
        }
        return name;
    }

    // -------------------------------------------------------------------------
    // Rendering
    // -------------------------------------------------------------------------

    private void render(Element element, ElementType type, int level, StringBuilder sb, Set<String> path) {
        String indent = INDENT.repeat(level);

        switch (type) {
            case COMMENT -> {
                String body = element.string("body");
                if (body != null && !body.isEmpty()) {
                    sb.append(indent).append("/* ").append(body).append(" */\n");
                }
                return;
            }
            case DOCUMENTATION -> {
                String body = element.string("body");
                sb.append(indent).append(type.keyword());
                if (body != null && !body.isEmpty()) {
                    sb.append(" /* ").append(body).append(" */\n");
                } else {
                    sb.append(";\n");
                }
                return;
            }
            default -> { }
        }

        sb.append(indent).append(type.keyword());
        String name = element.name();
        if (name != null) {
            sb.append(' ').append(escapeName(name));
        }

        String id = element.id();
        if (id != null && !path.add(id)) {
            // Ownership cycle; stop descending.
            sb.append(";\n");
            return;
        }

        List<Child> children = displayableChildren(element);
        if (children.isEmpty()) {
            sb.append(";\n");
        } else {
            sb.append(" {\n");
            for (Child child : children) {
                render(child.element(), child.type(), level + 1, sb, path);
            }
            sb.append(indent).append("}\n");
        }

        if (id != null) path.remove(id);
    }

    private record Child(Element element, ElementType type) {}

    private List<Child> displayableChildren(Element element) {
        List<Child> children = new ArrayList<>();
        for (String childId : element.childReferenceIds()) {
            lookup.find(childId).ifPresent(child ->
                ElementType.of(child).ifPresent(type -> children.add(new Child(child, type))));
        }
        return children;
    }
}
