package org.example.sysmlapi.generate;

import net.sourceforge.plantuml.FileFormat;
import net.sourceforge.plantuml.FileFormatOption;
import net.sourceforge.plantuml.SourceStringReader;
import org.example.sysmlapi.cache.ElementLookup;
import org.example.sysmlapi.model.Element;
import org.example.sysmlapi.model.ElementType;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Draws the cached ownership tree below one or more elements as nested
 * PlantUML rectangles, each labelled with the element name and type.
 */
public class DiagramGenerator {

    public enum Format {
        PUML("puml"), PNG("png"), SVG("svg");

        private final String extension;

        Format(String extension) {
            this.extension = extension;
        }

        public String extension() {
            return extension;
        }

        public static Format parse(String text) {
            for (Format f : values()) {
                if (f.extension.equals(text.toLowerCase(Locale.ROOT))) return f;
            }
            throw new IllegalArgumentException("Unsupported format: " + text + " (expected png, svg or puml)");
        }
    }

    private final ElementLookup lookup;
    private final int maxDepth;

    /** @param maxDepth levels drawn below each top element; 0 draws the top elements only */
    public DiagramGenerator(ElementLookup lookup, int maxDepth) {
        this.lookup = lookup;
        this.maxDepth = maxDepth;
    }

    public String toPlantUml(String title, List<Element> elements) {
        StringBuilder sb = new StringBuilder();
        sb.append("@startuml\n");
        if (title != null) sb.append("title ").append(quote(title)).append('\n');
        sb.append("skinparam rectangle {\n  RoundCorner 8\n}\n");
        int[] counter = {0};
        for (Element element : elements) {
            appendElement(sb, element, 0, counter, new HashSet<>());
        }
        sb.append("@enduml\n");
        return sb.toString();
    }

    /** Renders PlantUML source; {@link Format#PUML} returns the source itself as UTF-8. */
    public static byte[] render(String puml, Format format) throws IOException {
        if (format == Format.PUML) {
            return puml.getBytes(StandardCharsets.UTF_8);
        }
        FileFormat ff = format == Format.SVG ? FileFormat.SVG : FileFormat.PNG;
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            new SourceStringReader(puml).outputImage(baos, new FileFormatOption(ff));
            return baos.toByteArray();
        }
    }

    private void appendElement(StringBuilder sb, Element element, int depth, int[] counter, Set<String> path) {
        String indent = "  ".repeat(depth);
        String alias = "E" + (++counter[0]);
        String label = quote(element.displayName()) + "\\n«" + element.simpleType() + "»";

        boolean entered = depth < maxDepth && element.id() != null && path.add(element.id());
        List<Element> children = entered ? displayableChildren(element) : List.of();

        sb.append(indent).append("rectangle \"").append(label).append("\" as ").append(alias);
        if (children.isEmpty()) {
            sb.append('\n');
        } else {
            sb.append(" {\n");
            for (Element child : children) {
                appendElement(sb, child, depth + 1, counter, path);
            }
            sb.append(indent).append("}\n");
        }
        if (entered) path.remove(element.id());
    }

    private List<Element> displayableChildren(Element element) {
        return element.childReferenceIds().stream()
            .map(lookup::find)
            .flatMap(Optional::stream)
            .filter(ElementType::isDisplayable)
            .collect(Collectors.toList());
    }

    private static String quote(String text) {
        return text.replace("\"", "'");
    }
}
