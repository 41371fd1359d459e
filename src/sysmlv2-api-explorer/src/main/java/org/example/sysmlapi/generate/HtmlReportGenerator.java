package org.example.sysmlapi.generate;

import org.example.sysmlapi.model.Element;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Builds a self-contained HTML page for a set of cached elements: a searchable
 * sidebar with one entry per element, a statistics header, and the element
 * JSON embedded for a client-side property view.
 */
public class HtmlReportGenerator {

    private final String css;
    private final String script;

    public HtmlReportGenerator() {
        this.css = resource("report.css");
        this.script = resource("report.js");
    }

    /**
     * @param projectLabel project name (or id) shown in the sidebar header
     * @param commitId     commit the elements were read from
     * @param elements     id to element, rendered in map order
     * @param exportDate   date shown in the statistics header
     */
    public String generate(String projectLabel, String commitId, Map<String, Element> elements, LocalDate exportDate) {
        StringBuilder html = new StringBuilder(4096 + elements.size() * 512);

        html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n");
        html.append("<meta charset=\"UTF-8\">\n");
        html.append("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n");
        html.append("<title>SysML v2 Export: ").append(escapeHtml(projectLabel)).append("</title>\n");
        html.append("<style>\n").append(css).append("</style>\n");
        html.append("</head>\n<body>\n<div class=\"container\">\n");

        // ── Sidebar ──
        html.append("<div class=\"sidebar\">\n");
        html.append("<div class=\"header\">\n<h1>SysML v2 Export</h1>\n");
        html.append("<p>Project: ").append(escapeHtml(projectLabel)).append("</p>\n");
        html.append("<p>Commit: ").append(escapeHtml(commitId)).append("</p>\n</div>\n");
        html.append("<div class=\"search-box\">")
            .append("<input type=\"text\" id=\"searchBox\" placeholder=\"Search elements...\" onkeyup=\"filterElements()\">")
            .append("</div>\n");
        html.append("<div class=\"nav-tree\" id=\"navTree\">\n");
        for (Map.Entry<String, Element> entry : elements.entrySet()) {
            Element element = entry.getValue();
            html.append("<div class=\"nav-item\" data-id=\"").append(escapeHtml(entry.getKey()))
                .append("\" onclick=\"showElement(this)\">")
                .append("<span class=\"nav-item-label\">").append(escapeHtml(element.displayName())).append("</span>")
                .append("<span class=\"nav-item-type\">").append(escapeHtml(element.simpleType())).append("</span>")
                .append("</div>\n");
        }
        html.append("</div>\n</div>\n");

        // ── Content ──
        html.append("<div class=\"content\">\n<div class=\"stats\">\n");
        html.append("<h2>Project Statistics</h2>\n<div class=\"stats-grid\">\n");
        appendStat(html, String.valueOf(elements.size()), "Total Elements");
        appendStat(html, String.valueOf(countTypes(elements)), "Element Types");
        appendStat(html, exportDate.toString(), "Export Date");
        html.append("</div>\n</div>\n");
        html.append("<div id=\"details\"><p class=\"hint\">Select an element from the sidebar to view details</p></div>\n");
        html.append("</div>\n</div>\n");

        // ── Data ──
        JSONObject data = new JSONObject();
        elements.forEach((id, element) -> data.put(id, element.json()));
        html.append("<script>\nconst elements = ").append(escapeScript(data.toString())).append(";\n");
        html.append(script).append("</script>\n");
        html.append("</body>\n</html>\n");
        return html.toString();
    }

    public static String escapeHtml(String text) {
        if (text == null || text.isEmpty()) return "";
        return text.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&#39;");
    }

    /** Keeps embedded JSON from terminating its {@code <script>} element early. */
    static String escapeScript(String json) {
        return json.replace("</", "<\\/");
    }

    private static void appendStat(StringBuilder html, String value, String label) {
        html.append("<div class=\"stat-item\"><div class=\"stat-value\">").append(escapeHtml(value))
            .append("</div><div class=\"stat-label\">").append(label).append("</div></div>\n");
    }

    private static int countTypes(Map<String, Element> elements) {
        Set<String> types = new HashSet<>();
        for (Element element : elements.values()) {
            types.add(element.type() != null ? element.type() : "Unknown");
        }
        return types.size();
    }

    private static String resource(String name) {
        try (InputStream in = HtmlReportGenerator.class.getResourceAsStream(name)) {
            if (in == null) throw new IllegalStateException("Missing resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
