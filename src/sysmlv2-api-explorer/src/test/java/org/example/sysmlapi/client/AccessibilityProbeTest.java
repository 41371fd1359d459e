package org.example.sysmlapi.client;

import org.example.sysmlapi.config.ExplorerSettings;
import org.example.sysmlapi.model.Element;
import org.example.sysmlapi.testutil.MockApiServer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AccessibilityProbeTest {

    @Test
    void keepsAccessibleProjectsInInputOrder() {
        SysMLApiClient client = mock(SysMLApiClient.class);
        when(client.isProjectAccessible(anyString())).thenAnswer(inv -> !inv.getArgument(0, String.class).startsWith("x"));

        List<Element> projects = List.of(
            Element.parse("{\"@id\":\"p3\"}"),
            Element.parse("{\"@id\":\"x1\"}"),
            Element.parse("{\"@id\":\"p1\"}"),
            Element.parse("{\"name\":\"no id\"}"),
            Element.parse("{\"@id\":\"p2\"}"));

        List<Element> accessible;
        try (AccessibilityProbe probe = new AccessibilityProbe(client, 4)) {
            accessible = probe.accessible(projects);
        }

        assertEquals(List.of("p3", "p1", "p2"), accessible.stream().map(Element::id).collect(Collectors.toList()));
    }

    @Test
    void projectWhoseIdCannotFormAUrlIsLeftOut() throws IOException {
        try (MockApiServer server = new MockApiServer().respond("/projects/p1/commits", "[]")) {
            SysMLApiClient client = new SysMLApiClient(ExplorerSettings.defaults(server.baseUrl()), "u", "p");
            List<Element> projects = List.of(
                Element.parse("{\"@id\":\"p1\"}"),
                Element.parse("{\"@id\":\"bad id\"}"));

            List<Element> accessible;
            try (AccessibilityProbe probe = new AccessibilityProbe(client, 2)) {
                accessible = probe.accessible(projects);
            }

            assertEquals(List.of("p1"), accessible.stream().map(Element::id).collect(Collectors.toList()));
        }
    }
}
