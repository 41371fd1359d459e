package org.example.sysmlapi.model;

import org.json.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ElementTest {

    @Nested
    @DisplayName("names")
    class Names {

        @Test
        void nameWinsOverDeclaredName() {
            Element e = Element.parse("{\"@id\":\"a\",\"name\":\"Engine\",\"declaredName\":\"Other\"}");
            assertEquals("Engine", e.name());
        }

        @Test
        void fallsBackToDeclaredName() {
            Element e = Element.parse("{\"@id\":\"a\",\"name\":\"\",\"declaredName\":\"Motor\"}");
            assertEquals("Motor", e.name());
        }

        @Test
        void fallsBackToLastQualifiedNameSegmentWithoutQuotes() {
            Element e = Element.parse("{\"@id\":\"a\",\"qualifiedName\":\"Vehicle::'Front Axle'\"}");
            assertEquals("Front Axle", e.name());
        }

        @Test
        void displayNameUsesIdPrefixWhenUnnamed() {
            Element e = Element.parse("{\"@id\":\"0123456789abcdef\"}");
            assertNull(e.name());
            assertEquals("01234567", e.displayName());
        }

        @Test
        void shortNameFallsBackToDeclaredShortName() {
            Element e = Element.parse("{\"@id\":\"a\",\"declaredShortName\":\"R1\"}");
            assertEquals("R1", e.shortName());
        }
    }

    @Nested
    @DisplayName("types")
    class Types {

        @Test
        void simpleTypeStripsNamespace() {
            assertEquals("PartUsage", Element.parse("{\"@type\":\"sysml.PartUsage\"}").simpleType());
        }

        @Test
        void missingTypeIsUnknown() {
            Element e = Element.parse("{\"@id\":\"a\"}");
            assertNull(e.type());
            assertEquals("Unknown", e.simpleType());
        }
    }

    @Nested
    @DisplayName("references")
    class References {

        @Test
        void acceptsArrayOfReferenceObjects() {
            Element e = Element.parse("{\"ownedMember\":[{\"@id\":\"m1\"},{\"@id\":\"m2\"}]}");
            assertEquals(List.of("m1", "m2"), e.ownedMemberIds());
        }

        @Test
        void acceptsSingleReferenceObjectAndBareStrings() {
            Element e = Element.parse("{\"client\":{\"@id\":\"c\"},\"supplier\":[\"s1\",\"\"]}");
            assertEquals(List.of("c"), e.references("client"));
            assertEquals(List.of("s1"), e.references("supplier"));
        }

        @Test
        void nullAndMissingKeysYieldNoReferences() {
            Element e = Element.parse("{\"ownedMember\":null}");
            assertTrue(e.ownedMemberIds().isEmpty());
            assertTrue(e.ownedFeatureIds().isEmpty());
            assertFalse(e.hasChildReferences());
        }

        @Test
        void childReferencesAreMembersThenFeaturesWithoutDuplicates() {
            Element e = Element.parse("{\"ownedMember\":[{\"@id\":\"a\"},{\"@id\":\"b\"}],"
                + "\"ownedFeature\":[{\"@id\":\"b\"},{\"@id\":\"c\"}]}");
            assertEquals(List.of("a", "b", "c"), e.childReferenceIds());
            assertTrue(e.hasChildReferences());
        }
    }

    @Test
    void equalityIgnoresKeyOrder() {
        Element a = Element.of(new JSONObject("{\"@id\":\"x\",\"name\":\"A\"}"));
        Element b = Element.of(new JSONObject("{\"name\":\"A\",\"@id\":\"x\"}"));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, Element.parse("{\"@id\":\"x\",\"name\":\"B\"}"));
    }

    @Test
    void toStringShowsNameAndType() {
        assertEquals("Motor [PartDefinition]",
            Element.parse("{\"@id\":\"m\",\"@type\":\"PartDefinition\",\"name\":\"Motor\"}").toString());
    }
}
